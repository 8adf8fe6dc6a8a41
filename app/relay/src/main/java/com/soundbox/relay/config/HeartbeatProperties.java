/*
 * Where: Relay configuration binding
 * What: Name of the liveness table
 * Why: The name is spliced into SQL, so it is restricted to a plain identifier
 */
package com.soundbox.relay.config;

import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "soundbox.heartbeat")
public record HeartbeatProperties(String tableName) {

  private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public HeartbeatProperties {
    tableName = tableName == null || tableName.isBlank() ? "device_heartbeat" : tableName;
    if (!IDENTIFIER.matcher(tableName).matches()) {
      throw new IllegalArgumentException(
          "soundbox.heartbeat.table-name must be a plain identifier: " + tableName);
    }
    // unquoted identifiers are folded to lower case by Postgres
    tableName = tableName.toLowerCase(Locale.ROOT);
  }
}
