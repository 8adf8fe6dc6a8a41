/*
 * Where: Relay heartbeat schema model
 * What: Capabilities of the liveness table discovered at runtime
 * Why: Deployments apply different migrations, so columns are resolved rather than assumed
 */
package com.soundbox.relay.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

public record HeartbeatSchema(
    HeartbeatIdentityColumn identityColumn,
    boolean lastSeen,
    boolean ipAddress,
    boolean firmwareVersion,
    boolean storeId) {

  public static final String LAST_SEEN = "last_seen";
  public static final String IP_ADDRESS = "ip_address";
  public static final String FIRMWARE_VERSION = "firmware_version";
  public static final String STORE_ID = "store_id";

  public static HeartbeatSchema unavailable() {
    return new HeartbeatSchema(HeartbeatIdentityColumn.NONE, false, false, false, false);
  }

  /** Resolves the descriptor from a column-name set; the first identity candidate present wins. */
  public static HeartbeatSchema fromColumns(Collection<String> columnNames) {
    final Set<String> columns =
        columnNames.stream()
            .map(name -> name.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    final HeartbeatIdentityColumn identity =
        Arrays.stream(HeartbeatIdentityColumn.values())
            .filter(candidate -> candidate.columnName().map(columns::contains).orElse(false))
            .findFirst()
            .orElse(HeartbeatIdentityColumn.NONE);
    return new HeartbeatSchema(
        identity,
        columns.contains(LAST_SEEN),
        columns.contains(IP_ADDRESS),
        columns.contains(FIRMWARE_VERSION),
        columns.contains(STORE_ID));
  }

  public boolean isJoinAvailable() {
    return identityColumn != HeartbeatIdentityColumn.NONE;
  }

  /** store_id is written as a plain value only when it is not already the key. */
  public boolean writesStoreIdValue() {
    return storeId && identityColumn != HeartbeatIdentityColumn.STORE_ID;
  }
}
