/*
 * Where: Relay configuration binding
 * What: Header names and shared keys for the cashier API and operator endpoints
 * Why: Keys differ per deployment and must never be hard-coded
 */
package com.soundbox.relay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "soundbox.api")
public record RelayApiProperties(
    String apiKeyHeaderName, String apiKey, String adminKeyHeaderName, String adminKey) {

  public RelayApiProperties {
    apiKeyHeaderName =
        apiKeyHeaderName == null || apiKeyHeaderName.isBlank() ? "X-Api-Key" : apiKeyHeaderName;
    apiKey = apiKey == null ? "" : apiKey;
    adminKeyHeaderName =
        adminKeyHeaderName == null || adminKeyHeaderName.isBlank()
            ? "X-Admin-Key"
            : adminKeyHeaderName;
    adminKey = adminKey == null ? "" : adminKey;
  }
}
