/*
 * Where: Relay configuration binding
 * What: Attempt budget of the transaction claim loop
 * Why: Trades starvation risk against poll latency, so operators may tune it
 */
package com.soundbox.relay.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "soundbox.claim")
@Validated
public record ClaimProperties(@Positive Integer maxAttempts) {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  public ClaimProperties {
    maxAttempts = maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
  }
}
