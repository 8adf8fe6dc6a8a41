/*
 * Where: Relay configuration binding
 * What: Schedule and liveness window of the offline alert scan
 * Why: The stale threshold and the suppression ceiling bound which devices are alerted
 */
package com.soundbox.relay.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "soundbox.offline-alert")
@Validated
public record OfflineAlertProperties(
    boolean enabled,
    Duration checkInterval,
    Duration staleThreshold,
    Duration suppressionCeiling,
    @Positive Integer dispatchThreads) {

  public OfflineAlertProperties {
    checkInterval = checkInterval == null ? Duration.ofMinutes(5) : checkInterval;
    staleThreshold = staleThreshold == null ? Duration.ofMinutes(30) : staleThreshold;
    suppressionCeiling = suppressionCeiling == null ? Duration.ofHours(24) : suppressionCeiling;
    dispatchThreads = dispatchThreads == null ? 2 : dispatchThreads;
  }

  @AssertTrue(message = "soundbox.offline-alert.stale-threshold must be positive")
  public boolean isStaleThresholdPositive() {
    return !staleThreshold.isZero() && !staleThreshold.isNegative();
  }

  @AssertTrue(
      message = "soundbox.offline-alert.suppression-ceiling must exceed the stale threshold")
  public boolean isSuppressionCeilingAboveThreshold() {
    // An empty window would silently disable alerting.
    return suppressionCeiling.compareTo(staleThreshold) > 0;
  }
}
