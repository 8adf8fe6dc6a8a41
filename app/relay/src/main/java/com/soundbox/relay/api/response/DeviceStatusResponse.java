/*
 * Where: Relay API response
 * What: Store with the liveness its heartbeat row reports
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.soundbox.relay.model.DeviceStatusRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeviceStatusResponse(
    String storeId,
    String name,
    boolean enabled,
    Instant lastSeen,
    String ipAddress,
    String firmwareVersion) {

  public static DeviceStatusResponse from(DeviceStatusRecord record) {
    return new DeviceStatusResponse(
        record.storeId(),
        record.name(),
        record.enabled(),
        record.lastSeen(),
        record.ipAddress(),
        record.firmwareVersion());
  }
}
