/*
 * Where: Relay API response
 * What: Store as shown to operators, device token included
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.soundbox.relay.model.StoreRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreResponse(
    String storeId, String name, String deviceToken, boolean enabled, Instant createdAt) {

  public static StoreResponse from(StoreRecord record) {
    return new StoreResponse(
        record.storeId(),
        record.name(),
        record.deviceToken(),
        record.enabled(),
        record.createdAt());
  }
}
