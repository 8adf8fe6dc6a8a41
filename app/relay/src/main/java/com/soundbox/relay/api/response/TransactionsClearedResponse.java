/*
 * Where: Relay API response
 * What: Result of clearing a store's queue
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionsClearedResponse(String storeId, int deleted) {}
