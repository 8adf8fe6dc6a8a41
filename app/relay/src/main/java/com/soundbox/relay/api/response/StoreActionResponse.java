/*
 * Where: Relay API response
 * What: Acknowledges an operator action on a single store
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreActionResponse(String storeId, boolean ok) {}
