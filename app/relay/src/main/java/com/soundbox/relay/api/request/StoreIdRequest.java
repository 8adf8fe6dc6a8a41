/*
 * Where: Relay admin API request
 * What: Body of the single-store operator actions
 */
package com.soundbox.relay.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StoreIdRequest(@NotBlank(message = "store_id required") String storeId) {}
