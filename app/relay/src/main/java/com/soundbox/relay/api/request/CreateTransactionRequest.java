/*
 * Where: Relay API request
 * What: Cashier payment confirmation
 * Why: amount is in the smallest currency unit and must be positive
 */
package com.soundbox.relay.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateTransactionRequest(
    @NotBlank(message = "store_id is required") String storeId,
    @NotNull(message = "amount is required") @Positive(message = "amount must be positive")
        Long amount) {}
