/*
 * Where: Relay API response
 * What: Id of the accepted transaction
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateTransactionResponse(String transactionId) {}
