/*
 * Where: Relay API response
 * What: Transaction row in the operator listing
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.soundbox.relay.model.TransactionRecord;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TransactionSummary(
    long id,
    String transactionId,
    String storeId,
    long amount,
    boolean played,
    Instant createdAt) {

  public static TransactionSummary from(TransactionRecord record) {
    return new TransactionSummary(
        record.id(),
        record.transactionId(),
        record.storeId(),
        record.amount(),
        record.played(),
        record.createdAt());
  }
}
