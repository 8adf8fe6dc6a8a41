/*
 * Where: Relay API response
 * What: Poll result; only available is present when nothing was claimed
 */
package com.soundbox.relay.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.soundbox.relay.model.TransactionRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NextTransactionResponse(
    boolean available, String transactionId, Long amount, String storeId) {

  public static NextTransactionResponse unavailable() {
    return new NextTransactionResponse(false, null, null, null);
  }

  public static NextTransactionResponse from(TransactionRecord record) {
    return new NextTransactionResponse(
        true, record.transactionId(), record.amount(), record.storeId());
  }
}
