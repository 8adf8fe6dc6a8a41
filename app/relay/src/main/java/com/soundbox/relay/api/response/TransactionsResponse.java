/*
 * Where: Relay API response
 * What: Transaction listing
 */
package com.soundbox.relay.api.response;

import java.util.List;

public record TransactionsResponse(List<TransactionSummary> transactions) {}
