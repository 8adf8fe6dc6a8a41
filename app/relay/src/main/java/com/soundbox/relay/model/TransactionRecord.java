/*
 * Where: Relay domain model
 * What: Snapshot of a transactions row
 * Why: id defines queue order, transactionId is what devices and cashiers see
 */
package com.soundbox.relay.model;

import java.time.Instant;

public record TransactionRecord(
    long id,
    String transactionId,
    String storeId,
    long amount,
    boolean played,
    Instant createdAt) {}
