/*
 * Where: Relay service layer
 * What: Accepts payment confirmations into the per-store queue
 */
package com.soundbox.relay.service;

import com.soundbox.common.OpaqueIds;
import com.soundbox.relay.api.StoreUnavailableException;
import com.soundbox.relay.model.StoreRecord;
import com.soundbox.relay.repository.StoreRepository;
import com.soundbox.relay.repository.TransactionRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TransactionService {

  private static final Logger logger = LoggerFactory.getLogger(TransactionService.class);

  private final StoreRepository storeRepository;
  private final TransactionRepository transactionRepository;
  private final SoundboxMetrics metrics;
  private final Clock clock;

  /**
   * Appends a pending transaction for an enabled store.
   *
   * @return the generated transaction id
   * @throws StoreUnavailableException when the store is unknown or disabled
   * @throws IllegalArgumentException when amount is not positive
   */
  public String create(String storeId, long amount) {
    if (storeId == null || storeId.isBlank()) {
      throw new IllegalArgumentException("store_id is required");
    }
    final StoreRecord store =
        storeRepository
            .findById(storeId)
            .filter(StoreRecord::enabled)
            .orElseThrow(() -> new StoreUnavailableException(storeId));
    if (amount <= 0) {
      throw new IllegalArgumentException("amount must be positive");
    }
    final String transactionId = OpaqueIds.newTransactionId();
    transactionRepository.insert(transactionId, store.storeId(), amount, Instant.now(clock));
    metrics.recordTransactionCreated();
    logger.info(
        "transaction created transactionId={} storeId={} amount={}",
        transactionId,
        store.storeId(),
        amount);
    return transactionId;
  }
}
