/*
 * Where: Relay service layer
 * What: Hands the oldest pending transaction of a store to exactly one polling device
 * Why: Several devices may poll the same store concurrently and each payment must play at most once
 */
package com.soundbox.relay.service;

import com.soundbox.relay.api.DeviceUnauthorizedException;
import com.soundbox.relay.api.StoreUnavailableException;
import com.soundbox.relay.config.ClaimProperties;
import com.soundbox.relay.model.DeviceReport;
import com.soundbox.relay.model.StoreRecord;
import com.soundbox.relay.model.TransactionRecord;
import com.soundbox.relay.repository.StoreRepository;
import com.soundbox.relay.repository.TransactionRepository;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TransactionClaimService {

  private static final Logger logger = LoggerFactory.getLogger(TransactionClaimService.class);

  private final StoreRepository storeRepository;
  private final TransactionRepository transactionRepository;
  private final HeartbeatRecorder heartbeatRecorder;
  private final ClaimProperties claimProperties;
  private final SoundboxMetrics metrics;

  /**
   * Authenticates the device, records its heartbeat and claims the next transaction.
   *
   * <p>Claiming is a read of the oldest pending row followed by a conditional update that only
   * succeeds while the row is still pending. Losing that race moves on to the next row, up to the
   * configured attempt budget; an exhausted budget is reported as "nothing available" and the
   * device simply polls again.
   *
   * @return the claimed transaction, or empty when none is pending or every attempt lost its race
   * @throws StoreUnavailableException when the store is unknown or disabled
   * @throws DeviceUnauthorizedException when the credential does not match the store
   */
  public Optional<TransactionRecord> claimNext(
      String storeId, String deviceToken, DeviceReport report) {
    final StoreRecord store =
        storeRepository
            .findById(storeId)
            .filter(StoreRecord::enabled)
            .orElseThrow(() -> new StoreUnavailableException(storeId));
    final String presented = deviceToken == null ? "" : deviceToken.trim();
    if (presented.isEmpty() || !tokenMatches(presented, store.deviceToken())) {
      logger.info("device credential rejected storeId={}", storeId);
      throw new DeviceUnauthorizedException();
    }

    try {
      heartbeatRecorder.record(store.storeId(), presented, report);
    } catch (RuntimeException ex) {
      metrics.recordHeartbeatFailure();
      logger.warn("heartbeat write failed storeId={}", store.storeId(), ex);
    }

    final int maxAttempts = claimProperties.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      final Optional<TransactionRecord> pending =
          transactionRepository.findOldestPending(store.storeId());
      if (pending.isEmpty()) {
        metrics.recordClaimResult(SoundboxMetrics.CLAIM_EMPTY);
        return Optional.empty();
      }
      final TransactionRecord candidate = pending.get();
      if (transactionRepository.markPlayedIfPending(candidate.id()) == 1) {
        metrics.recordClaimResult(SoundboxMetrics.CLAIM_CLAIMED);
        logger.info(
            "transaction claimed transactionId={} storeId={} attempt={}",
            candidate.transactionId(),
            store.storeId(),
            attempt);
        return Optional.of(candidate);
      }
      logger.debug(
          "claim race lost transactionId={} storeId={} attempt={}",
          candidate.transactionId(),
          store.storeId(),
          attempt);
    }
    metrics.recordClaimResult(SoundboxMetrics.CLAIM_EXHAUSTED);
    logger.info("claim attempts exhausted storeId={} maxAttempts={}", store.storeId(), maxAttempts);
    return Optional.empty();
  }

  private boolean tokenMatches(String presented, String expected) {
    if (expected == null) {
      return false;
    }
    return MessageDigest.isEqual(
        presented.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }
}
