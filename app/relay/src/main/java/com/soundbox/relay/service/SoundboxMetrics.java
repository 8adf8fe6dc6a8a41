/*
 * Where: Relay service layer
 * What: Application metrics for transaction flow, heartbeats and offline alerts
 * Why: Claim contention and alert delivery are observable from Prometheus
 */
package com.soundbox.relay.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class SoundboxMetrics {

  public static final String CLAIM_CLAIMED = "claimed";
  public static final String CLAIM_EMPTY = "empty";
  public static final String CLAIM_EXHAUSTED = "exhausted";
  public static final String ALERT_SENT = "sent";
  public static final String ALERT_FAILED = "failed";

  private static final String METRIC_TRANSACTION_CREATED_TOTAL = "soundbox.transaction.created.total";
  private static final String METRIC_CLAIM_TOTAL = "soundbox.claim.total";
  private static final String METRIC_HEARTBEAT_FAILURE_TOTAL = "soundbox.heartbeat.failure.total";
  private static final String METRIC_OFFLINE_ALERT_TOTAL = "soundbox.offline_alert.total";

  private final MeterRegistry meterRegistry;
  private final Counter transactionCreatedCounter;
  private final Counter heartbeatFailureCounter;
  private final ConcurrentMap<String, Counter> claimCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> alertCounters = new ConcurrentHashMap<>();

  public SoundboxMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.transactionCreatedCounter =
        Counter.builder(METRIC_TRANSACTION_CREATED_TOTAL)
            .description("Transactions accepted from the cashier integration")
            .register(meterRegistry);
    this.heartbeatFailureCounter =
        Counter.builder(METRIC_HEARTBEAT_FAILURE_TOTAL)
            .description("Heartbeat writes that failed and were skipped")
            .register(meterRegistry);
  }

  public void recordTransactionCreated() {
    transactionCreatedCounter.increment();
  }

  public void recordClaimResult(String result) {
    claimCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CLAIM_TOTAL)
                    .description("Device poll outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordHeartbeatFailure() {
    heartbeatFailureCounter.increment();
  }

  public void recordOfflineAlert(String result) {
    alertCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_OFFLINE_ALERT_TOTAL)
                    .description("Offline alert delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
