/*
 * Where: Relay service layer
 * What: Finds devices that stopped polling and dispatches one alert per device
 * Why: Operators learn about a silent soundbox before the merchant misses a payment
 */
package com.soundbox.relay.service;

import com.soundbox.relay.config.OfflineAlertProperties;
import com.soundbox.relay.model.HeartbeatSchema;
import com.soundbox.relay.model.OfflineAlert;
import com.soundbox.relay.model.StaleDevice;
import com.soundbox.relay.repository.HeartbeatRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class OfflineAlertService {

  private static final Logger logger = LoggerFactory.getLogger(OfflineAlertService.class);

  private final HeartbeatSchemaCache schemaCache;
  private final HeartbeatRepository heartbeatRepository;
  private final OfflineAlertSender sender;
  private final OfflineAlertProperties properties;
  private final SoundboxMetrics metrics;
  private final Clock clock;
  private final Executor executor;

  public OfflineAlertService(
      HeartbeatSchemaCache schemaCache,
      HeartbeatRepository heartbeatRepository,
      OfflineAlertSender sender,
      OfflineAlertProperties properties,
      SoundboxMetrics metrics,
      Clock clock,
      @Qualifier("offlineAlertExecutor") Executor executor) {
    this.schemaCache = schemaCache;
    this.heartbeatRepository = heartbeatRepository;
    this.sender = sender;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.executor = executor;
  }

  /**
   * Runs one scan.
   *
   * <p>A device is alerted when its last heartbeat is older than the stale threshold but newer
   * than the suppression ceiling, so a long-dead device stops producing alerts. Delivery is
   * fire-and-forget on the dispatch executor.
   *
   * @return number of alerts handed to the executor
   */
  public int dispatchOfflineAlerts() {
    final HeartbeatSchema schema = schemaCache.get();
    if (!schema.isJoinAvailable() || !schema.lastSeen()) {
      logger.info(
          "offline alert scan skipped, heartbeat schema unusable identity={} lastSeen={}",
          schema.identityColumn(),
          schema.lastSeen());
      return 0;
    }
    final Instant now = Instant.now(clock);
    final List<StaleDevice> stale;
    try {
      stale =
          heartbeatRepository.findStaleDevices(
              schema,
              now.minus(properties.staleThreshold()),
              now.minus(properties.suppressionCeiling()));
    } catch (DataAccessException ex) {
      logger.error("offline alert scan query failed", ex);
      return 0;
    }

    int dispatched = 0;
    for (StaleDevice device : stale) {
      final long minutes = Duration.between(device.lastSeen(), now).toMinutes();
      final OfflineAlert alert = new OfflineAlert(device.storeId(), device.storeName(), minutes);
      try {
        executor.execute(() -> deliver(alert));
        dispatched++;
      } catch (RejectedExecutionException ex) {
        metrics.recordOfflineAlert(SoundboxMetrics.ALERT_FAILED);
        logger.warn("offline alert dispatch rejected storeId={}", alert.storeId(), ex);
      }
    }
    logger.info("offline alert scan finished alerted={}", dispatched);
    return dispatched;
  }

  private void deliver(OfflineAlert alert) {
    try {
      sender.send(alert);
      metrics.recordOfflineAlert(SoundboxMetrics.ALERT_SENT);
    } catch (RuntimeException ex) {
      metrics.recordOfflineAlert(SoundboxMetrics.ALERT_FAILED);
      logger.warn(
          "offline alert delivery failed storeId={} minutesOffline={}",
          alert.storeId(),
          alert.minutesOffline(),
          ex);
    }
  }
}
