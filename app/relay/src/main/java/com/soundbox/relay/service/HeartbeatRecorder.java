/*
 * Where: Relay service layer
 * What: Records that a device polled, through whatever columns the liveness table has
 * Why: Offline alerts and the device listing read what is written here
 */
package com.soundbox.relay.service;

import com.soundbox.relay.model.DeviceReport;
import com.soundbox.relay.model.HeartbeatSchema;
import com.soundbox.relay.repository.HeartbeatRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HeartbeatRecorder {

  private static final Logger logger = LoggerFactory.getLogger(HeartbeatRecorder.class);

  private final HeartbeatSchemaCache schemaCache;
  private final HeartbeatRepository heartbeatRepository;
  private final Clock clock;

  /**
   * Upserts the heartbeat row of an authenticated device.
   *
   * <p>Storage failures propagate; callers decide whether they are fatal.
   */
  public void record(String storeId, String deviceToken, DeviceReport report) {
    final HeartbeatSchema schema = schemaCache.get();
    final Optional<String> identity =
        schema.identityColumn().identityValue(storeId, deviceToken);
    if (identity.isEmpty()) {
      logger.debug("heartbeat skipped, no identity column storeId={}", storeId);
      return;
    }
    final Instant now = Instant.now(clock);
    heartbeatRepository.upsert(
        schema, identity.get(), storeId, now, report == null ? DeviceReport.empty() : report);
  }
}
