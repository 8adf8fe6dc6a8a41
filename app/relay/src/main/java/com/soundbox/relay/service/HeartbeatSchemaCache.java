/*
 * Where: Relay service layer
 * What: Resolves the heartbeat schema once and serves it for the process lifetime
 * Why: Column discovery hits information_schema and the answer does not change while running
 */
package com.soundbox.relay.service;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.soundbox.relay.model.HeartbeatSchema;
import com.soundbox.relay.repository.HeartbeatColumnRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class HeartbeatSchemaCache {

  private static final Logger logger = LoggerFactory.getLogger(HeartbeatSchemaCache.class);

  private final HeartbeatColumnRepository columnRepository;
  private final Supplier<HeartbeatSchema> schema;

  public HeartbeatSchemaCache(HeartbeatColumnRepository columnRepository) {
    this.columnRepository = columnRepository;
    // memoize is single-flight: concurrent first callers block on one inspection
    this.schema = Suppliers.memoize(this::inspect);
  }

  public HeartbeatSchema get() {
    return schema.get();
  }

  private HeartbeatSchema inspect() {
    List<String> columns;
    try {
      columns = columnRepository.findColumnNames();
    } catch (DataAccessException ex) {
      // Cached as unusable until restart.
      logger.warn("heartbeat schema inspection failed, liveness features disabled", ex);
      columns = List.of();
    }
    final HeartbeatSchema resolved = HeartbeatSchema.fromColumns(columns);
    if (!resolved.isJoinAvailable()) {
      logger.warn("heartbeat table has no identity column columns={}", columns);
    } else {
      logger.info(
          "heartbeat schema resolved identity={} lastSeen={} ipAddress={} firmwareVersion={}",
          resolved.identityColumn(),
          resolved.lastSeen(),
          resolved.ipAddress(),
          resolved.firmwareVersion());
    }
    return resolved;
  }
}
