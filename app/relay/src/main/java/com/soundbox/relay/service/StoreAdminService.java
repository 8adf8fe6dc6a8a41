/*
 * Where: Relay service layer
 * What: Operator maintenance of the store registry
 * Why: Store enablement and device tokens gate both cashier and device traffic
 */
package com.soundbox.relay.service;

import com.soundbox.common.OpaqueIds;
import com.soundbox.relay.api.StoreNotFoundException;
import com.soundbox.relay.model.StoreRecord;
import com.soundbox.relay.repository.StoreRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class StoreAdminService {

  private static final Logger logger = LoggerFactory.getLogger(StoreAdminService.class);
  private static final Pattern STORE_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private final StoreRepository storeRepository;
  private final Clock clock;

  public List<StoreRecord> listStores() {
    return storeRepository.findAll();
  }

  /**
   * Creates the store, or renames an existing one.
   *
   * <p>The device token is the supplied one when non-blank, otherwise the store keeps its current
   * token, otherwise a fresh token is generated.
   */
  public StoreRecord upsert(String storeId, String name, String deviceToken) {
    final String id = trimToEmpty(storeId);
    final String trimmedName = trimToEmpty(name);
    if (id.isEmpty() || trimmedName.isEmpty()) {
      throw new IllegalArgumentException("store_id and name required");
    }
    if (!STORE_ID_PATTERN.matcher(id).matches()) {
      throw new IllegalArgumentException("store_id has invalid characters");
    }
    final Optional<StoreRecord> existing = storeRepository.findById(id);
    final String suppliedToken = trimToEmpty(deviceToken);
    final String token;
    if (!suppliedToken.isEmpty()) {
      token = suppliedToken;
    } else if (existing.isPresent()) {
      token = existing.get().deviceToken();
    } else {
      token = OpaqueIds.newDeviceToken();
    }

    if (existing.isPresent()) {
      storeRepository.updateNameAndToken(id, trimmedName, token);
      logger.info("store updated storeId={} tokenRotated={}", id, !suppliedToken.isEmpty());
    } else {
      storeRepository.insert(id, trimmedName, token, Instant.now(clock));
      logger.info("store created storeId={}", id);
    }
    return storeRepository.findById(id).orElseThrow(() -> new StoreNotFoundException(id));
  }

  public void enable(String storeId) {
    setEnabled(storeId, true);
  }

  public void disable(String storeId) {
    setEnabled(storeId, false);
  }

  /** Deletes the store row only; its transactions and heartbeat rows are left in place. */
  public void delete(String storeId) {
    final String id = trimToEmpty(storeId);
    if (storeRepository.delete(id) == 0) {
      throw new StoreNotFoundException(id);
    }
    logger.info("store deleted storeId={}", id);
  }

  private void setEnabled(String storeId, boolean enabled) {
    final String id = trimToEmpty(storeId);
    if (storeRepository.updateEnabled(id, enabled) == 0) {
      throw new StoreNotFoundException(id);
    }
    logger.info("store enablement changed storeId={} enabled={}", id, enabled);
  }

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
