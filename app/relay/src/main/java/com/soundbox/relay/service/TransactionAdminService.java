/*
 * Where: Relay service layer
 * What: Operator view and cleanup of the transaction queue
 */
package com.soundbox.relay.service;

import com.google.common.annotations.VisibleForTesting;
import com.soundbox.relay.model.TransactionRecord;
import com.soundbox.relay.repository.TransactionRepository;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TransactionAdminService {

  private static final Logger logger = LoggerFactory.getLogger(TransactionAdminService.class);

  static final int DEFAULT_LIMIT = 50;
  static final int MAX_LIMIT = 200;

  private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

  private final TransactionRepository transactionRepository;

  /**
   * Newest transactions first.
   *
   * @param storeId optional store filter
   * @param played raw filter value; only "0" and "1" filter, anything else is ignored
   * @param limit raw limit; values without leading digits fall back to the default, others are
   *     clamped
   */
  public List<TransactionRecord> listRecent(String storeId, String played, String limit) {
    final String store = storeId == null || storeId.isBlank() ? null : storeId.trim();
    return transactionRepository.findRecent(store, parsePlayed(played), resolveLimit(limit));
  }

  /** @return number of deleted transactions */
  public int clear(String storeId) {
    if (storeId == null || storeId.isBlank()) {
      throw new IllegalArgumentException("store_id required");
    }
    final int deleted = transactionRepository.deleteByStoreId(storeId.trim());
    logger.info("transactions cleared storeId={} deleted={}", storeId.trim(), deleted);
    return deleted;
  }

  @VisibleForTesting
  static Boolean parsePlayed(String played) {
    if ("1".equals(played)) {
      return Boolean.TRUE;
    }
    if ("0".equals(played)) {
      return Boolean.FALSE;
    }
    return null;
  }

  /** Reads the leading integer of the raw value, so "12abc" yields 12. */
  @VisibleForTesting
  static int resolveLimit(String limit) {
    if (limit == null) {
      return DEFAULT_LIMIT;
    }
    final Matcher matcher = LEADING_INTEGER.matcher(limit);
    if (!matcher.find()) {
      return DEFAULT_LIMIT;
    }
    final String digits = matcher.group(1);
    long parsed;
    try {
      parsed = Long.parseLong(digits);
    } catch (NumberFormatException ex) {
      parsed = digits.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
    return (int) Math.max(1, Math.min(MAX_LIMIT, parsed));
  }
}
