/*
 * Where: Relay repository tests
 * What: Queue ordering, compare-and-swap claim and operator listing against Postgres
 */
package com.soundbox.relay.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.soundbox.relay.AbstractPostgresContainerTest;
import com.soundbox.relay.model.TransactionRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class TransactionRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  @Autowired private TransactionRepository transactionRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM transactions", new MapSqlParameterSource());
  }

  @Test
  void findOldestPendingReturnsLowestIdOfTheStore() {
    transactionRepository.insert("tx-a", "S1", 100L, NOW);
    transactionRepository.insert("tx-b", "S1", 200L, NOW);
    transactionRepository.insert("tx-other", "S2", 300L, NOW);

    final TransactionRecord oldest = transactionRepository.findOldestPending("S1").orElseThrow();

    assertThat(oldest.transactionId()).isEqualTo("tx-a");
    assertThat(oldest.amount()).isEqualTo(100L);
    assertThat(oldest.played()).isFalse();
    assertThat(oldest.createdAt()).isEqualTo(NOW);
  }

  @Test
  void markPlayedIfPendingSucceedsOnlyOnce() {
    transactionRepository.insert("tx-a", "S1", 100L, NOW);
    final long id = transactionRepository.findOldestPending("S1").orElseThrow().id();

    assertThat(transactionRepository.markPlayedIfPending(id)).isEqualTo(1);
    assertThat(transactionRepository.markPlayedIfPending(id)).isZero();
    assertThat(transactionRepository.findOldestPending("S1")).isEmpty();
  }

  @Test
  void findRecentFiltersAndOrdersNewestFirst() {
    transactionRepository.insert("tx-1", "S1", 100L, NOW);
    transactionRepository.insert("tx-2", "S1", 200L, NOW);
    transactionRepository.insert("tx-3", "S2", 300L, NOW);
    transactionRepository.markPlayedIfPending(
        transactionRepository.findOldestPending("S1").orElseThrow().id());

    final List<TransactionRecord> all = transactionRepository.findRecent(null, null, 10);
    final List<TransactionRecord> pendingS1 = transactionRepository.findRecent("S1", false, 10);
    final List<TransactionRecord> playedS1 = transactionRepository.findRecent("S1", true, 10);
    final List<TransactionRecord> limited = transactionRepository.findRecent(null, null, 1);

    assertThat(all).extracting(TransactionRecord::transactionId)
        .containsExactly("tx-3", "tx-2", "tx-1");
    assertThat(pendingS1).extracting(TransactionRecord::transactionId).containsExactly("tx-2");
    assertThat(playedS1).extracting(TransactionRecord::transactionId).containsExactly("tx-1");
    assertThat(limited).extracting(TransactionRecord::transactionId).containsExactly("tx-3");
  }

  @Test
  void deleteByStoreIdLeavesOtherStores() {
    transactionRepository.insert("tx-1", "S1", 100L, NOW);
    transactionRepository.insert("tx-2", "S1", 200L, NOW);
    transactionRepository.insert("tx-3", "S2", 300L, NOW);

    assertThat(transactionRepository.deleteByStoreId("S1")).isEqualTo(2);
    assertThat(transactionRepository.findRecent(null, null, 10))
        .extracting(TransactionRecord::storeId)
        .containsExactly("S2");
  }
}
