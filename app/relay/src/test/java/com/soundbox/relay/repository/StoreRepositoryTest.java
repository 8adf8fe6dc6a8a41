package com.soundbox.relay.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.soundbox.relay.AbstractPostgresContainerTest;
import com.soundbox.relay.model.StoreRecord;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class StoreRepositoryTest extends AbstractPostgresContainerTest {

  @Autowired private StoreRepository storeRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM stores", new MapSqlParameterSource());
  }

  @Test
  void insertedStoreIsEnabledAndListedNewestFirst() {
    storeRepository.insert("S1", "Warung A", "tok-1", Instant.parse("2026-03-01T00:00:00Z"));
    storeRepository.insert("S2", "Warung B", "tok-2", Instant.parse("2026-03-02T00:00:00Z"));

    assertThat(storeRepository.findById("S1"))
        .get()
        .satisfies(
            store -> {
              assertThat(store.enabled()).isTrue();
              assertThat(store.deviceToken()).isEqualTo("tok-1");
            });
    assertThat(storeRepository.findAll())
        .extracting(StoreRecord::storeId)
        .containsExactly("S2", "S1");
  }

  @Test
  void updatesReportAffectedRows() {
    storeRepository.insert("S1", "Warung A", "tok-1", Instant.parse("2026-03-01T00:00:00Z"));

    assertThat(storeRepository.updateNameAndToken("S1", "Warung Baru", "tok-2")).isEqualTo(1);
    assertThat(storeRepository.updateEnabled("S1", false)).isEqualTo(1);
    assertThat(storeRepository.updateEnabled("missing", false)).isZero();

    final StoreRecord updated = storeRepository.findById("S1").orElseThrow();
    assertThat(updated.name()).isEqualTo("Warung Baru");
    assertThat(updated.deviceToken()).isEqualTo("tok-2");
    assertThat(updated.enabled()).isFalse();

    assertThat(storeRepository.delete("S1")).isEqualTo(1);
    assertThat(storeRepository.delete("S1")).isZero();
    assertThat(storeRepository.findById("S1")).isEmpty();
  }
}
