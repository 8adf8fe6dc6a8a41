/*
 * Where: Relay data access
 * What: Per-store transaction queue: append, read oldest pending, compare-and-swap claim
 * Why: The played flag transition is the only concurrency-critical write in the system
 */
package com.soundbox.relay.repository;

import static com.soundbox.common.JdbcTimestampUtils.toInstant;
import static com.soundbox.common.JdbcTimestampUtils.toTimestamp;

import com.soundbox.relay.model.TransactionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TransactionRepository {

  private static final String COLUMNS = "id, transaction_id, store_id, amount, played, created_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(String transactionId, String storeId, long amount, Instant createdAt) {
    final String sql =
        """
        INSERT INTO transactions (transaction_id, store_id, amount, played, created_at)
        VALUES (:transactionId, :storeId, :amount, FALSE, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("transactionId", transactionId)
            .addValue("storeId", storeId)
            .addValue("amount", amount)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public Optional<TransactionRecord> findOldestPending(String storeId) {
    final String sql =
        """
        SELECT %s
        FROM transactions
        WHERE store_id = :storeId
          AND played = FALSE
        ORDER BY id
        LIMIT 1
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("storeId", storeId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * Flips played to true only if it is still false.
   *
   * @return 1 when this caller won the row, 0 when a concurrent poll claimed it first
   */
  public int markPlayedIfPending(long id) {
    final String sql =
        """
        UPDATE transactions
        SET played = TRUE
        WHERE id = :id
          AND played = FALSE
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public List<TransactionRecord> findRecent(String storeId, Boolean played, int limit) {
    final List<String> clauses = new ArrayList<>();
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    if (storeId != null) {
      clauses.add("store_id = :storeId");
      params.addValue("storeId", storeId);
    }
    if (played != null) {
      clauses.add("played = :played");
      params.addValue("played", played);
    }
    final StringBuilder sql =
        new StringBuilder("SELECT ").append(COLUMNS).append(" FROM transactions");
    if (!clauses.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", clauses));
    }
    sql.append(" ORDER BY id DESC LIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public int deleteByStoreId(String storeId) {
    final String sql = "DELETE FROM transactions WHERE store_id = :storeId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("storeId", storeId));
  }

  private TransactionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TransactionRecord(
        rs.getLong("id"),
        rs.getString("transaction_id"),
        rs.getString("store_id"),
        rs.getLong("amount"),
        rs.getBoolean("played"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
