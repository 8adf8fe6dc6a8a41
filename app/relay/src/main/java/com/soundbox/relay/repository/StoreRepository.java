/*
 * Where: Relay data access
 * What: Reads and mutates stores rows
 * Why: Store identity, enablement and device credential gate every other operation
 */
package com.soundbox.relay.repository;

import static com.soundbox.common.JdbcTimestampUtils.toInstant;
import static com.soundbox.common.JdbcTimestampUtils.toTimestamp;

import com.soundbox.relay.model.StoreRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class StoreRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<StoreRecord> findById(String storeId) {
    final String sql =
        """
        SELECT store_id, name, device_token, enabled, created_at
        FROM stores
        WHERE store_id = :storeId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("storeId", storeId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<StoreRecord> findAll() {
    final String sql =
        """
        SELECT store_id, name, device_token, enabled, created_at
        FROM stores
        ORDER BY created_at DESC, store_id
        """;
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  public void insert(String storeId, String name, String deviceToken, Instant createdAt) {
    final String sql =
        """
        INSERT INTO stores (store_id, name, device_token, enabled, created_at)
        VALUES (:storeId, :name, :deviceToken, TRUE, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("name", name)
            .addValue("deviceToken", deviceToken)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public int updateNameAndToken(String storeId, String name, String deviceToken) {
    final String sql =
        """
        UPDATE stores
        SET name = :name,
            device_token = :deviceToken
        WHERE store_id = :storeId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("storeId", storeId)
            .addValue("name", name)
            .addValue("deviceToken", deviceToken);
    return jdbcTemplate.update(sql, params);
  }

  public int updateEnabled(String storeId, boolean enabled) {
    final String sql = "UPDATE stores SET enabled = :enabled WHERE store_id = :storeId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("storeId", storeId).addValue("enabled", enabled);
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String storeId) {
    final String sql = "DELETE FROM stores WHERE store_id = :storeId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("storeId", storeId));
  }

  private StoreRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new StoreRecord(
        rs.getString("store_id"),
        rs.getString("name"),
        rs.getString("device_token"),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
