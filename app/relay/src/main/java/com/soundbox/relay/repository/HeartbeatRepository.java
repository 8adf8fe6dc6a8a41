/*
 * Where: Relay data access
 * What: Writes and reads the liveness table through a resolved HeartbeatSchema
 * Why: Only columns the deployment actually has may appear in the generated SQL
 */
package com.soundbox.relay.repository;

import static com.soundbox.common.JdbcTimestampUtils.toInstant;
import static com.soundbox.common.JdbcTimestampUtils.toTimestamp;

import com.soundbox.relay.config.HeartbeatProperties;
import com.soundbox.relay.model.DeviceReport;
import com.soundbox.relay.model.DeviceStatusRecord;
import com.soundbox.relay.model.HeartbeatSchema;
import com.soundbox.relay.model.StaleDevice;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class HeartbeatRepository {

  private static final String STORE_ALIAS = "s";
  private static final String HEARTBEAT_ALIAS = "h";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final HeartbeatProperties properties;

  /**
   * Updates the row keyed by {@code identity}, inserting it when no row matched.
   *
   * <p>Last writer wins; a concurrent first insert for the same device keeps the other writer's
   * values.
   */
  public void upsert(
      HeartbeatSchema schema, String identity, String storeId, Instant seenAt, DeviceReport report) {
    final String keyColumn =
        schema
            .identityColumn()
            .columnName()
            .orElseThrow(() -> new IllegalArgumentException("heartbeat identity column unavailable"));
    final String table = properties.tableName();
    final List<String> columns = new ArrayList<>();
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("identity", identity, Types.VARCHAR);
    if (schema.lastSeen()) {
      columns.add(HeartbeatSchema.LAST_SEEN);
      params.addValue(HeartbeatSchema.LAST_SEEN, toTimestamp(seenAt), Types.TIMESTAMP);
    }
    if (schema.ipAddress()) {
      columns.add(HeartbeatSchema.IP_ADDRESS);
      params.addValue(HeartbeatSchema.IP_ADDRESS, report.ipAddress(), Types.VARCHAR);
    }
    if (schema.firmwareVersion()) {
      columns.add(HeartbeatSchema.FIRMWARE_VERSION);
      params.addValue(HeartbeatSchema.FIRMWARE_VERSION, report.firmwareVersion(), Types.VARCHAR);
    }
    if (schema.writesStoreIdValue()) {
      columns.add(HeartbeatSchema.STORE_ID);
      params.addValue(HeartbeatSchema.STORE_ID, storeId, Types.VARCHAR);
    }

    if (!columns.isEmpty()) {
      final String assignments =
          columns.stream().map(c -> c + " = :" + c).collect(Collectors.joining(", "));
      final String update =
          "UPDATE " + table + " SET " + assignments + " WHERE " + keyColumn + " = :identity";
      if (jdbcTemplate.update(update, params) > 0) {
        return;
      }
    }
    final String insertColumns =
        columns.stream().map(c -> ", " + c).collect(Collectors.joining());
    final String insertValues =
        columns.stream().map(c -> ", :" + c).collect(Collectors.joining());
    final String insert =
        "INSERT INTO "
            + table
            + " ("
            + keyColumn
            + insertColumns
            + ") VALUES (:identity"
            + insertValues
            + ") ON CONFLICT DO NOTHING";
    jdbcTemplate.update(insert, params);
  }

  /** Enabled stores whose device was last seen strictly between the two instants. */
  public List<StaleDevice> findStaleDevices(
      HeartbeatSchema schema, Instant seenBefore, Instant seenAfter) {
    final Optional<String> predicate = joinPredicate(schema);
    if (predicate.isEmpty() || !schema.lastSeen()) {
      return List.of();
    }
    final String sql =
        """
        SELECT s.store_id, s.name, h.last_seen
        FROM stores s
        JOIN %s h ON %s
        WHERE s.enabled = TRUE
          AND h.last_seen < :seenBefore
          AND h.last_seen > :seenAfter
        ORDER BY h.last_seen
        """
            .formatted(properties.tableName(), predicate.get());
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("seenBefore", toTimestamp(seenBefore))
            .addValue("seenAfter", toTimestamp(seenAfter));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new StaleDevice(
                rs.getString("store_id"),
                rs.getString("name"),
                toInstant(rs.getTimestamp("last_seen"))));
  }

  /** Every store, with null liveness fields wherever the schema cannot supply them. */
  public List<DeviceStatusRecord> findDeviceStatuses(HeartbeatSchema schema) {
    final Optional<String> predicate = joinPredicate(schema);
    final boolean joined = predicate.isPresent();
    final StringBuilder sql =
        new StringBuilder("SELECT s.store_id, s.name, s.enabled, ")
            .append(selectColumn(joined && schema.lastSeen(), HeartbeatSchema.LAST_SEEN))
            .append(", ")
            .append(selectColumn(joined && schema.ipAddress(), HeartbeatSchema.IP_ADDRESS))
            .append(", ")
            .append(
                selectColumn(joined && schema.firmwareVersion(), HeartbeatSchema.FIRMWARE_VERSION))
            .append(" FROM stores s");
    predicate.ifPresent(
        p -> sql.append(" LEFT JOIN ").append(properties.tableName()).append(" h ON ").append(p));
    sql.append(" ORDER BY s.created_at DESC, s.store_id");
    return jdbcTemplate.query(sql.toString(), new MapSqlParameterSource(), this::mapStatus);
  }

  private Optional<String> joinPredicate(HeartbeatSchema schema) {
    return schema.identityColumn().joinPredicate(STORE_ALIAS, HEARTBEAT_ALIAS);
  }

  private String selectColumn(boolean available, String column) {
    return available ? HEARTBEAT_ALIAS + "." + column : "NULL AS " + column;
  }

  private DeviceStatusRecord mapStatus(ResultSet rs, int rowNum) throws SQLException {
    return new DeviceStatusRecord(
        rs.getString("store_id"),
        rs.getString("name"),
        rs.getBoolean("enabled"),
        toInstant(rs.getTimestamp(HeartbeatSchema.LAST_SEEN)),
        rs.getString(HeartbeatSchema.IP_ADDRESS),
        rs.getString(HeartbeatSchema.FIRMWARE_VERSION));
  }
}
