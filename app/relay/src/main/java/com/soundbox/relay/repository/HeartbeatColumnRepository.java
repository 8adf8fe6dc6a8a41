/*
 * Where: Relay data access
 * What: Lists the column names of the liveness table
 * Why: The heartbeat schema is discovered at runtime instead of being assumed
 */
package com.soundbox.relay.repository;

import com.soundbox.relay.config.HeartbeatProperties;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class HeartbeatColumnRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final HeartbeatProperties properties;

  /** Empty when the table does not exist in the current schema. */
  public List<String> findColumnNames() {
    final String sql =
        """
        SELECT column_name
        FROM information_schema.columns
        WHERE table_schema = current_schema()
          AND table_name = :tableName
        ORDER BY ordinal_position
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("tableName", properties.tableName());
    return jdbcTemplate.queryForList(sql, params, String.class);
  }
}
