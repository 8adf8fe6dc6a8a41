/*
 * Where: Relay heartbeat schema model
 * What: Identity column the liveness table exposes, in preference order
 * Why: Join and upsert logic branch exhaustively on the resolved variant
 */
package com.soundbox.relay.model;

import java.util.Optional;

public enum HeartbeatIdentityColumn {
  DEVICE_TOKEN("device_token"),
  DEVICE_ID("device_id"),
  TOKEN("token"),
  STORE_ID("store_id"),
  NONE(null);

  private final String columnName;

  HeartbeatIdentityColumn(String columnName) {
    this.columnName = columnName;
  }

  public Optional<String> columnName() {
    return Optional.ofNullable(columnName);
  }

  /**
   * Predicate linking a stores row to its heartbeat row.
   *
   * @param storeAlias alias of the stores table in the enclosing query
   * @param heartbeatAlias alias of the heartbeat table in the enclosing query
   * @return empty when the table has no usable identity column
   */
  public Optional<String> joinPredicate(String storeAlias, String heartbeatAlias) {
    return switch (this) {
      case DEVICE_TOKEN, DEVICE_ID, TOKEN ->
          Optional.of(heartbeatAlias + "." + columnName + " = " + storeAlias + ".device_token");
      case STORE_ID -> Optional.of(heartbeatAlias + ".store_id = " + storeAlias + ".store_id");
      case NONE -> Optional.empty();
    };
  }

  /** Value identifying this device's heartbeat row. */
  public Optional<String> identityValue(String storeId, String deviceToken) {
    return switch (this) {
      case DEVICE_TOKEN, DEVICE_ID, TOKEN -> Optional.ofNullable(deviceToken);
      case STORE_ID -> Optional.ofNullable(storeId);
      case NONE -> Optional.empty();
    };
  }
}
