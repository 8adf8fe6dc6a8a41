/*
 * Where: Relay domain model
 * What: Snapshot of a stores row
 * Why: Shared by the claim protocol, transaction creation and administration
 */
package com.soundbox.relay.model;

import java.time.Instant;

public record StoreRecord(
    String storeId, String name, String deviceToken, boolean enabled, Instant createdAt) {}
