/*
 * Where: Relay domain model
 * What: Row selected by the offline scan
 * Why: Carries the last-seen time the alert duration is computed from
 */
package com.soundbox.relay.model;

import java.time.Instant;

public record StaleDevice(String storeId, String storeName, Instant lastSeen) {}
