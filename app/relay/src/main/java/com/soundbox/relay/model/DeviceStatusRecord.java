/*
 * Where: Relay domain model
 * What: A store joined with whatever liveness data its heartbeat row carries
 * Why: Liveness fields are null when the schema cannot provide them
 */
package com.soundbox.relay.model;

import java.time.Instant;

public record DeviceStatusRecord(
    String storeId,
    String name,
    boolean enabled,
    Instant lastSeen,
    String ipAddress,
    String firmwareVersion) {}
