/*
 * Where: Relay domain model
 * What: Alert payload for a device that stopped polling
 * Why: Computed per scheduler run and handed to the alert channel, never persisted
 */
package com.soundbox.relay.model;

public record OfflineAlert(String storeId, String storeName, long minutesOffline) {}
