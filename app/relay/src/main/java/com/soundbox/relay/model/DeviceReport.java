/*
 * Where: Relay domain model
 * What: What a polling device tells us about itself
 * Why: The heartbeat recorder persists these values when the schema supports them
 */
package com.soundbox.relay.model;

public record DeviceReport(String ipAddress, String firmwareVersion) {

  public static DeviceReport empty() {
    return new DeviceReport(null, null);
  }
}
