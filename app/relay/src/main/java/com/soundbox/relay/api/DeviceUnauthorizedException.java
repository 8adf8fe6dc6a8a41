/*
 * Where: Relay API
 * What: The presented device credential is missing or does not match the store
 */
package com.soundbox.relay.api;

public class DeviceUnauthorizedException extends RuntimeException {

  public DeviceUnauthorizedException() {
    super("device credential rejected");
  }
}
