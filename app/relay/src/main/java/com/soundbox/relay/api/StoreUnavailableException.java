/*
 * Where: Relay API
 * What: The store is unknown or disabled
 * Why: Both transaction creation and device polling refuse such stores with 403
 */
package com.soundbox.relay.api;

public class StoreUnavailableException extends RuntimeException {

  public StoreUnavailableException(String storeId) {
    super("store unavailable: " + storeId);
  }
}
