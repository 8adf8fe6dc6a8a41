/*
 * Where: Relay API
 * What: An operator action targets a store that does not exist
 */
package com.soundbox.relay.api;

public class StoreNotFoundException extends RuntimeException {

  public StoreNotFoundException(String storeId) {
    super("store not found: " + storeId);
  }
}
