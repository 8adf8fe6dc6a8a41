/*
 * Where: Relay alert channel
 * What: Delivers an offline alert to operators
 */
package com.soundbox.relay.service;

import com.soundbox.relay.model.OfflineAlert;

public interface OfflineAlertSender {

  /** Throws on delivery failure; the dispatcher logs and counts it. */
  void send(OfflineAlert alert);
}
