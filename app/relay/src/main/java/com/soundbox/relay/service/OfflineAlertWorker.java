/*
 * Where: Relay offline alert worker
 * What: Triggers the offline scan on a fixed delay
 */
package com.soundbox.relay.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "soundbox.offline-alert.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class OfflineAlertWorker {

  private final OfflineAlertService offlineAlertService;

  @Scheduled(fixedDelayString = "${soundbox.offline-alert.check-interval:PT5M}")
  public void run() {
    offlineAlertService.dispatchOfflineAlerts();
  }
}
