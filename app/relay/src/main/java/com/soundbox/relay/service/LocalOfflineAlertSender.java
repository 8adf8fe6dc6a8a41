/*
 * Where: Relay alert channel
 * What: Default channel that writes alerts to the application log
 * Why: Deployments without a webhook still see offline devices in their log pipeline
 */
package com.soundbox.relay.service;

import com.soundbox.relay.model.OfflineAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LocalOfflineAlertSender implements OfflineAlertSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalOfflineAlertSender.class);

  @Override
  public void send(OfflineAlert alert) {
    logger.warn(
        "device offline storeId={} storeName={} minutesOffline={}",
        alert.storeId(),
        alert.storeName(),
        alert.minutesOffline());
  }
}
