/*
 * Where: Relay alert channel
 * What: Posts offline alerts as JSON to a chat webhook
 */
package com.soundbox.relay.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.google.common.annotations.VisibleForTesting;
import com.soundbox.relay.config.AlertWebhookProperties;
import com.soundbox.relay.model.OfflineAlert;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
@Primary
@ConditionalOnProperty(name = "soundbox.alert-webhook.enabled", havingValue = "true")
public class WebhookOfflineAlertSender implements OfflineAlertSender {

  private final RestClient restClient;
  private final AlertWebhookProperties properties;

  public WebhookOfflineAlertSender(
      @Qualifier("alertWebhookRestClient") RestClient restClient,
      AlertWebhookProperties properties) {
    this.restClient = restClient;
    this.properties = properties;
  }

  @Override
  public void send(OfflineAlert alert) {
    restClient
        .post()
        .uri(properties.url())
        .contentType(MediaType.APPLICATION_JSON)
        .body(toPayload(alert))
        .retrieve()
        .toBodilessEntity();
  }

  @VisibleForTesting
  static WebhookPayload toPayload(OfflineAlert alert) {
    final String text =
        "Soundbox offline: "
            + alert.storeName()
            + " ("
            + alert.storeId()
            + ") has not polled for "
            + alert.minutesOffline()
            + " minutes";
    return new WebhookPayload(text, alert.storeId(), alert.storeName(), alert.minutesOffline());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  record WebhookPayload(String text, String storeId, String storeName, long minutesOffline) {}
}
