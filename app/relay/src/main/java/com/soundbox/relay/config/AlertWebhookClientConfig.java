/*
 * Where: Relay infrastructure configuration
 * What: RestClient dedicated to the alert webhook
 * Why: A slow chat endpoint must time out instead of holding a dispatch thread
 */
package com.soundbox.relay.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "soundbox.alert-webhook.enabled", havingValue = "true")
public class AlertWebhookClientConfig {

  @Bean
  RestClient alertWebhookRestClient(RestClient.Builder builder, AlertWebhookProperties properties) {
    if (properties.url().isBlank()) {
      throw new IllegalStateException("soundbox.alert-webhook.url is required when enabled");
    }
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.requestFactory(requestFactory).build();
  }
}
