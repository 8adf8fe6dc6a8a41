/*
 * Where: Relay configuration binding
 * What: Target and timeout of the webhook alert channel
 * Why: The channel is optional and differs per deployment
 */
package com.soundbox.relay.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "soundbox.alert-webhook")
public record AlertWebhookProperties(boolean enabled, String url, Duration timeout) {

  public AlertWebhookProperties {
    url = url == null ? "" : url;
    timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
  }
}
