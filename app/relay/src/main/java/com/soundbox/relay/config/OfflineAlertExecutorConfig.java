/*
 * Where: Relay infrastructure configuration
 * What: Small thread pool that delivers offline alerts
 * Why: The scheduler run must not wait on alert delivery
 */
package com.soundbox.relay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class OfflineAlertExecutorConfig {

  @Bean
  ThreadPoolTaskExecutor offlineAlertExecutor(OfflineAlertProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.dispatchThreads());
    executor.setMaxPoolSize(properties.dispatchThreads());
    executor.setThreadNamePrefix("offline-alert-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}
