/*
 * Where: Shared configuration
 * What: Exposes a UTC Clock bean
 * Why: Liveness windows and timestamps must be computed from one injectable clock
 */
package com.soundbox.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
