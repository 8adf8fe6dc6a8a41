/*
 * Where: Relay web configuration
 * What: Applies RequestMdcInterceptor to every request
 * Why: Poll and cashier logs need stable correlation keys
 */
package com.soundbox.relay.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(new RequestMdcInterceptor());
  }
}
