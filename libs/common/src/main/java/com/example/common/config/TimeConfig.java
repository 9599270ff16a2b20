/*
 * Where: common configuration
 * What: exposes a UTC Clock bean
 * Why: due-time arithmetic and tests share one injectable time source
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    // stored timestamps are UTC; local rendering happens per user zone
    return Clock.systemUTC();
  }
}
