/*
 * Where: Shared configuration
 * What: Exposes a UTC Clock bean
 * Why: Services read time through an injected Clock so tests can pin it
 */
package com.hirewise.common.config;

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
