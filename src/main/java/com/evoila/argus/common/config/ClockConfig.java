package com.evoila.argus.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  /** Source of {@code now} for bucket sizing and error timestamps; replaced in tests. */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
