package com.scholary.refinery.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Core settings and the clock every timestamp is taken from. */
@Configuration
@EnableConfigurationProperties(RefineryProperties.class)
public class RefineryConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
