package com.flamingo.ai.notionrag.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Time source for sync windows and ledger timestamps. */
@Configuration
public class SyncConfig {

  @Bean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }
}
