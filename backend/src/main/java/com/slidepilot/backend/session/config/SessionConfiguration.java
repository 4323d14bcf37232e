package com.slidepilot.backend.session.config;

import com.slidepilot.backend.session.SessionStore;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public SessionStore sessionStore(SessionProperties properties, Clock clock) {
    return new SessionStore(properties.getTtl(), clock);
  }
}
