package com.slidepilot.backend.session.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.sessions")
public class SessionProperties {

  /**
   * How long a session stays alive after its last activity. Once the threshold is crossed the
   * session is no longer visible, even if it has not been swept yet.
   */
  private Duration ttl = Duration.ofHours(1);

  public Duration getTtl() {
    return ttl;
  }

  public void setTtl(Duration ttl) {
    this.ttl = ttl;
  }
}
