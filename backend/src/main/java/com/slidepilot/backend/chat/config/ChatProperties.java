package com.slidepilot.backend.chat.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat")
public class ChatProperties {

  /** Upper bound for one streamed turn; the SSE connection is closed once it elapses. */
  private Duration streamTimeout = Duration.ofMinutes(5);

  public Duration getStreamTimeout() {
    return streamTimeout;
  }

  public void setStreamTimeout(Duration streamTimeout) {
    this.streamTimeout = streamTimeout;
  }
}
