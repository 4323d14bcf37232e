package com.slidepilot.backend.session.domain;

import java.time.Instant;
import java.util.Objects;

public record ChatMessage(ChatRole role, String content, Instant timestamp) {

  public ChatMessage {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
