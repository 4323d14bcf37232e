package com.slidepilot.backend.session.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;

public enum SlideType {
  TITLE("title"),
  CONTENT("content"),
  SUMMARY("summary");

  private final String value;

  SlideType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Lenient lookup used when validating model output; unknown values are reported, not thrown. */
  public static Optional<SlideType> find(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim();
    for (SlideType type : values()) {
      if (type.value.equalsIgnoreCase(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  public static SlideType fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    return find(raw).orElseThrow(() -> new IllegalArgumentException("Unknown slide type: " + raw));
  }
}
