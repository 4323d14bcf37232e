package com.slidepilot.backend.session.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChatRole {
  USER("user"),
  ASSISTANT("assistant");

  private final String value;

  ChatRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Prefix used when the transcript is rendered into a single prompt. */
  public String speakerLabel() {
    return this == USER ? "User" : "Assistant";
  }

  @JsonCreator
  public static ChatRole fromValue(String raw) {
    if (raw == null) {
      return null;
    }
    for (ChatRole role : values()) {
      if (role.value.equalsIgnoreCase(raw)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown chat role: " + raw);
  }
}
