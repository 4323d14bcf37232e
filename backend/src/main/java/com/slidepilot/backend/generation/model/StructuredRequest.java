package com.slidepilot.backend.generation.model;

import java.util.Objects;

/**
 * Input for a structured-mode call. {@code temperature} and {@code contextWindow} fall back to
 * the configured defaults when null.
 */
public record StructuredRequest(
    String prompt,
    String system,
    PresentationSchema schema,
    Double temperature,
    Integer contextWindow) {

  public StructuredRequest {
    Objects.requireNonNull(prompt, "prompt");
    schema = schema != null ? schema : PresentationSchema.DEFAULT;
  }

  public static StructuredRequest of(String prompt) {
    return new StructuredRequest(prompt, null, PresentationSchema.DEFAULT, null, null);
  }
}
