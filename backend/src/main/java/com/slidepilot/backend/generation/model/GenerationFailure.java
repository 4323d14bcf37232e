package com.slidepilot.backend.generation.model;

import java.util.List;
import java.util.Objects;

public record GenerationFailure(FailureKind kind, String message, List<String> violations) {

  public GenerationFailure {
    Objects.requireNonNull(kind, "kind");
    violations = violations != null ? List.copyOf(violations) : List.of();
  }

  public static GenerationFailure unavailable(String message) {
    return new GenerationFailure(FailureKind.UNAVAILABLE, message, List.of());
  }

  public static GenerationFailure parse(String message) {
    return new GenerationFailure(FailureKind.PARSE, message, List.of());
  }

  public static GenerationFailure validation(List<String> violations) {
    return new GenerationFailure(
        FailureKind.VALIDATION, "Model output violates the presentation schema", violations);
  }
}
