package com.slidepilot.backend.generation.model;

/** Token counters reported by the backend, usually only on the final fragment. */
public record GenerationUsage(Integer promptTokens, Integer completionTokens, Long evalDurationNanos) {

  public boolean hasAny() {
    return promptTokens != null || completionTokens != null || evalDurationNanos != null;
  }
}
