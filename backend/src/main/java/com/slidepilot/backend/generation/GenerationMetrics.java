package com.slidepilot.backend.generation;

import com.slidepilot.backend.generation.model.FailureKind;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;

public class GenerationMetrics {

  private final MeterRegistry meterRegistry;

  public GenerationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordAttempt(String mode) {
    meterRegistry.counter("generation.attempts", "mode", mode).increment();
  }

  public void recordRetry(String mode) {
    meterRegistry.counter("generation.retries", "mode", mode).increment();
  }

  public void recordFailure(String mode, FailureKind kind) {
    meterRegistry
        .counter("generation.failures", "mode", mode, "kind", kind.name().toLowerCase(Locale.ROOT))
        .increment();
  }

  public void recordFragment() {
    meterRegistry.counter("generation.stream.fragments").increment();
  }

  public void recordSkippedLine() {
    meterRegistry.counter("generation.stream.skipped_lines").increment();
  }
}
