package com.slidepilot.backend.generation.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a structured generation call. Exactly one of {@link #value()} and {@link #failure()}
 * is present; callers branch on {@link #isSuccess()}.
 */
public final class GenerationResult<T> {

  private final T value;
  private final GenerationFailure failure;

  private GenerationResult(T value, GenerationFailure failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> GenerationResult<T> success(T value) {
    return new GenerationResult<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> GenerationResult<T> failure(GenerationFailure failure) {
    return new GenerationResult<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public T value() {
    if (failure != null) {
      throw new IllegalStateException("Result is a failure: " + failure.kind());
    }
    return value;
  }

  public GenerationFailure failure() {
    if (failure == null) {
      throw new IllegalStateException("Result is a success");
    }
    return failure;
  }

  public <R> GenerationResult<R> map(Function<? super T, ? extends R> mapper) {
    if (failure != null) {
      return failure(failure);
    }
    return success(mapper.apply(value));
  }

  @Override
  public String toString() {
    return isSuccess() ? "GenerationResult[success]" : "GenerationResult[" + failure.kind() + "]";
  }
}
