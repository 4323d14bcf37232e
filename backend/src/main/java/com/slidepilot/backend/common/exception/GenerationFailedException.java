package com.slidepilot.backend.common.exception;

import com.slidepilot.backend.generation.model.GenerationFailure;
import java.util.List;

/** Carries a structured-generation failure to the HTTP boundary. */
public class GenerationFailedException extends SlidePilotException {

  private final transient GenerationFailure failure;

  public GenerationFailedException(GenerationFailure failure) {
    super(codeFor(failure), codeFor(failure).defaultMessage());
    this.failure = failure;
  }

  public GenerationFailure getFailure() {
    return failure;
  }

  public List<String> getViolations() {
    return failure.violations();
  }

  static ErrorCode codeFor(GenerationFailure failure) {
    return switch (failure.kind()) {
      case UNAVAILABLE -> ErrorCode.BACKEND_UNAVAILABLE;
      case PARSE -> ErrorCode.MODEL_OUTPUT_UNPARSEABLE;
      case VALIDATION -> ErrorCode.DRAFT_VALIDATION_FAILED;
    };
  }
}
