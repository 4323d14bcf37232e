package com.slidepilot.backend.generation.model;

public enum FailureKind {
  /** Transport failures persisted through every retry, or were not retryable. */
  UNAVAILABLE,
  /** The response held no JSON object, or it was structurally incomplete. */
  PARSE,
  /** The JSON parsed but violated field or schema rules. */
  VALIDATION
}
