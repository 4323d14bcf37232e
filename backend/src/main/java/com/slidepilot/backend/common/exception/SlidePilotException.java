package com.slidepilot.backend.common.exception;

/**
 * Base class for failures that are reported to callers with a stable {@link ErrorCode}. The
 * message must be safe to show to an end user.
 */
public class SlidePilotException extends RuntimeException {

  private final ErrorCode code;

  public SlidePilotException(ErrorCode code) {
    this(code, code.defaultMessage());
  }

  public SlidePilotException(ErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public SlidePilotException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public ErrorCode getCode() {
    return code;
  }
}
