package com.slidepilot.backend.common.exception;

/** The operation is not valid for the current state of the session or template. */
public class InvalidStateException extends SlidePilotException {

  public InvalidStateException(ErrorCode code) {
    super(code);
  }

  public InvalidStateException(ErrorCode code, String message) {
    super(code, message);
  }
}
