package com.slidepilot.backend.common.exception;

public class NotFoundException extends SlidePilotException {

  public NotFoundException(ErrorCode code, String message) {
    super(code, message);
  }

  public static NotFoundException session(String sessionId) {
    return new NotFoundException(
        ErrorCode.SESSION_NOT_FOUND, "Session '" + sessionId + "' not found or expired");
  }

  public static NotFoundException template(String templateKey) {
    return new NotFoundException(
        ErrorCode.TEMPLATE_NOT_FOUND, "Template '" + templateKey + "' not found");
  }
}
