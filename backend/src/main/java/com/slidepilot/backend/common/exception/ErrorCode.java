package com.slidepilot.backend.common.exception;

import org.springframework.http.HttpStatus;

/** Stable machine-readable codes returned to callers alongside a human-readable message. */
public enum ErrorCode {
  SESSION_NOT_FOUND(HttpStatus.NOT_FOUND, "Session not found or expired"),
  TEMPLATE_NOT_FOUND(HttpStatus.NOT_FOUND, "Template not found"),
  GUIDED_MODE_NOT_SUPPORTED(HttpStatus.BAD_REQUEST, "Template does not support guided mode"),
  NO_DRAFT(HttpStatus.BAD_REQUEST, "No draft available. Create a draft first."),
  INVALID_REQUEST(HttpStatus.BAD_REQUEST, "Invalid request payload"),
  BACKEND_UNAVAILABLE(
      HttpStatus.SERVICE_UNAVAILABLE, "Generation service is unavailable. Please try again later."),
  MODEL_OUTPUT_UNPARSEABLE(HttpStatus.BAD_GATEWAY, "The model returned content that could not be parsed."),
  DRAFT_VALIDATION_FAILED(
      HttpStatus.UNPROCESSABLE_ENTITY, "The model returned a draft that does not match the schema."),
  RENDERER_ERROR(HttpStatus.BAD_GATEWAY, "Failed to render the presentation."),
  INTERNAL_ERROR(
      HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.");

  private final HttpStatus status;
  private final String defaultMessage;

  ErrorCode(HttpStatus status, String defaultMessage) {
    this.status = status;
    this.defaultMessage = defaultMessage;
  }

  public HttpStatus status() {
    return status;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
