package com.slidepilot.backend.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps failures to {@code application/problem+json} bodies carrying a stable {@code code}. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  static final String CODE_PROPERTY = "code";
  static final String VIOLATIONS_PROPERTY = "violations";

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleUnexpectedException(Exception ex) {
    log.error("Unhandled exception", ex);
    return problem(
        ErrorCode.INTERNAL_ERROR, "Unexpected error", ErrorCode.INTERNAL_ERROR.defaultMessage());
  }

  @ExceptionHandler(GenerationFailedException.class)
  public ResponseEntity<ProblemDetail> handleGenerationFailure(GenerationFailedException ex) {
    ResponseEntity<ProblemDetail> response =
        problem(ex.getCode(), "Generation failed", ex.getMessage());
    if (!ex.getViolations().isEmpty()) {
      response.getBody().setProperty(VIOLATIONS_PROPERTY, ex.getViolations());
    }
    return response;
  }

  @ExceptionHandler(SlidePilotException.class)
  public ResponseEntity<ProblemDetail> handleSlidePilotException(SlidePilotException ex) {
    if (ex.getCode().status().is5xxServerError()) {
      log.warn("Request failed with {}: {}", ex.getCode(), ex.getMessage());
    } else {
      log.debug("Request rejected with {}: {}", ex.getCode(), ex.getMessage());
    }
    return problem(ex.getCode(), titleFor(ex.getCode()), ex.getMessage());
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class})
  public ResponseEntity<ProblemDetail> handleValidationErrors(BindException ex) {
    return problem(ErrorCode.INVALID_REQUEST, "Validation failed", resolveValidationMessage(ex));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex) {
    log.debug("Unreadable request body: {}", ex.getMessage());
    return problem(
        ErrorCode.INVALID_REQUEST, "Validation failed", ErrorCode.INVALID_REQUEST.defaultMessage());
  }

  private ResponseEntity<ProblemDetail> problem(ErrorCode code, String title, String detail) {
    HttpStatus status = code.status();
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    problem.setProperty(CODE_PROPERTY, code.name());
    return ResponseEntity.status(status).body(problem);
  }

  private String titleFor(ErrorCode code) {
    return switch (code) {
      case SESSION_NOT_FOUND, TEMPLATE_NOT_FOUND -> "Not found";
      case GUIDED_MODE_NOT_SUPPORTED, NO_DRAFT -> "Invalid state";
      case INVALID_REQUEST -> "Validation failed";
      default -> code.status().getReasonPhrase();
    };
  }

  private String resolveValidationMessage(BindException ex) {
    return ex.getBindingResult().getAllErrors().stream()
        .findFirst()
        .map(
            error ->
                error.getDefaultMessage() != null
                    ? error.getDefaultMessage()
                    : ErrorCode.INVALID_REQUEST.defaultMessage())
        .orElse(ErrorCode.INVALID_REQUEST.defaultMessage());
  }
}
