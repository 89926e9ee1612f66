package com.github.spud.sample.ai.iac.interfaces.rest;

import com.github.spud.sample.ai.iac.application.service.SessionNotFoundException;
import com.github.spud.sample.ai.iac.domain.kernel.InvalidGenerationOptionsException;
import com.github.spud.sample.ai.iac.domain.rag.EmptyDatasetException;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  public static class ErrorResponse {

    private String code;
    private String message;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException e) {
    return build(HttpStatus.NOT_FOUND, "SESSION_NOT_FOUND", e.getMessage(), null);
  }

  @ExceptionHandler(InvalidGenerationOptionsException.class)
  public ResponseEntity<ErrorResponse> handleInvalidOptions(InvalidGenerationOptionsException e) {
    return build(HttpStatus.BAD_REQUEST, "INVALID_OPTIONS", e.getMessage(), null);
  }

  @ExceptionHandler(EmptyDatasetException.class)
  public ResponseEntity<ErrorResponse> handleEmptyDataset(EmptyDatasetException e) {
    log.warn("Knowledge base rebuild rejected: {}", e.getMessage());
    return build(HttpStatus.SERVICE_UNAVAILABLE, "EMPTY_DATASET", e.getMessage(), null);
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }
    return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed",
      Map.of("fieldErrors", fieldErrors));
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", e.getReason(), null);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", e.getMessage(), null);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred",
      createDetailsMap(e));
  }

  private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message,
    Map<String, Object> details) {
    ErrorResponse error = ErrorResponse.builder()
      .code(code)
      .message(message)
      .timestamp(OffsetDateTime.now())
      .details(details)
      .build();
    return ResponseEntity.status(status).body(error);
  }

  private Map<String, Object> createDetailsMap(Exception e) {
    Map<String, Object> details = new HashMap<>();
    details.put("exception", e.getClass().getSimpleName());
    details.put("message", e.getMessage());
    if (e.getCause() != null) {
      details.put("cause", e.getCause().getMessage());
    }
    return details;
  }
}
