package com.github.spud.apply.orchestrator.interfaces.rest;

import com.github.spud.apply.orchestrator.domain.error.DuplicateSessionException;
import com.github.spud.apply.orchestrator.domain.error.InvalidStateException;
import com.github.spud.apply.orchestrator.domain.error.InvalidTransitionException;
import com.github.spud.apply.orchestrator.domain.error.OrchestratorException;
import com.github.spud.apply.orchestrator.domain.error.SessionNotFoundException;
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
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(fromOrchestrator(e, null));
  }

  @ExceptionHandler(DuplicateSessionException.class)
  public ResponseEntity<ErrorResponse> handleDuplicateSession(DuplicateSessionException e) {
    log.warn("Rejected duplicate session: sessionId={}", e.getSessionId());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(fromOrchestrator(e, null));
  }

  @ExceptionHandler(InvalidTransitionException.class)
  public ResponseEntity<ErrorResponse> handleInvalidTransition(InvalidTransitionException e) {
    log.warn("Rejected transition: sessionId={}, {} -> {}", e.getSessionId(), e.getFrom(),
      e.getTo());
    Map<String, Object> details = new HashMap<>();
    details.put("from", e.getFrom());
    details.put("to", e.getTo());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(fromOrchestrator(e, details));
  }

  @ExceptionHandler(InvalidStateException.class)
  public ResponseEntity<ErrorResponse> handleInvalidState(InvalidStateException e) {
    log.warn("Rejected operation: sessionId={}, status={}", e.getSessionId(), e.getActual());
    Map<String, Object> details = new HashMap<>();
    details.put("status", e.getActual());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(fromOrchestrator(e, details));
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }

    ErrorResponse error = ErrorResponse.builder()
      .code("VALIDATION_ERROR")
      .message("Request validation failed")
      .timestamp(OffsetDateTime.now())
      .details(Map.of("fieldErrors", fieldErrors))
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e) {
    ErrorResponse error = ErrorResponse.builder()
      .code("VALIDATION_ERROR")
      .message(e.getReason() != null ? e.getReason() : "Malformed request")
      .timestamp(OffsetDateTime.now())
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
    ErrorResponse error = ErrorResponse.builder()
      .code("INVALID_ARGUMENT")
      .message(e.getMessage())
      .timestamp(OffsetDateTime.now())
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
    log.error("Unhandled exception", e);
    ErrorResponse error = ErrorResponse.builder()
      .code("INTERNAL_ERROR")
      .message("An unexpected error occurred")
      .timestamp(OffsetDateTime.now())
      .details(createDetailsMap(e))
      .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }

  private ErrorResponse fromOrchestrator(OrchestratorException e, Map<String, Object> extra) {
    Map<String, Object> details = new HashMap<>();
    details.put("sessionId", e.getSessionId());
    if (extra != null) {
      details.putAll(extra);
    }
    return ErrorResponse.builder()
      .code(e.getCode())
      .message(e.getMessage())
      .timestamp(OffsetDateTime.now())
      .details(details)
      .build();
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
