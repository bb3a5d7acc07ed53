package com.flamingo.ai.workspace.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ApiError> handleArtifactNotFound(
      ArtifactNotFoundException ex, HttpServletRequest request) {
    incrementErrorCounter("artifact_not_found");
    String errorId = generateErrorId();
    log.warn("Artifact not found [{}]: {}", errorId, ex.getArtifactId());
    return build(HttpStatus.NOT_FOUND, errorId, ApiError.ARTIFACT_NOT_FOUND, "Artifact not found", request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiError> handleInvalidQuery(
      IllegalArgumentException ex, HttpServletRequest request) {
    incrementErrorCounter("invalid_query");
    String errorId = generateErrorId();
    log.warn("Invalid request [{}]: {}", errorId, ex.getMessage());
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_QUERY, ex.getMessage(), request);
  }

  @ExceptionHandler(WorkspaceStorageException.class)
  public ResponseEntity<ApiError> handleStorage(
      WorkspaceStorageException ex, HttpServletRequest request) {
    incrementErrorCounter("storage_error");
    String errorId = generateErrorId();
    log.error("Storage error [{}] at {}: {}", errorId, ex.getPath(), ex.getMessage(), ex);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.STORAGE_ERROR, ex.getUserMessage(), request);
  }

  @ExceptionHandler(EmbeddingException.class)
  public ResponseEntity<ApiError> handleEmbedding(EmbeddingException ex, HttpServletRequest request) {
    incrementErrorCounter("embedding_error");
    String errorId = generateErrorId();
    log.error("Embedding error [{}]: {}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(SearchException.class)
  public ResponseEntity<ApiError> handleSearch(SearchException ex, HttpServletRequest request) {
    incrementErrorCounter("search_error");
    String errorId = generateErrorId();
    log.error("Search error [{}] on {}: {}", errorId, ex.getIndex(), ex.getMessage(), ex);
    return build(
        HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.SEARCH_FAILED, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");
    log.warn("Validation error [{}]: {}", errorId, message);
    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
