package com.flamingo.ai.notionrag.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(InvalidIdentifierException.class)
  public ResponseEntity<ApiError> handleInvalidIdentifier(
      InvalidIdentifierException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_identifier");
    String errorId = generateErrorId();
    log.warn("Invalid identifier [{}]: {}", errorId, ex.getInput());

    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_IDENTIFIER, ex.getMessage(), request);
  }

  @ExceptionHandler(UnknownDatabaseException.class)
  public ResponseEntity<ApiError> handleUnknownDatabase(
      UnknownDatabaseException ex, HttpServletRequest request) {

    incrementErrorCounter("unknown_database");
    String errorId = generateErrorId();
    log.warn("Unknown database [{}]: {}", errorId, ex.getMessage());

    // a named label that does not exist is a missing resource; a missing label is a bad request
    HttpStatus status = ex.getLabel() == null ? HttpStatus.BAD_REQUEST : HttpStatus.NOT_FOUND;
    return respond(status, errorId, ApiError.UNKNOWN_DATABASE, ex.getMessage(), request);
  }

  @ExceptionHandler(StoreNotFoundException.class)
  public ResponseEntity<ApiError> handleStoreNotFound(
      StoreNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("store_not_found");
    String errorId = generateErrorId();
    log.warn("Store not found [{}]: {}", errorId, ex.getStoreId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.STORE_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(ArtifactNotFoundException.class)
  public ResponseEntity<ApiError> handleArtifactNotFound(
      ArtifactNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getPageId());

    return respond(
        HttpStatus.NOT_FOUND, errorId, ApiError.DOCUMENT_NOT_FOUND, ex.getMessage(), request);
  }

  @ExceptionHandler(StoreOperationException.class)
  public ResponseEntity<ApiError> handleStoreOperation(
      StoreOperationException ex, HttpServletRequest request) {

    incrementErrorCounter("store_error");
    String errorId = generateErrorId();
    log.error("Store error [{}] in {}: {}", errorId, ex.getStoreId(), ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.STORE_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(NotionApiException.class)
  public ResponseEntity<ApiError> handleNotionApi(
      NotionApiException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "notion_rate_limited" : "notion_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("Notion API error [{}]: {}", errorId, ex.getMessage(), ex);

    if (ex.isRateLimited()) {
      return respond(
          HttpStatus.TOO_MANY_REQUESTS,
          errorId,
          ApiError.NOTION_RATE_LIMITED,
          "Notion API rate limit reached. Please try again later.",
          request);
    }
    return respond(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.NOTION_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(PageIndexingException.class)
  public ResponseEntity<ApiError> handlePageIndexing(
      PageIndexingException ex, HttpServletRequest request) {

    incrementErrorCounter("indexing_failed");
    String errorId = generateErrorId();
    log.error("Indexing failed [{}] for page {}: {}", errorId, ex.getPageId(), ex.getMessage(), ex);

    return respond(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.INDEXING_FAILED,
        ex.getUserMessage() + " " + ex.getPageId() + ": " + ex.getMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    incrementErrorCounter("llm_error");
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.LLM_UNAVAILABLE,
        ex.getUserMessage(),
        request);
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

    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof HttpMessageNotReadableException
            ? "Malformed request body"
            : ex.getMessage();
    return respond(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
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
