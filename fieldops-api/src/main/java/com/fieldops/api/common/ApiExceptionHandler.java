package com.fieldops.api.common;

import com.fieldops.api.tracing.RequestContext;
import com.fieldops.application.errors.StorageFailureException;
import com.fieldops.application.service.ResourceNotFoundException;
import com.fieldops.domain.DomainException;
import com.fieldops.domain.ErrorCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders every failure as {@code {category, message, field?, details?, requestId, ts}}.
 * Engine detail (SQL, constraint names) is logged, never returned.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String GENERIC_MESSAGE = StorageFailureException.GENERIC_MESSAGE;

  @ExceptionHandler(DomainException.class)
  public ResponseEntity<Map<String, Object>> domain(DomainException ex) {
    HttpStatus status = statusFor(ex.category());
    if (ex.category() == ErrorCategory.CONFIGURATION_ERROR) {
      log.error("[API] configuration error details={}", ex.details(), ex);
      return body(status, ex.category().code(), GENERIC_MESSAGE, null, List.of());
    }
    log.debug("[API] {} field={} message={}", ex.category().code(), ex.field(), ex.getMessage());
    return body(status, ex.category().code(), ex.getMessage(), ex.field(), ex.details());
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(ResourceNotFoundException ex) {
    return body(HttpStatus.NOT_FOUND, "NotFound", ex.getMessage(), null, List.of());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
    return body(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION_FAILED.code(),
        "Request body must be a JSON object", null, List.of());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<Map<String, Object>> badParameter(MethodArgumentTypeMismatchException ex) {
    return body(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION_FAILED.code(),
        "Invalid value for parameter " + ex.getName(), ex.getName(), List.of());
  }

  @ExceptionHandler(StorageFailureException.class)
  public ResponseEntity<Map<String, Object>> storage(StorageFailureException ex) {
    log.error("[API] storage failure", ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", GENERIC_MESSAGE, null, List.of());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> unexpected(Exception ex) {
    log.error("[API] unexpected error", ex);
    return body(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", GENERIC_MESSAGE, null, List.of());
  }

  static HttpStatus statusFor(ErrorCategory category) {
    return switch (category) {
      case PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
      case VALIDATION_FAILED, NOT_FOUND_REFERENCE -> HttpStatus.BAD_REQUEST;
      case CONFLICT_ERROR, DELETE_BLOCKED -> HttpStatus.CONFLICT;
      case CONFIGURATION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
    };
  }

  private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String category, String message,
                                                          String field, List<String> details) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("category", category);
    body.put("message", message);
    if (field != null) body.put("field", field);
    if (details != null && !details.isEmpty()) body.put("details", details);
    body.put("requestId", RequestContext.requestId());
    body.put("ts", Instant.now().toString());
    return ResponseEntity.status(status).body(body);
  }
}
