package io.intellixity.semantiq.server.web;

import io.intellixity.semantiq.error.SemanticQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps planner refusals to their status codes; anything unexpected becomes a 500. */
@RestControllerAdvice
public final class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(SemanticQueryException.class)
  public ResponseEntity<ApiError> refused(SemanticQueryException e) {
    if (log.isDebugEnabled()) log.debug("semantiq.http op=refuse code={} status={}", e.code(), e.httpStatus());
    return ResponseEntity.status(e.httpStatus()).body(ApiError.of(e.code().name(), e.getMessage()));
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> badRequest(Exception e) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiError.of(ApiError.BAD_REQUEST, e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> unexpected(Exception e) {
    log.error("semantiq.http op=fail type={}", e.getClass().getName(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiError.of(ApiError.INTERNAL_ERROR, "Query failed"));
  }
}
