package io.intellixity.semantiq.server.web;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

final class ApiExceptionHandlerTest {
  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void refusalCarriesItsStatusAndCode() {
    ResponseEntity<ApiError> r = handler.refused(
        new SemanticQueryException(ErrorCode.RLS_PAGE_DENIED, "Page p2 is not shared with you"));

    assertEquals(403, r.getStatusCode().value());
    ApiError body = r.getBody();
    assertNotNull(body);
    assertFalse(body.success());
    assertEquals("RLS_PAGE_DENIED", body.code());
    assertEquals("Page p2 is not shared with you", body.message());
  }

  @Test
  void missingModelIs404() {
    ResponseEntity<ApiError> r = handler.refused(
        new SemanticQueryException(ErrorCode.DATA_MODEL_NOT_FOUND, "Data model not found: dm-9"));
    assertEquals(404, r.getStatusCode().value());
  }

  @Test
  void malformedInputIs400() {
    ResponseEntity<ApiError> r = handler.badRequest(new IllegalArgumentException("Missing query param: $3"));
    assertEquals(400, r.getStatusCode().value());
    assertEquals(ApiError.BAD_REQUEST, r.getBody().code());
  }

  @Test
  void databaseFailureIs500WithoutDetails() {
    ResponseEntity<ApiError> r = handler.unexpected(new RuntimeException(new java.sql.SQLException("boom")));
    assertEquals(500, r.getStatusCode().value());
    assertEquals(ApiError.INTERNAL_ERROR, r.getBody().code());
    assertEquals("Query failed", r.getBody().message());
  }
}
