package io.intellixity.semantiq.error;

/** Planner refusal codes, each carrying the HTTP status it surfaces as. */
public enum ErrorCode {
  MISSING_TABLE_SCOPE(400),
  NO_RELATIONSHIP_PATH(400),
  JOIN_GRAPH_ERROR(400),
  CROSS_SOURCE_BLOCKED(400),
  TABLE_NOT_EXECUTABLE(400),
  RLS_PAGE_DENIED(403),
  ENGINE_NOT_SUPPORTED(400),
  UNSAFE_SQL(400),
  DATA_MODEL_NOT_FOUND(404),
  INVALID_RELATIONSHIP(400);

  private final int httpStatus;

  ErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() { return httpStatus; }
}
