package io.intellixity.semantiq.error;

import java.util.Objects;

/**
 * Raised when a request cannot be planned or executed for a reason the caller can act on
 * (bad scope, missing join path, policy denial, unsafe SQL).
 * <p>
 * Database failures are not reported through this type.
 */
public final class SemanticQueryException extends RuntimeException {
  private final ErrorCode code;

  public SemanticQueryException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ErrorCode code() { return code; }

  public int httpStatus() { return code.httpStatus(); }
}
