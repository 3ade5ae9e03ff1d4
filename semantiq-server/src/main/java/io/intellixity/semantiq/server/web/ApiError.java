package io.intellixity.semantiq.server.web;

/** Failure envelope: {@code {"success":false,"message":...,"code":...}}. */
public record ApiError(boolean success, String message, String code) {
  public static final String BAD_REQUEST = "BAD_REQUEST";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  public static ApiError of(String code, String message) {
    return new ApiError(false, message, code);
  }
}
