package io.intellixity.semantiq.security;

public enum ShareTargetType {
  USER,
  GROUP;

  /** Anything other than {@code group} is a user share. */
  public static ShareTargetType fromValue(String value) {
    return (value != null && value.trim().equalsIgnoreCase("group")) ? GROUP : USER;
  }
}
