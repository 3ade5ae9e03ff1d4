package io.intellixity.semantiq.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationStatus {
  VALID,
  INVALID;

  @JsonValue
  public String code() { return name().toLowerCase(); }

  public static ValidationStatus fromCode(String code) {
    return "valid".equalsIgnoreCase(code == null ? null : code.trim()) ? VALID : INVALID;
  }
}
