package io.intellixity.semantiq.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CrossFilterDirection {
  SINGLE,
  BOTH;

  @JsonValue
  public String code() { return name().toLowerCase(); }

  public static CrossFilterDirection fromCode(String code) {
    return "both".equalsIgnoreCase(code == null ? null : code.trim()) ? BOTH : SINGLE;
  }
}
