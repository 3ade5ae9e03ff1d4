package io.intellixity.semantiq.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Cardinality {
  ONE_TO_ONE("1-1"),
  ONE_TO_MANY("1-n"),
  MANY_TO_ONE("n-1"),
  MANY_TO_MANY("n-n");

  private final String code;

  Cardinality(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() { return code; }

  /** Unknown or blank codes default to 1-n. */
  public static Cardinality fromCode(String code) {
    if (code != null) {
      String s = code.trim().toLowerCase();
      for (Cardinality c : values()) {
        if (c.code.equals(s)) return c;
      }
    }
    return ONE_TO_MANY;
  }
}
