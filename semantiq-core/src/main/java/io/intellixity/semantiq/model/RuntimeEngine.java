package io.intellixity.semantiq.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Backend a model table executes on. Closed set: one dialect per value. */
public enum RuntimeEngine {
  POSTGRES("postgres"),
  BIGQUERY("bigquery");

  private final String id;

  RuntimeEngine(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() { return id; }

  public static RuntimeEngine fromId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("Blank runtime engine id");
    String s = id.trim().toLowerCase(Locale.ROOT);
    for (RuntimeEngine e : values()) {
      if (e.id.equals(s)) return e;
    }
    throw new IllegalArgumentException("Unknown runtime engine: " + id);
  }

  /** Engine implied by a connection source type when the runtime catalog does not name one. */
  public static RuntimeEngine fromSourceType(String sourceType) {
    return "bigquery".equalsIgnoreCase(sourceType == null ? null : sourceType.trim()) ? BIGQUERY : POSTGRES;
  }
}
