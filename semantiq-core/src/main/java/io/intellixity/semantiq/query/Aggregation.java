package io.intellixity.semantiq.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Aggregation {
  SUM("sum"),
  AVG("avg"),
  COUNT("count"),
  MIN("min"),
  MAX("max"),
  COUNT_DISTINCT("countdistinct"),
  NONE("none"),
  RAW("raw");

  private final String code;

  Aggregation(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() { return code; }

  /** True when the projection collapses rows (anything but none/raw). */
  public boolean isAggregating() {
    return this != NONE && this != RAW;
  }

  /** Case-insensitive; unknown codes fall back to {@link #NONE}. */
  public static Aggregation fromCode(String code) {
    if (code == null) return NONE;
    String s = code.trim().toLowerCase(Locale.ROOT);
    for (Aggregation a : values()) {
      if (a.code.equals(s)) return a;
    }
    return NONE;
  }
}
