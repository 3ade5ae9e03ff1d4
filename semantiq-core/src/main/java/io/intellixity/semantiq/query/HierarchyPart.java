package io.intellixity.semantiq.query;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Calendar component extracted from a date/time column. */
public enum HierarchyPart {
  YEAR,
  QUARTER,
  HALF,
  MONTH,
  WEEK,
  DAY,
  HOUR,
  MINUTE,
  SECOND;

  @JsonValue
  public String code() { return name().toLowerCase(Locale.ROOT); }

  /** Returns null for blank or unknown parts, which are ignored downstream. */
  public static HierarchyPart fromCode(String code) {
    if (code == null) return null;
    String s = code.trim().toUpperCase(Locale.ROOT);
    if (s.isEmpty()) return null;
    try {
      return valueOf(s);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
