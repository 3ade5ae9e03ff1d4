package io.intellixity.semantiq.model;

import java.util.Locale;
import java.util.Objects;

public record ColumnDef(String name, String type) {
  public ColumnDef {
    Objects.requireNonNull(name, "name");
  }

  /**
   * Coarse type family used when comparing join columns: boolean, date, number or string.
   */
  public String typeFamily() {
    String t = (type == null) ? "" : type.trim().toUpperCase(Locale.ROOT);
    if (t.isEmpty()) return "string";
    if (t.contains("BOOL")) return "boolean";
    if (t.contains("DATE") || t.contains("TIME")) return "date";
    if (t.contains("INT") || t.contains("NUMERIC") || t.contains("DECIMAL") || t.contains("FLOAT")
        || t.contains("DOUBLE") || t.contains("REAL") || t.contains("NUMBER")) {
      return "number";
    }
    return "string";
  }
}
