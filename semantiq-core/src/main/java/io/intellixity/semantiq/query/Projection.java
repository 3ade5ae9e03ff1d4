package io.intellixity.semantiq.query;

import java.util.Objects;

/** One output column of a request, optionally aggregated and aliased. */
public record Projection(String tableRef, String column, Aggregation aggregation, String alias, HierarchyPart hierarchyPart) {
  public static final String STAR = "*";

  public Projection {
    Objects.requireNonNull(column, "column");
    aggregation = (aggregation == null) ? Aggregation.NONE : aggregation;
  }

  public static Projection star(String tableRef) {
    return new Projection(tableRef, STAR, Aggregation.NONE, null, null);
  }

  public boolean isStar() { return STAR.equals(column); }
}
