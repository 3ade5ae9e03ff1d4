package io.intellixity.semantiq.plan;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Rows are column-label to value maps in select-list order. */
public record ExecutionResult(QueryPlan plan, List<Map<String, Object>> rows, int rowCount) {
  public ExecutionResult {
    Objects.requireNonNull(plan, "plan");
    rows = (rows == null) ? List.of() : rows;
  }

  public static ExecutionResult of(QueryPlan plan, List<Map<String, Object>> rows) {
    return new ExecutionResult(plan, rows, rows == null ? 0 : rows.size());
  }
}
