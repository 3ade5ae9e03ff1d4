package io.intellixity.semantiq.planner.plan;

import java.util.List;
import java.util.Map;

/** Runs a single read statement against the row-store backend. */
public interface PlanExecutor {
  /**
   * @param sql    statement using {@code $n} positional placeholders (or none)
   * @param params values for {@code $1..$n}
   * @return rows as column-label to value maps, in select-list order
   */
  List<Map<String, Object>> query(String sql, List<Object> params);
}
