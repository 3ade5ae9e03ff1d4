package io.intellixity.semantiq.model;

import java.util.List;
import java.util.Objects;

/**
 * Row of the physical table registry (synced tables plus their runtime materialization).
 * Source of truth that {@link ModelTable} rows are healed from.
 * <p>
 * {@code projectId} is the warehouse project of the owning connection, when it has one.
 */
public record PhysicalTable(String id,
                            String tenantId,
                            String tableName,
                            String datasetName,
                            String sourceId,
                            String sourceType,
                            String projectId,
                            RuntimeEngine runtimeEngine,
                            String runtimeRef,
                            boolean executable,
                            String executableReason,
                            List<ColumnDef> columns) {
  public PhysicalTable {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(tableName, "tableName");
    runtimeEngine = (runtimeEngine == null) ? RuntimeEngine.fromSourceType(sourceType) : runtimeEngine;
    columns = List.copyOf(columns == null ? List.of() : columns);
  }

  /**
   * Runtime reference to query this table by. A warehouse table without one is addressed as
   * {@code `project.dataset.table`} when all three parts are known; otherwise null.
   */
  public String effectiveRuntimeRef() {
    if (runtimeRef != null && !runtimeRef.isBlank()) return runtimeRef;
    if (runtimeEngine == RuntimeEngine.BIGQUERY && notBlank(projectId) && notBlank(datasetName) && notBlank(tableName)) {
      return "`" + projectId + "." + datasetName + "." + tableName + "`";
    }
    return null;
  }

  private static boolean notBlank(String s) {
    return s != null && !s.isBlank();
  }
}
