package io.intellixity.semantiq.model;

import java.util.List;
import java.util.Objects;

/**
 * A queryable table inside a {@link DataModel}, bound to one physical table and one runtime engine.
 * <p>
 * {@code runtimeRef} is already quoted for its dialect and goes into FROM/JOIN verbatim.
 */
public record ModelTable(String id,
                         String dataModelId,
                         String physicalTableId,
                         String tableName,
                         String datasetName,
                         String sourceId,
                         String sourceType,
                         RuntimeEngine runtimeEngine,
                         String runtimeRef,
                         boolean executable,
                         String executableReason,
                         List<ColumnDef> columns) {
  public ModelTable {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(runtimeEngine, "runtimeEngine");
    columns = List.copyOf(columns == null ? List.of() : columns);
  }

  /** True if {@code ref} names this table either by model-table id or by physical-table id. */
  public boolean matchesRef(String ref) {
    if (ref == null) return false;
    return ref.equals(id) || ref.equals(physicalTableId);
  }

  /** Exact-name column lookup. */
  public boolean hasColumn(String name) {
    if (name == null) return false;
    for (ColumnDef c : columns) {
      if (c.name().equals(name)) return true;
    }
    return false;
  }

  /** Case-insensitive column lookup; null if absent. */
  public ColumnDef findColumnIgnoreCase(String name) {
    if (name == null) return null;
    for (ColumnDef c : columns) {
      if (c.name().equalsIgnoreCase(name)) return c;
    }
    return null;
  }

  /** Ready to appear in a plan: flagged executable and carrying a runtime reference. */
  public boolean isRunnable() {
    return executable && runtimeRef != null && !runtimeRef.isBlank();
  }

  public String label() {
    return (datasetName == null ? "dataset" : datasetName) + "." + (tableName == null ? id : tableName);
  }
}
