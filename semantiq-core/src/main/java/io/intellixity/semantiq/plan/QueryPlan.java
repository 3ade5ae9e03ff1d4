package io.intellixity.semantiq.plan;

import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.model.RuntimeEngine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Output of planning: one SQL statement for one engine plus the metadata the caller needs to explain it.
 * <p>
 * {@code params} is positional ({@code $1} is index 0) and always empty for dialects that inline literals.
 */
public record QueryPlan(String dataModelId,
                        String dataModelName,
                        RuntimeEngine engine,
                        String sql,
                        List<Object> params,
                        TableInfo rootTable,
                        List<TableInfo> selectedTables,
                        List<Relationship> relationshipsUsed) {
  public QueryPlan {
    Objects.requireNonNull(engine, "engine");
    Objects.requireNonNull(sql, "sql");
    // params may legitimately contain null binds, so List.copyOf is not an option
    params = Collections.unmodifiableList(new ArrayList<>(params == null ? List.of() : params));
    selectedTables = List.copyOf(selectedTables == null ? List.of() : selectedTables);
    relationshipsUsed = List.copyOf(relationshipsUsed == null ? List.of() : relationshipsUsed);
  }

  /** Same plan metadata, different statement. */
  public QueryPlan withSql(String newSql, List<Object> newParams) {
    return new QueryPlan(dataModelId, dataModelName, engine, newSql, newParams, rootTable, selectedTables, relationshipsUsed);
  }

  public record TableInfo(String id,
                          String tableName,
                          String datasetName,
                          String sourceType,
                          RuntimeEngine runtimeEngine,
                          String runtimeRef) {
    public static TableInfo of(ModelTable t) {
      return new TableInfo(t.id(), t.tableName(), t.datasetName(), t.sourceType(), t.runtimeEngine(), t.runtimeRef());
    }
  }
}
