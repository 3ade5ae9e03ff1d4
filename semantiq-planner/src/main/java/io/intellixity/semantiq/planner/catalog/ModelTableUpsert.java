package io.intellixity.semantiq.planner.catalog;

import io.intellixity.semantiq.model.PhysicalTable;
import io.intellixity.semantiq.model.RuntimeEngine;

import java.util.Objects;

/** Fields of a model table that are refreshed from the physical registry on every sync. */
public record ModelTableUpsert(String dataModelId,
                               String physicalTableId,
                               String tableName,
                               String datasetName,
                               String sourceId,
                               String sourceType,
                               RuntimeEngine runtimeEngine,
                               String runtimeRef) {
  public ModelTableUpsert {
    Objects.requireNonNull(dataModelId, "dataModelId");
    Objects.requireNonNull(physicalTableId, "physicalTableId");
    Objects.requireNonNull(runtimeEngine, "runtimeEngine");
  }

  public static ModelTableUpsert of(String dataModelId, PhysicalTable p) {
    return new ModelTableUpsert(dataModelId, p.id(), p.tableName(), p.datasetName(), p.sourceId(), p.sourceType(),
        p.runtimeEngine(), p.effectiveRuntimeRef());
  }
}
