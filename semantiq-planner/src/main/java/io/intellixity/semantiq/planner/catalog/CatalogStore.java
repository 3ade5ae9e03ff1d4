package io.intellixity.semantiq.planner.catalog;

import io.intellixity.semantiq.model.DataModel;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.PhysicalTable;
import io.intellixity.semantiq.model.Relationship;

import java.util.List;

/** Catalog and metadata persistence. All lookups are tenant-scoped. */
public interface CatalogStore {
  /** The model with this id if it belongs to the tenant, else null. */
  DataModel findModel(String tenantId, String dataModelId);

  /** The tenant's oldest default model, else null. */
  DataModel findDefaultModel(String tenantId);

  /**
   * Creates the tenant's default model. Implementations must tolerate a concurrent creator and return
   * whichever default ends up persisted.
   */
  DataModel createDefaultModel(String tenantId, String name);

  /** Active physical tables of the tenant (not deleted, on a live connection). */
  List<PhysicalTable> listPhysicalTables(String tenantId);

  /** Insert or refresh the model table bound to {@code row.physicalTableId()} inside {@code row.dataModelId()}. */
  void upsertModelTable(ModelTableUpsert row);

  /** Model tables whose physical table is still active, ordered by dataset then table name. */
  List<ModelTable> listModelTables(String tenantId, String dataModelId);

  /** Relationships of the model in creation order. */
  List<Relationship> listRelationships(String dataModelId);

  /**
   * Insert or update keyed by (model, from table, from column, to table, to column).
   * Returns the persisted row.
   */
  Relationship upsertRelationship(Relationship relationship);
}
