package io.intellixity.semantiq.planner.catalog;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.Catalog;
import io.intellixity.semantiq.model.DataModel;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.PhysicalTable;
import io.intellixity.semantiq.model.Relationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Loads a tenant's data model for one planning call.
 * <p>
 * Every load first heals the model from the physical registry ({@link #syncCatalog}), so newly synced
 * tables become queryable without an explicit registration step. Model tables are never deleted here.
 */
public final class CatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);

  private final CatalogStore store;

  public CatalogLoader(CatalogStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  public Catalog loadCatalog(String tenantId, String dataModelId) {
    Objects.requireNonNull(tenantId, "tenantId");
    DataModel model = resolveModel(tenantId, dataModelId);
    syncCatalog(tenantId, model);

    List<ModelTable> tables = store.listModelTables(tenantId, model.id());
    List<Relationship> relationships = store.listRelationships(model.id());
    if (log.isDebugEnabled()) {
      log.debug("semantiq.catalog op=load tenant={} model={} tables={} relationships={}",
          tenantId, model.id(), tables.size(), relationships.size());
    }
    return new Catalog(model, tables, relationships);
  }

  /** Upserts one model table per active physical table of the tenant. Idempotent. */
  public int syncCatalog(String tenantId, DataModel model) {
    List<PhysicalTable> physical = store.listPhysicalTables(tenantId);
    for (PhysicalTable p : physical) {
      store.upsertModelTable(ModelTableUpsert.of(model.id(), p));
    }
    if (log.isDebugEnabled()) log.debug("semantiq.catalog op=sync model={} upserts={}", model.id(), physical.size());
    return physical.size();
  }

  /** The named model (must belong to the tenant) or the tenant's default, created on first use. */
  public DataModel resolveModel(String tenantId, String dataModelId) {
    if (dataModelId == null || dataModelId.isBlank()) return ensureDefaultModel(tenantId);
    DataModel m = store.findModel(tenantId, dataModelId);
    if (m == null) throw new SemanticQueryException(ErrorCode.DATA_MODEL_NOT_FOUND, "Data model not found");
    return m;
  }

  public DataModel ensureDefaultModel(String tenantId) {
    DataModel m = store.findDefaultModel(tenantId);
    if (m != null) return m;
    log.info("semantiq.catalog op=createDefaultModel tenant={}", tenantId);
    return store.createDefaultModel(tenantId, DataModel.DEFAULT_NAME);
  }
}
