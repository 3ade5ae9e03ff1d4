package io.intellixity.semantiq.planner.plan;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.Cardinality;
import io.intellixity.semantiq.model.Catalog;
import io.intellixity.semantiq.model.CrossFilterDirection;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.plan.ExecutionResult;
import io.intellixity.semantiq.plan.QueryPlan;
import io.intellixity.semantiq.planner.catalog.CatalogLoader;
import io.intellixity.semantiq.planner.catalog.CatalogStore;
import io.intellixity.semantiq.planner.catalog.RelationshipValidator;
import io.intellixity.semantiq.query.Projection;
import io.intellixity.semantiq.query.QueryRequest;
import io.intellixity.semantiq.security.Requester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for planning, executing and relationship maintenance.
 * <p>
 * Execution is supported for the row store only; warehouse plans are returned as SQL text by {@link #plan}.
 */
public final class SemanticQueryService {
  private static final Logger log = LoggerFactory.getLogger(SemanticQueryService.class);

  private final SemanticQueryPlanner planner;
  private final PlanExecutor executor;
  private final CatalogLoader catalogLoader;
  private final CatalogStore catalogStore;
  private final RelationshipValidator relationshipValidator;

  public SemanticQueryService(SemanticQueryPlanner planner,
                              PlanExecutor executor,
                              CatalogLoader catalogLoader,
                              CatalogStore catalogStore,
                              RelationshipValidator relationshipValidator) {
    this.planner = Objects.requireNonNull(planner, "planner");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.catalogLoader = Objects.requireNonNull(catalogLoader, "catalogLoader");
    this.catalogStore = Objects.requireNonNull(catalogStore, "catalogStore");
    this.relationshipValidator = Objects.requireNonNull(relationshipValidator, "relationshipValidator");
  }

  public QueryPlan plan(String tenantId, Requester requester, QueryRequest request) {
    return planner.plan(tenantId, requester, request);
  }

  /** Plans and runs the request; a request carrying {@code rawSql} takes the raw path. */
  public ExecutionResult execute(String tenantId, Requester requester, QueryRequest request) {
    if (request.hasRawSql()) return executeRaw(tenantId, requester, request);

    QueryPlan plan = planner.plan(tenantId, requester, request);
    requireRowStore(plan);
    List<Map<String, Object>> rows = executor.query(plan.sql(), plan.params());
    if (log.isDebugEnabled()) log.debug("semantiq.exec op=execute tenant={} rows={}", tenantId, rows.size());
    return ExecutionResult.of(plan, rows);
  }

  /**
   * Runs caller-written SQL after validating its declared table scope by planning a one-row star select over
   * {@code tableIds} (executability, engine and page checks apply). Row predicates from share policy are not
   * injected into the caller's SQL.
   */
  public ExecutionResult executeRaw(String tenantId, Requester requester, QueryRequest request) {
    String sql = RawSqlGuard.check(request.rawSql());
    if (request.tableIds().isEmpty()) {
      throw new SemanticQueryException(ErrorCode.MISSING_TABLE_SCOPE, "tableIds are required when executing raw SQL");
    }

    QueryRequest scope = QueryRequest.builder()
        .dataModelId(request.dataModelId())
        .tableIds(request.tableIds())
        .select(List.of(Projection.star(request.tableIds().get(0))))
        .dashboardId(request.dashboardId())
        .pageId(request.pageId())
        .limit(1)
        .build();
    QueryPlan validation = planner.plan(tenantId, requester, scope);
    requireRowStore(validation);

    List<Map<String, Object>> rows = executor.query(sql, List.of());
    log.info("semantiq.exec op=executeRaw tenant={} tables={} rows={}", tenantId, request.tableIds().size(), rows.size());
    return ExecutionResult.of(validation.withSql(sql, List.of()), rows);
  }

  /** Validates and stores a relationship of the named (or default) model. */
  public Relationship upsertRelationship(String tenantId, RelationshipDraft draft) {
    Catalog catalog = catalogLoader.loadCatalog(tenantId, draft.dataModelId());
    ModelTable from = catalog.resolveTable(draft.fromTableId());
    ModelTable to = catalog.resolveTable(draft.toTableId());
    if (from == null || to == null) {
      throw new SemanticQueryException(ErrorCode.INVALID_RELATIONSHIP, "fromTableId/toTableId not found in data model");
    }
    String fromColumn = (draft.fromColumn() == null) ? "" : draft.fromColumn().trim();
    String toColumn = (draft.toColumn() == null) ? "" : draft.toColumn().trim();
    if (fromColumn.isEmpty() || toColumn.isEmpty()) {
      throw new SemanticQueryException(ErrorCode.INVALID_RELATIONSHIP, "fromColumn and toColumn are required");
    }

    Cardinality cardinality = Cardinality.fromCode(draft.cardinality());
    RelationshipValidator.Result v = relationshipValidator.validate(from, fromColumn, to, toColumn, cardinality);
    Relationship saved = catalogStore.upsertRelationship(new Relationship(
        null,
        catalog.model().id(),
        from.id(), from.tableName(), fromColumn,
        to.id(), to.tableName(), toColumn,
        cardinality,
        CrossFilterDirection.fromCode(draft.crossFilterDirection()),
        v.status(),
        v.reason(),
        null));
    log.info("semantiq.catalog op=upsertRelationship model={} status={}", catalog.model().id(), v.status().code());
    return saved;
  }

  private static void requireRowStore(QueryPlan plan) {
    if (plan.engine() != RuntimeEngine.POSTGRES) {
      throw new SemanticQueryException(ErrorCode.ENGINE_NOT_SUPPORTED,
          "Execution endpoint only supports postgres runtime. Use /query/plan for bigquery SQL.");
    }
  }
}
