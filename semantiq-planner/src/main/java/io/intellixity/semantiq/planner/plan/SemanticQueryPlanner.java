package io.intellixity.semantiq.planner.plan;

import io.intellixity.semantiq.config.PlannerConfig;
import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;
import io.intellixity.semantiq.model.Catalog;
import io.intellixity.semantiq.model.ModelTable;
import io.intellixity.semantiq.model.Relationship;
import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.plan.QueryPlan;
import io.intellixity.semantiq.planner.catalog.CatalogLoader;
import io.intellixity.semantiq.planner.graph.JoinAliasAssigner;
import io.intellixity.semantiq.planner.graph.JoinGraph;
import io.intellixity.semantiq.planner.graph.JoinPathResolver;
import io.intellixity.semantiq.planner.graph.JoinResolution;
import io.intellixity.semantiq.planner.security.RlsFilterCompiler;
import io.intellixity.semantiq.planner.security.SharePolicyResolver;
import io.intellixity.semantiq.query.FilterSpec;
import io.intellixity.semantiq.query.GroupKey;
import io.intellixity.semantiq.query.OrderKey;
import io.intellixity.semantiq.query.Projection;
import io.intellixity.semantiq.query.QueryRequest;
import io.intellixity.semantiq.security.Requester;
import io.intellixity.semantiq.security.SharePolicy;
import io.intellixity.semantiq.spi.sql.AbstractSqlDialect;
import io.intellixity.semantiq.spi.sql.BoundFilter;
import io.intellixity.semantiq.spi.sql.DiscoveredDialectRegistry;
import io.intellixity.semantiq.spi.sql.RenderCtx;
import io.intellixity.semantiq.spi.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Assembles one SQL statement from a {@link QueryRequest}.
 * <p>
 * Order of work: load catalog, scope tables, check executability and engine, resolve join paths, apply
 * share policy, render. Planning is stateless; every call works on a fresh catalog snapshot.
 */
public final class SemanticQueryPlanner {
  private static final Logger log = LoggerFactory.getLogger(SemanticQueryPlanner.class);

  private final CatalogLoader catalogLoader;
  private final SharePolicyResolver policyResolver;
  private final DiscoveredDialectRegistry dialects;
  private final PlannerConfig config;
  private final JoinPathResolver pathResolver = new JoinPathResolver();
  private final JoinAliasAssigner aliasAssigner = new JoinAliasAssigner();
  private final RlsFilterCompiler rlsCompiler = new RlsFilterCompiler();

  public SemanticQueryPlanner(CatalogLoader catalogLoader,
                              SharePolicyResolver policyResolver,
                              DiscoveredDialectRegistry dialects,
                              PlannerConfig config) {
    this.catalogLoader = Objects.requireNonNull(catalogLoader, "catalogLoader");
    this.policyResolver = Objects.requireNonNull(policyResolver, "policyResolver");
    this.dialects = Objects.requireNonNull(dialects, "dialects");
    this.config = Objects.requireNonNull(config, "config");
  }

  public QueryPlan plan(String tenantId, Requester requester, QueryRequest request) {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(request, "request");
    Catalog catalog = catalogLoader.loadCatalog(tenantId, request.dataModelId());

    // Scope: refs in request order. Filter-only tables are optional unless nothing else names a table.
    Set<String> requiredRefs = new LinkedHashSet<>(request.tableIds());
    request.select().forEach(p -> addRef(requiredRefs, p.tableRef()));
    request.groupBy().forEach(g -> addRef(requiredRefs, g.tableRef()));
    request.orderBy().forEach(o -> addRef(requiredRefs, o.tableRef()));
    Set<String> optionalRefs = new LinkedHashSet<>();
    request.filters().forEach(f -> addRef(optionalRefs, f.tableRef()));
    if (requiredRefs.isEmpty()) requiredRefs.addAll(optionalRefs);

    if (requiredRefs.isEmpty() && optionalRefs.isEmpty()) {
      throw new SemanticQueryException(ErrorCode.MISSING_TABLE_SCOPE, "At least one table must be selected");
    }

    Map<String, ModelTable> required = canonical(catalog, requiredRefs);
    Map<String, ModelTable> optional = canonical(catalog, optionalRefs);
    optional.keySet().removeAll(required.keySet());
    if (required.isEmpty() && optional.isEmpty()) {
      throw new SemanticQueryException(ErrorCode.MISSING_TABLE_SCOPE, "No selected tables found in data model");
    }

    List<ModelTable> candidates = new ArrayList<>(required.values());
    candidates.addAll(optional.values());
    checkRunnable(required.values().isEmpty() ? candidates : new ArrayList<>(required.values()));

    ModelTable root = pickRoot(catalog, request, candidates);

    JoinGraph graph = JoinGraph.of(catalog.relationships());
    JoinResolution joins = pathResolver.resolve(graph, root.id(), required.keySet(), optional.keySet(), catalog::resolveTable);

    List<ModelTable> selected = new ArrayList<>();
    for (ModelTable t : candidates) {
      if (!joins.skippedTableIds().contains(t.id())) selected.add(t);
    }
    checkRunnable(joined(catalog, selected, joins.relationships()));
    RuntimeEngine engine = selected.get(0).runtimeEngine();
    SqlDialect dialect = dialects.forEngine(engine);

    JoinAliasAssigner.Assignment aliases = aliasAssigner.assign(root.id(), joins.relationships(), catalog::resolveTable, dialect);

    SharePolicy policy = policyResolver.resolvePolicy(tenantId, requester, request.dashboardId());
    policyResolver.checkPage(policy, request.pageId());
    List<List<FilterSpec>> rlsGroups = rlsCompiler.compile(policy, candidates);

    RenderCtx ctx = new RenderCtx();
    List<String> where = new ArrayList<>();
    String userExpr = dialect.renderFilters(bindFilters(catalog, request.filters(), aliases, joins, false), ctx);
    if (!userExpr.isEmpty()) where.add(userExpr);
    for (List<FilterSpec> group : rlsGroups) {
      String rlsExpr = dialect.renderFilters(bindFilters(catalog, group, aliases, joins, true), ctx);
      if (!rlsExpr.isEmpty()) where.add(rlsExpr);
    }

    List<Projection> select = request.select().isEmpty() ? List.of(Projection.star(root.id())) : request.select();
    List<String> selectParts = new ArrayList<>();
    Set<String> implicitGroupBy = new LinkedHashSet<>();
    boolean hasAggregation = false;
    for (int i = 0; i < select.size(); i++) {
      Projection p = select.get(i);
      ModelTable t = catalog.resolveTable(p.tableRef());
      String alias = (t == null) ? null : aliases.aliasOf(t.id());
      if (alias == null) continue;

      String expr = dialect.projectionExpr(alias, p);
      if (p.aggregation().isAggregating()) {
        hasAggregation = true;
      } else if (!p.isStar()) {
        implicitGroupBy.add(dialect.columnExpr(alias, p.column(), p.hierarchyPart()));
      }

      if (p.isStar() && !p.aggregation().isAggregating()) {
        selectParts.add(expr);
      } else {
        String raw = (p.alias() != null && !p.alias().isBlank())
            ? p.alias()
            : t.tableName() + "_" + p.column() + "_" + p.aggregation().code() + "_" + i;
        selectParts.add(expr + " AS " + dialect.quoteIdent(AbstractSqlDialect.sanitizeAlias(raw, config.aliasMaxLength())));
      }
    }

    List<String> groupBy = new ArrayList<>();
    if (!request.groupBy().isEmpty()) {
      for (GroupKey g : request.groupBy()) {
        String alias = aliasFor(catalog, aliases, g.tableRef());
        if (alias == null || g.column() == null) continue;
        groupBy.add(dialect.columnExpr(alias, g.column(), g.hierarchyPart()));
      }
    } else if (hasAggregation) {
      groupBy.addAll(implicitGroupBy);
    }

    List<String> orderBy = new ArrayList<>();
    for (OrderKey o : request.orderBy()) {
      String alias = aliasFor(catalog, aliases, o.tableRef());
      if (alias == null || o.column() == null) continue;
      orderBy.add(dialect.columnExpr(alias, o.column(), o.hierarchyPart()) + " " + o.direction().name());
    }

    int limit = config.effectiveLimit(request.limit());

    List<String> lines = new ArrayList<>();
    lines.add("SELECT " + (selectParts.isEmpty() ? JoinAliasAssigner.ROOT_ALIAS + ".*" : String.join(", ", selectParts)));
    lines.add("FROM " + root.runtimeRef() + " " + JoinAliasAssigner.ROOT_ALIAS);
    lines.addAll(aliases.joinClauses());
    if (!where.isEmpty()) lines.add("WHERE " + String.join(" AND ", where));
    if (!groupBy.isEmpty()) lines.add("GROUP BY " + String.join(", ", groupBy));
    if (!orderBy.isEmpty()) lines.add("ORDER BY " + String.join(", ", orderBy));
    lines.add("LIMIT " + limit);
    String sql = String.join("\n", lines);

    if (log.isDebugEnabled()) {
      log.debug("semantiq.plan op=plan tenant={} model={} engine={} tables={} joins={} rlsGroups={} params={}",
          tenantId, catalog.model().id(), engine.id(), selected.size(), joins.relationships().size(),
          rlsGroups.size(), ctx.params().size());
    }

    return new QueryPlan(
        catalog.model().id(),
        catalog.model().name(),
        engine,
        sql,
        ctx.params(),
        QueryPlan.TableInfo.of(root),
        selected.stream().map(QueryPlan.TableInfo::of).toList(),
        joins.relationships());
  }

  private static void addRef(Set<String> refs, String ref) {
    if (ref != null && !ref.isBlank()) refs.add(ref);
  }

  /** Resolvable refs keyed by model-table id, deduplicated, in first-seen order. */
  private static Map<String, ModelTable> canonical(Catalog catalog, Set<String> refs) {
    Map<String, ModelTable> out = new LinkedHashMap<>();
    for (String ref : refs) {
      ModelTable t = catalog.resolveTable(ref);
      if (t != null) out.putIfAbsent(t.id(), t);
    }
    return out;
  }

  /** First resolvable of select, group-by, order-by, explicit refs; otherwise the first candidate. */
  private static ModelTable pickRoot(Catalog catalog, QueryRequest request, List<ModelTable> candidates) {
    List<String> refs = new ArrayList<>();
    request.select().forEach(p -> refs.add(p.tableRef()));
    request.groupBy().forEach(g -> refs.add(g.tableRef()));
    request.orderBy().forEach(o -> refs.add(o.tableRef()));
    refs.addAll(request.tableIds());
    for (String ref : refs) {
      ModelTable t = catalog.resolveTable(ref);
      if (t != null) return t;
    }
    return candidates.get(0);
  }

  private static void checkRunnable(List<ModelTable> tables) {
    for (ModelTable t : tables) {
      if (!t.isRunnable()) {
        String reason = (t.executableReason() != null && !t.executableReason().isBlank())
            ? t.executableReason()
            : "Table " + t.tableName() + " is not executable";
        throw new SemanticQueryException(ErrorCode.TABLE_NOT_EXECUTABLE, reason);
      }
    }
    Set<RuntimeEngine> engines = new LinkedHashSet<>();
    for (ModelTable t : tables) engines.add(t.runtimeEngine());
    if (engines.size() > 1) {
      throw new SemanticQueryException(ErrorCode.CROSS_SOURCE_BLOCKED,
          "Cross-source execution is blocked. Selected tables must belong to the same runtime engine.");
    }
  }

  /** Selected tables plus every intermediate table the join path passes through. */
  private static List<ModelTable> joined(Catalog catalog, List<ModelTable> selected, List<Relationship> path) {
    Map<String, ModelTable> out = new LinkedHashMap<>();
    for (ModelTable t : selected) out.put(t.id(), t);
    for (Relationship r : path) {
      for (String id : List.of(r.fromTableId(), r.toTableId())) {
        ModelTable t = catalog.resolveTable(id);
        if (t != null) out.putIfAbsent(t.id(), t);
      }
    }
    return new ArrayList<>(out.values());
  }

  private static String aliasFor(Catalog catalog, JoinAliasAssigner.Assignment aliases, String ref) {
    ModelTable t = catalog.resolveTable(ref);
    return (t == null) ? null : aliases.aliasOf(t.id());
  }

  /**
   * Resolves each filter's table to its alias. Filters on unknown tables or without a column are ignored;
   * filters on tables skipped for lack of a join path are dropped (or refused, for RLS under strict binding).
   */
  private List<BoundFilter> bindFilters(Catalog catalog,
                                        List<FilterSpec> filters,
                                        JoinAliasAssigner.Assignment aliases,
                                        JoinResolution joins,
                                        boolean fromPolicy) {
    List<BoundFilter> out = new ArrayList<>();
    for (FilterSpec f : filters) {
      ModelTable t = catalog.resolveTable(f.tableRef());
      if (t == null || f.column() == null || f.column().isBlank()) continue;
      if (joins.skippedTableIds().contains(t.id())) {
        if (fromPolicy && config.strictRlsBinding()) {
          throw new SemanticQueryException(ErrorCode.NO_RELATIONSHIP_PATH,
              "Row-level security predicate on " + t.label() + "." + f.column() + " cannot be applied: no relationship path");
        }
        log.warn("semantiq.plan op=dropFilter table={} source={} reason=noRelationshipPath",
            t.label(), fromPolicy ? "rls" : "request");
        continue;
      }
      String alias = aliases.aliasOf(t.id());
      if (alias == null) continue;
      out.add(new BoundFilter(alias, f));
    }
    return out;
  }
}
