package io.intellixity.semantiq.spi.sql;

import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.query.HierarchyPart;
import io.intellixity.semantiq.query.Projection;

import java.util.List;

/**
 * Per-engine SQL rendering strategy: identifier quoting, calendar extraction, aggregation and
 * predicate compilation, value binding.
 * <p>
 * Implementations are stateless; per-statement state lives in {@link RenderCtx}.
 */
public interface SqlDialect {
  RuntimeEngine engine();

  default String id() { return engine().id(); }

  String quoteIdent(String ident);

  /** {@code alias.<quoted column>} */
  String columnRef(String alias, String column);

  /** Column reference with an optional calendar part applied; a null part yields the bare reference. */
  String columnExpr(String alias, String column, HierarchyPart part);

  /** Projection expression (aggregation applied, no output alias). */
  String projectionExpr(String alias, Projection projection);

  /**
   * Compiles filters into one boolean expression, combining left to right with each filter's connector.
   * Returns an empty string for an empty list.
   */
  String renderFilters(List<BoundFilter> filters, RenderCtx ctx);
}
