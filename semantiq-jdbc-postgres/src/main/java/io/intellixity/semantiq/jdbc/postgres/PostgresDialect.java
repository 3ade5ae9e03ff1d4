package io.intellixity.semantiq.jdbc.postgres;

import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.spi.sql.AbstractSqlDialect;
import io.intellixity.semantiq.spi.sql.RenderCtx;

/**
 * Postgres dialect.
 *
 * Values are bound as positional {@code $n} parameters; text matching is case-insensitive ({@code ILIKE}).
 * Generic rendering lives in {@link AbstractSqlDialect}.
 */
public final class PostgresDialect extends AbstractSqlDialect {
  @Override public RuntimeEngine engine() { return RuntimeEngine.POSTGRES; }

  @Override
  public String quoteIdent(String ident) {
    String s = (ident == null) ? "" : ident;
    return "\"" + s.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String value(Object value, RenderCtx ctx) {
    return "$" + ctx.add(value);
  }

  @Override
  protected String textCast(String expr) {
    return "CAST(" + expr + " AS TEXT)";
  }

  @Override protected String likeOperator() { return "ILIKE"; }

  @Override protected String weekField() { return "WEEK"; }
}
