package io.intellixity.semantiq.spi.sql;

import io.intellixity.semantiq.query.FilterOperator;
import io.intellixity.semantiq.query.FilterSpec;
import io.intellixity.semantiq.query.HierarchyPart;
import io.intellixity.semantiq.query.NullLikeValues;
import io.intellixity.semantiq.query.Projection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Shared predicate and projection compiler.
 * <p>
 * Dialects supply identifier quoting, value placement (bound parameter or inline literal), the text cast
 * and pattern operator, and the calendar field used for weeks.
 */
public abstract class AbstractSqlDialect implements SqlDialect {

  /** Renders {@code value} into the statement, either as a placeholder registered in {@code ctx} or inline. */
  protected abstract String value(Object value, RenderCtx ctx);

  /** Expression casting {@code expr} to the dialect's text type. */
  protected abstract String textCast(String expr);

  /** Pattern match keyword ({@code ILIKE}, {@code LIKE}). */
  protected abstract String likeOperator();

  protected abstract String weekField();

  @Override
  public String columnRef(String alias, String column) {
    return alias + "." + quoteIdent(column);
  }

  @Override
  public String columnExpr(String alias, String column, HierarchyPart part) {
    String base = columnRef(alias, column);
    if (part == null) return base;
    return switch (part) {
      case HALF -> "CASE WHEN " + base + " IS NULL THEN NULL WHEN EXTRACT(MONTH FROM " + base + ") <= 6 THEN 1 ELSE 2 END";
      case WEEK -> "EXTRACT(" + weekField() + " FROM " + base + ")";
      default -> "EXTRACT(" + part.name() + " FROM " + base + ")";
    };
  }

  @Override
  public String projectionExpr(String alias, Projection p) {
    String expr = p.isStar() ? alias + ".*" : columnExpr(alias, p.column(), p.hierarchyPart());
    return switch (p.aggregation()) {
      case NONE, RAW -> expr;
      case COUNT_DISTINCT -> "COUNT(DISTINCT " + expr + ")";
      default -> p.aggregation().name() + "(" + expr + ")";
    };
  }

  @Override
  public String renderFilters(List<BoundFilter> filters, RenderCtx ctx) {
    if (filters == null || filters.isEmpty()) return "";
    String acc = null;
    for (BoundFilter bf : filters) {
      String sql = renderFilter(bf.alias(), bf.filter(), ctx);
      acc = (acc == null)
          ? "(" + sql + ")"
          : "(" + acc + " " + bf.filter().connector().name() + " (" + sql + "))";
    }
    return acc;
  }

  protected String renderFilter(String alias, FilterSpec f, RenderCtx ctx) {
    String expr = columnExpr(alias, f.column(), f.hierarchyPart());
    Object v = f.value();

    return switch (f.operator()) {
      case EQUALS -> NullLikeValues.isNullLike(v) ? expr + " IS NULL" : expr + " = " + value(v, ctx);
      case NOT_EQUALS -> NullLikeValues.isNullLike(v) ? expr + " IS NOT NULL" : expr + " != " + value(v, ctx);
      case CONTAINS -> likeSql(expr, false, "%" + v + "%", ctx);
      case NOT_CONTAINS -> likeSql(expr, true, "%" + v + "%", ctx);
      case STARTS_WITH -> likeSql(expr, false, v + "%", ctx);
      case ENDS_WITH -> likeSql(expr, false, "%" + v, ctx);
      case GREATER_THAN -> expr + " > " + value(v, ctx);
      case GREATER_OR_EQUAL -> expr + " >= " + value(v, ctx);
      case LESS_THAN -> expr + " < " + value(v, ctx);
      case LESS_OR_EQUAL -> expr + " <= " + value(v, ctx);
      case BETWEEN -> expr + " BETWEEN " + value(v, ctx) + " AND " + value(f.value2(), ctx);
      case IN -> listSql(expr, FilterOperator.IN, toList(v), ctx);
      case NOT_IN -> listSql(expr, FilterOperator.NOT_IN, toList(v), ctx);
      case IS_NULL -> expr + " IS NULL";
      case IS_NOT_NULL -> expr + " IS NOT NULL";
    };
  }

  private String likeSql(String expr, boolean not, String pattern, RenderCtx ctx) {
    return textCast(expr) + (not ? " NOT " : " ") + likeOperator() + " " + value(pattern, ctx);
  }

  private String listSql(String expr, FilterOperator op, List<Object> vals, RenderCtx ctx) {
    boolean not = (op == FilterOperator.NOT_IN);
    if (vals.isEmpty()) return not ? "TRUE" : "FALSE";
    List<String> ph = new ArrayList<>(vals.size());
    for (Object x : vals) ph.add(value(x, ctx));
    return expr + (not ? " NOT IN (" : " IN (") + String.join(", ", ph) + ")";
  }

  private static List<Object> toList(Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    List<Object> one = new ArrayList<>(1);
    one.add(v);
    return one;
  }

  /**
   * Output alias normalization: characters outside {@code [A-Za-z0-9_]} become {@code _}, leading and
   * trailing underscores are dropped, the result is cut to {@code maxLength} and defaults to {@code col}.
   */
  public static String sanitizeAlias(String raw, int maxLength) {
    String s = (raw == null) ? "" : raw.replaceAll("[^a-zA-Z0-9_]", "_");
    s = s.replaceAll("^_+|_+$", "");
    if (s.length() > maxLength) s = s.substring(0, maxLength);
    return s.isEmpty() ? "col" : s;
  }
}
