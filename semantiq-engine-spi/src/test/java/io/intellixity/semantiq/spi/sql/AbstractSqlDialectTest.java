package io.intellixity.semantiq.spi.sql;

import io.intellixity.semantiq.query.Aggregation;
import io.intellixity.semantiq.query.Connector;
import io.intellixity.semantiq.query.FilterOperator;
import io.intellixity.semantiq.query.FilterSpec;
import io.intellixity.semantiq.query.HierarchyPart;
import io.intellixity.semantiq.query.Projection;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AbstractSqlDialectTest {
  private final TestDialect d = new TestDialect();

  private static BoundFilter f(String column, FilterOperator op, Object value, Connector c) {
    return new BoundFilter("t1", new FilterSpec("x", column, op, value, null, null, c));
  }

  @Test
  void combinesLeftAssociatively() {
    RenderCtx ctx = new RenderCtx();
    String sql = d.renderFilters(List.of(
        f("a", FilterOperator.EQUALS, 1, Connector.OR),
        f("b", FilterOperator.EQUALS, 2, Connector.OR),
        f("c", FilterOperator.EQUALS, 3, Connector.AND)), ctx);
    assertEquals("(((t1.[a] = ?1) OR (t1.[b] = ?2)) AND (t1.[c] = ?3))", sql);
    assertEquals(List.of(1, 2, 3), ctx.params());
  }

  @Test
  void emptyFilterListRendersNothing() {
    assertEquals("", d.renderFilters(List.of(), new RenderCtx()));
  }

  @Test
  void nullLikeEqualityBecomesNullCheck() {
    RenderCtx ctx = new RenderCtx();
    assertEquals("(t1.[a] IS NULL)", d.renderFilters(List.of(f("a", FilterOperator.EQUALS, "(blank)", null)), ctx));
    assertEquals("(t1.[a] IS NOT NULL)", d.renderFilters(List.of(f("a", FilterOperator.NOT_EQUALS, " NULL ", null)), ctx));
    assertTrue(ctx.params().isEmpty());
  }

  @Test
  void textOperatorsCastAndWrap() {
    RenderCtx ctx = new RenderCtx();
    assertEquals("(TEXT(t1.[n]) LIKE ?1)", d.renderFilters(List.of(f("n", FilterOperator.CONTAINS, "ab", null)), ctx));
    assertEquals("(TEXT(t1.[n]) NOT LIKE ?2)", d.renderFilters(List.of(f("n", FilterOperator.NOT_CONTAINS, "ab", null)), ctx));
    assertEquals("(TEXT(t1.[n]) LIKE ?3)", d.renderFilters(List.of(f("n", FilterOperator.STARTS_WITH, "ab", null)), ctx));
    assertEquals("(TEXT(t1.[n]) LIKE ?4)", d.renderFilters(List.of(f("n", FilterOperator.ENDS_WITH, "ab", null)), ctx));
    assertEquals(List.of("%ab%", "%ab%", "ab%", "%ab"), ctx.params());
  }

  @Test
  void listOperators() {
    RenderCtx ctx = new RenderCtx();
    assertEquals("(t1.[s] IN (?1, ?2))", d.renderFilters(List.of(f("s", FilterOperator.IN, List.of("a", "b"), null)), ctx));
    assertEquals("(t1.[s] NOT IN (?3))", d.renderFilters(List.of(f("s", FilterOperator.NOT_IN, "c", null)), ctx));
    assertEquals("(FALSE)", d.renderFilters(List.of(f("s", FilterOperator.IN, List.of(), null)), ctx));
    assertEquals("(TRUE)", d.renderFilters(List.of(f("s", FilterOperator.NOT_IN, List.of(), null)), ctx));
    assertEquals(List.of("a", "b", "c"), ctx.params());
  }

  @Test
  void betweenAndComparisons() {
    RenderCtx ctx = new RenderCtx();
    BoundFilter between = new BoundFilter("t2", new FilterSpec("x", "d", FilterOperator.BETWEEN, 1, 9, null, null));
    assertEquals("(t2.[d] BETWEEN ?1 AND ?2)", d.renderFilters(List.of(between), ctx));
    assertEquals("(t1.[d] >= ?3)", d.renderFilters(List.of(f("d", FilterOperator.GREATER_OR_EQUAL, 5, null)), ctx));
    assertEquals("(t1.[d] IS NOT NULL)", d.renderFilters(List.of(f("d", FilterOperator.IS_NOT_NULL, 5, null)), ctx));
    assertEquals(Arrays.asList(1, 9, 5), ctx.params());
  }

  @Test
  void calendarParts() {
    assertEquals("EXTRACT(YEAR FROM t1.[d])", d.columnExpr("t1", "d", HierarchyPart.YEAR));
    assertEquals("EXTRACT(WK FROM t1.[d])", d.columnExpr("t1", "d", HierarchyPart.WEEK));
    assertEquals("CASE WHEN t1.[d] IS NULL THEN NULL WHEN EXTRACT(MONTH FROM t1.[d]) <= 6 THEN 1 ELSE 2 END",
        d.columnExpr("t1", "d", HierarchyPart.HALF));
    assertEquals("t1.[d]", d.columnExpr("t1", "d", null));
  }

  @Test
  void projections() {
    assertEquals("SUM(t1.[r])", d.projectionExpr("t1", new Projection("x", "r", Aggregation.SUM, null, null)));
    assertEquals("COUNT(DISTINCT t1.[r])", d.projectionExpr("t1", new Projection("x", "r", Aggregation.COUNT_DISTINCT, null, null)));
    assertEquals("t1.[r]", d.projectionExpr("t1", new Projection("x", "r", Aggregation.RAW, null, null)));
    assertEquals("t1.*", d.projectionExpr("t1", Projection.star("x")));
    assertEquals("MAX(EXTRACT(MONTH FROM t3.[d]))",
        d.projectionExpr("t3", new Projection("x", "d", Aggregation.MAX, null, HierarchyPart.MONTH)));
  }

  @Test
  void sanitizesAliases() {
    assertEquals("orders_total_sum_0", AbstractSqlDialect.sanitizeAlias("orders.total sum 0", 60));
    assertEquals("x", AbstractSqlDialect.sanitizeAlias("__x__", 60));
    assertEquals("col", AbstractSqlDialect.sanitizeAlias("***", 60));
    assertEquals("col", AbstractSqlDialect.sanitizeAlias(null, 60));
    assertEquals("abc", AbstractSqlDialect.sanitizeAlias("abcdef", 3));
  }
}
