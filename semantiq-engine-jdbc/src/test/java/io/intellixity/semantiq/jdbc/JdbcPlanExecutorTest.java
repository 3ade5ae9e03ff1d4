package io.intellixity.semantiq.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.intellixity.semantiq.jdbc.FakeJdbc.row;
import static org.junit.jupiter.api.Assertions.*;

final class JdbcPlanExecutorTest {

  @Test
  void bindsPositionalParamsAndReadsRowsInOrder() {
    LocalDateTime at = LocalDateTime.of(2024, 3, 1, 10, 30);
    FakeJdbc jdbc = new FakeJdbc().returning(List.of(
        row("region", "EU", "total", 10, "first_at", Timestamp.valueOf(at)),
        row("region", "US", "total", 7, "first_at", null)));
    JdbcPlanExecutor executor = new JdbcPlanExecutor(jdbc.dataSource(), 30);

    List<Map<String, Object>> rows = executor.query(
        "SELECT region FROM t1 WHERE (a = $1) AND (b = $2)", Arrays.asList("open", null));

    assertEquals(List.of("SELECT region FROM t1 WHERE (a = ?) AND (b = ?)"), jdbc.prepared);
    assertEquals("open", jdbc.binds.get(0).get(1));
    assertSame(FakeJdbc.NULL, jdbc.binds.get(0).get(2));
    assertEquals(30, jdbc.queryTimeout);

    assertEquals(2, rows.size());
    assertEquals(List.of("region", "total", "first_at"), List.copyOf(rows.get(0).keySet()));
    assertEquals(at, rows.get(0).get("first_at"));
    assertNull(rows.get(1).get("first_at"));
    assertEquals(0, jdbc.openConnections);
  }

  @Test
  void paramlessSqlRunsVerbatimSoQuestionMarkOperatorsSurvive() {
    FakeJdbc jdbc = new FakeJdbc().returning(List.of(row("id", 1)));
    JdbcPlanExecutor executor = new JdbcPlanExecutor(jdbc.dataSource(), 15);

    String sql = "SELECT id FROM events WHERE payload ? 'kind' AND tags ?| array['a']";
    List<Map<String, Object>> rows = executor.query(sql, List.of());

    assertEquals(List.of(sql), jdbc.executed);
    assertTrue(jdbc.prepared.isEmpty());
    assertEquals(15, jdbc.queryTimeout);
    assertEquals(1, rows.size());
    assertEquals(0, jdbc.openConnections);
  }

  @Test
  void zeroTimeoutIsNotApplied() {
    FakeJdbc jdbc = new FakeJdbc();
    new JdbcPlanExecutor(jdbc.dataSource(), 0).query("select 1", List.of());
    assertEquals(0, jdbc.queryTimeout);
  }

  @Test
  void sqlErrorsPropagateUnchecked() {
    FakeJdbc jdbc = new FakeJdbc();
    jdbc.failWith = new SQLException("relation does not exist", "42P01");
    JdbcPlanExecutor executor = new JdbcPlanExecutor(jdbc.dataSource(), 0);

    RuntimeException e = assertThrows(RuntimeException.class, () -> executor.query("select * from nope", List.of()));
    assertInstanceOf(SQLException.class, e.getCause());
    assertEquals(0, jdbc.openConnections);
  }

  @Test
  void negativeTimeoutIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new JdbcPlanExecutor(new FakeJdbc().dataSource(), -1));
  }
}
