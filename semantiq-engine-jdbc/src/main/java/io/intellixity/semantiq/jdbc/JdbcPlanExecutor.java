package io.intellixity.semantiq.jdbc;

import io.intellixity.semantiq.planner.plan.PlanExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Row-store executor: one read-only statement per call on a pooled connection. */
public final class JdbcPlanExecutor implements PlanExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcPlanExecutor.class);

  private final DataSource ds;
  private final int queryTimeoutSeconds;

  /** @param queryTimeoutSeconds statement timeout; 0 means none */
  public JdbcPlanExecutor(DataSource ds, int queryTimeoutSeconds) {
    this.ds = Objects.requireNonNull(ds, "ds");
    if (queryTimeoutSeconds < 0) throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0");
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  /**
   * Without params the SQL runs verbatim on a plain {@link Statement}, so caller SQL may use the Postgres
   * {@code ?} operators; with params {@code $n} placeholders are compiled to JDBC binds.
   */
  @Override
  public List<Map<String, Object>> query(String sql, List<Object> params) {
    boolean plain = params == null || params.isEmpty();
    JdbcStatement st = plain ? new JdbcStatement(sql, List.of()) : PositionalParamCompiler.compile(sql, params);
    long start = System.nanoTime();
    debugSql(st);
    try (Connection c = ds.getConnection()) {
      c.setReadOnly(true);
      try {
        List<Map<String, Object>> rows = plain ? runPlain(c, st.sql()) : runPrepared(c, st);
        if (log.isDebugEnabled()) {
          log.debug("semantiq.jdbc_done op=SELECT durationMs={} rows={}", (System.nanoTime() - start) / 1_000_000.0, rows.size());
        }
        return rows;
      } finally {
        c.setReadOnly(false);
      }
    } catch (SQLException e) {
      throw new RuntimeException(e);
    }
  }

  private List<Map<String, Object>> runPlain(Connection c, String sql) throws SQLException {
    try (Statement s = c.createStatement()) {
      if (queryTimeoutSeconds > 0) s.setQueryTimeout(queryTimeoutSeconds);
      try (ResultSet rs = s.executeQuery(sql)) {
        return JdbcRows.readAll(rs);
      }
    }
  }

  private List<Map<String, Object>> runPrepared(Connection c, JdbcStatement st) throws SQLException {
    try (PreparedStatement ps = c.prepareStatement(st.sql())) {
      if (queryTimeoutSeconds > 0) ps.setQueryTimeout(queryTimeoutSeconds);
      bindAll(ps, st.binds());
      try (ResultSet rs = ps.executeQuery()) {
        return JdbcRows.readAll(rs);
      }
    }
  }

  private static void bindAll(PreparedStatement ps, List<Object> binds) throws SQLException {
    for (int i = 0; i < binds.size(); i++) {
      Object v = binds.get(i);
      if (v == null) ps.setNull(i + 1, Types.NULL);
      else ps.setObject(i + 1, v);
    }
  }

  private static void debugSql(JdbcStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("semantiq.jdbc op=SELECT bindCount={} sql={}", st.binds().size(), st.sql());

    // TRACE: bind types only, never values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : st.binds()) {
        log.trace("semantiq.jdbc bind index={} valueType={} valueLen={}", idx++,
            v == null ? "null" : v.getClass().getName(), (v instanceof CharSequence cs) ? cs.length() : -1);
      }
    }
  }
}
