package io.intellixity.semantiq.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** JDBC-ready statement: {@code ?} placeholders plus their values in placeholder order. */
public record JdbcStatement(String sql, List<Object> binds) {
  public JdbcStatement {
    binds = Collections.unmodifiableList(new ArrayList<>(binds == null ? List.of() : binds));
  }
}
