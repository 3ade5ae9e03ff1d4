package io.intellixity.semantiq.planner.plan;

import io.intellixity.semantiq.error.ErrorCode;
import io.intellixity.semantiq.error.SemanticQueryException;

import java.util.regex.Pattern;

/** Lexical gate for caller-supplied SQL: a single read query, no write or DDL keywords anywhere. */
final class RawSqlGuard {
  private static final Pattern READ_START = Pattern.compile("^(select|with)\\s", Pattern.CASE_INSENSITIVE);
  private static final Pattern FORBIDDEN = Pattern.compile(
      "\\b(insert|update|delete|drop|alter|truncate|create|grant|revoke)\\b", Pattern.CASE_INSENSITIVE);

  private RawSqlGuard() {}

  static String check(String rawSql) {
    String sql = (rawSql == null) ? "" : rawSql.trim();
    if (!READ_START.matcher(sql).find() || FORBIDDEN.matcher(sql).find()) {
      throw new SemanticQueryException(ErrorCode.UNSAFE_SQL, "Only read-only SELECT/CTE SQL is allowed for execution");
    }
    return sql;
  }
}
