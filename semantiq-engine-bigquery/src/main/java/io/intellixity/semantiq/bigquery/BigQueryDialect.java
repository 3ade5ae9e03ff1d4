package io.intellixity.semantiq.bigquery;

import io.intellixity.semantiq.model.RuntimeEngine;
import io.intellixity.semantiq.spi.sql.AbstractSqlDialect;
import io.intellixity.semantiq.spi.sql.RenderCtx;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * BigQuery Standard SQL dialect.
 * <p>
 * Statements are handed to the caller as text, so every value is inlined as a literal and the render
 * context never receives parameters. Identifiers are backtick-quoted with embedded backticks removed.
 */
public final class BigQueryDialect extends AbstractSqlDialect {
  @Override public RuntimeEngine engine() { return RuntimeEngine.BIGQUERY; }

  @Override
  public String quoteIdent(String ident) {
    String s = (ident == null) ? "" : ident;
    return "`" + s.replace("`", "") + "`";
  }

  @Override
  protected String value(Object value, RenderCtx ctx) {
    return literal(value);
  }

  @Override
  protected String textCast(String expr) {
    return "CAST(" + expr + " AS STRING)";
  }

  @Override protected String likeOperator() { return "LIKE"; }

  @Override protected String weekField() { return "ISOWEEK"; }

  /** NULL, finite numbers as written, TRUE/FALSE, everything else as an escaped single-quoted string. */
  static String literal(Object value) {
    if (value == null) return "NULL";
    if (value instanceof Boolean b) return b ? "TRUE" : "FALSE";
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof BigDecimal bd) return plain(bd);
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isFinite(d)) return plain(BigDecimal.valueOf(d));
    }
    return quoted(String.valueOf(value));
  }

  /** Backslash escapes inside BigQuery string literals; quotes and control characters use them too. */
  static String quoted(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('\'');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '\'' -> sb.append("\\'");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20 || c == 0x7f) sb.append(String.format("\\u%04x", (int) c));
          else sb.append(c);
        }
      }
    }
    return sb.append('\'').toString();
  }

  private static String plain(BigDecimal bd) {
    if (bd.signum() == 0) return "0";
    return bd.stripTrailingZeros().toPlainString();
  }
}
