package io.intellixity.semantiq.jdbc;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles SQL with positional parameters ({@code $1}, {@code $2}, ...) into JDBC SQL with '?' binds.
 *
 * Rules:
 * - A parameter is '$' followed by one or more digits; the number is 1-based into the param list.
 * - Parameters inside single-quoted literals or double-quoted identifiers are ignored.
 * - A parameter may appear more than once or out of order; binds follow appearance order.
 */
public final class PositionalParamCompiler {
  private PositionalParamCompiler() {}

  public static JdbcStatement compile(String sql, List<Object> params) {
    if (sql == null) return new JdbcStatement("", List.of());
    List<Object> effective = (params == null) ? List.of() : params;

    StringBuilder out = new StringBuilder(sql.length());
    List<Object> binds = new ArrayList<>();
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        out.append(ch);
        if (ch == quote) {
          // doubled quote stays inside the literal
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            out.append(quote);
            i++;
          } else {
            quote = 0;
          }
        }
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        out.append(ch);
        continue;
      }

      if (ch == '$' && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int position = Integer.parseInt(sql.substring(i + 1, end));
        if (position < 1 || position > effective.size()) {
          throw new IllegalArgumentException("Missing query param: $" + position);
        }
        binds.add(effective.get(position - 1));
        out.append('?');
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    return new JdbcStatement(out.toString(), binds);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
