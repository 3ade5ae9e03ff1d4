package io.intellixity.semantiq.jdbc;

import java.sql.Array;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads result rows as column-label maps in select-list order.
 * <p>
 * JDBC temporal types become {@code java.time} values; SQL arrays become lists; driver-specific objects
 * (json, intervals, ...) are returned as their text form.
 */
final class JdbcRows {
  private JdbcRows() {}

  static List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    for (int i = 1; i <= n; i++) labels[i - 1] = md.getColumnLabel(i);

    List<Map<String, Object>> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= n; i++) row.put(labels[i - 1], value(rs.getObject(i)));
      out.add(row);
    }
    return out;
  }

  static Object value(Object v) throws SQLException {
    if (v == null) return null;
    if (v instanceof Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof Date d) return d.toLocalDate();
    if (v instanceof Time t) return t.toLocalTime();
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) {
        List<Object> items = new ArrayList<>(oa.length);
        for (Object o : oa) items.add(value(o));
        return items;
      }
      return String.valueOf(arr);
    }
    if (v instanceof Object[] oa) return Arrays.asList(oa);
    if (v.getClass().getName().startsWith("java.")) return v;
    return v.toString();
  }
}
