package io.intellixity.unisql.jdbc;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/** Materialises a JDBC result set into ordered column-label to value maps. */
final class JdbcResultReader {
  private JdbcResultReader() {}

  record Materialized(List<String> columns, List<Map<String, Object>> rows) {}

  static Materialized read(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> columns = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) {
      String label = md.getColumnLabel(i);
      columns.add(label == null || label.isEmpty() ? md.getColumnName(i) : label);
    }

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>(n * 2);
      for (int i = 1; i <= n; i++) {
        row.put(columns.get(i - 1), value(rs.getObject(i)));
      }
      rows.add(row);
    }
    return new Materialized(List.copyOf(new LinkedHashSet<>(columns)), rows);
  }

  private static Object value(Object v) throws SQLException {
    // LOB locators are only valid while the connection is open.
    if (v instanceof Clob c) return c.getSubString(1, (int) c.length());
    if (v instanceof Blob b) return b.getBytes(1, (int) b.length());
    return v;
  }
}
