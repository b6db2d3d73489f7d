package io.intellixity.unisql.federation.join;

import io.intellixity.unisql.federation.parse.JoinSpec;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory equi-join of a warehouse result with a transactional result.\n
 *
 * The transactional side is indexed by join key; warehouse rows drive the probe in their original order.
 * Output keys are {@code <alias>_<column>} for both sides. RIGHT and FULL append transactional rows whose key
 * no warehouse row carries, after all warehouse-driven rows. LIMIT caps the joined output only.\n
 */
public final class HashJoin {
  private HashJoin() {}

  public static QueryResult join(JoinSpec spec, QueryResult warehouse, QueryResult transactional) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(warehouse, "warehouse");
    Objects.requireNonNull(transactional, "transactional");

    int limit = spec.limit().orElse(Integer.MAX_VALUE);
    List<Map<String, Object>> out = new ArrayList<>();
    if (limit == 0) return result(out);

    String wAlias = spec.warehouse().alias();
    String tAlias = spec.transactional().alias();
    String wCol = JoinKeys.resolveColumn(warehouse.columns(), spec.predicate().warehouseColumn());
    String tCol = JoinKeys.resolveColumn(transactional.columns(), spec.predicate().transactionalColumn());

    Map<String, List<Map<String, Object>>> index = new HashMap<>();
    for (Map<String, Object> row : transactional.rows()) {
      index.computeIfAbsent(JoinKeys.of(row.get(tCol)), k -> new ArrayList<>()).add(row);
    }

    Map<String, Object> transactionalNulls = nulls(transactional.columns());
    probe:
    for (Map<String, Object> wRow : warehouse.rows()) {
      List<Map<String, Object>> matches = index.get(JoinKeys.of(wRow.get(wCol)));
      if (matches != null) {
        for (Map<String, Object> tRow : matches) {
          out.add(joined(wAlias, wRow, tAlias, tRow));
          if (out.size() >= limit) break probe;
        }
      } else if (spec.joinType().keepsUnmatchedWarehouseRows()) {
        out.add(joined(wAlias, wRow, tAlias, transactionalNulls));
        if (out.size() >= limit) break;
      }
    }

    if (spec.joinType().keepsUnmatchedTransactionalRows() && out.size() < limit) {
      Set<String> warehouseKeys = new HashSet<>();
      for (Map<String, Object> wRow : warehouse.rows()) warehouseKeys.add(JoinKeys.of(wRow.get(wCol)));

      Map<String, Object> warehouseNulls = nulls(warehouse.columns());
      for (Map<String, Object> tRow : transactional.rows()) {
        if (warehouseKeys.contains(JoinKeys.of(tRow.get(tCol)))) continue;
        out.add(joined(wAlias, warehouseNulls, tAlias, tRow));
        if (out.size() >= limit) break;
      }
    }
    return result(out);
  }

  private static QueryResult result(List<Map<String, Object>> rows) {
    // Columns come from the first joined row; no rows means no columns.
    List<String> columns = rows.isEmpty() ? List.of() : new ArrayList<>(rows.get(0).keySet());
    return QueryResult.of(columns, rows, Source.CROSS);
  }

  private static Map<String, Object> joined(String wAlias, Map<String, Object> wRow, String tAlias, Map<String, Object> tRow) {
    Map<String, Object> row = new LinkedHashMap<>();
    wRow.forEach((col, v) -> row.put(wAlias + "_" + col, v));
    tRow.forEach((col, v) -> row.put(tAlias + "_" + col, v));
    return row;
  }

  private static Map<String, Object> nulls(List<String> columns) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String c : columns) row.put(c, null);
    return row;
  }
}
