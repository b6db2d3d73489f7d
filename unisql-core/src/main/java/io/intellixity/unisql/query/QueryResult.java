package io.intellixity.unisql.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Materialised result of one (single-source or federated) query.\n
 *
 * rowCount equals rows.size() except for statements without a result set, where rows is empty and
 * rowCount carries the affected-row count reported by the backend.\n
 */
public record QueryResult(List<String> columns,
                          List<Map<String, Object>> rows,
                          long rowCount,
                          long executionTimeMs,
                          Source source) {
  public QueryResult {
    columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    // Row maps may hold null values, so they are wrapped rather than copied.
    rows = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rows, "rows")));
    Objects.requireNonNull(source, "source");
    if (rowCount < 0) throw new IllegalArgumentException("rowCount must be >= 0");
  }

  public static QueryResult of(List<String> columns, List<Map<String, Object>> rows, Source source) {
    return new QueryResult(columns, rows, rows.size(), 0, source);
  }

  /** Result of a statement that materialised no rows. */
  public static QueryResult affected(long affectedRows, Source source) {
    return new QueryResult(List.of(), List.of(), Math.max(0, affectedRows), 0, source);
  }

  public QueryResult withExecutionTimeMs(long ms) {
    return new QueryResult(columns, rows, rowCount, ms, source);
  }
}
