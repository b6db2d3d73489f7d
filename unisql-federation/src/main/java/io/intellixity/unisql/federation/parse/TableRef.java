package io.intellixity.unisql.federation.parse;

import java.util.Objects;

/** One side of a cross-source join: {@code schema.table} as written, plus its alias. */
public record TableRef(String schema, String table, String alias) {
  public TableRef {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(alias, "alias");
  }

  public boolean hasAlias(String other) {
    return alias.equalsIgnoreCase(other);
  }
}
