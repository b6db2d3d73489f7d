package io.intellixity.unisql.jdbc.dialect;

/** Vendor specifics the generic JDBC driver needs. */
public interface JdbcDialect {
  String id();

  /** Human-readable backend name used in error messages. */
  String displayName();

  /** Statement used for health probes. */
  default String probeSql() {
    return "SELECT 1";
  }

  /**
   * Catalog query returning one row per user table, with columns {@code schema_name} and {@code table_name},
   * ordered by schema then table.
   */
  String tableCatalogSql();
}
