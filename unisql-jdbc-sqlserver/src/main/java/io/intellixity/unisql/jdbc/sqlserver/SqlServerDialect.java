package io.intellixity.unisql.jdbc.sqlserver;

import io.intellixity.unisql.jdbc.dialect.JdbcDialect;

/** SQL Server dialect for the transactional driver. The catalog covers user tables only. */
public final class SqlServerDialect implements JdbcDialect {
  static final String TABLE_CATALOG_SQL =
      "SELECT s.name AS schema_name, t.name AS table_name "
          + "FROM sys.schemas s "
          + "INNER JOIN sys.tables t ON s.schema_id = t.schema_id "
          + "ORDER BY s.name, t.name";

  @Override public String id() { return "sqlserver"; }

  @Override public String displayName() { return "SQL Server"; }

  @Override public String tableCatalogSql() { return TABLE_CATALOG_SQL; }
}
