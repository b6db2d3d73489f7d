package io.intellixity.unisql.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Builds the shared HikariCP pool. The caller owns the returned pool and must close it at shutdown. */
public final class JdbcPools {
  private JdbcPools() {}

  public static HikariDataSource create(JdbcPoolSettings s) {
    HikariConfig hc = new HikariConfig();
    hc.setPoolName(s.poolName());
    hc.setJdbcUrl(s.jdbcUrl());
    hc.setUsername(s.username());
    hc.setPassword(s.password());
    hc.setMaximumPoolSize(s.maximumPoolSize());
    hc.setMinimumIdle(s.minimumIdle());
    hc.setIdleTimeout(s.idleTimeout().toMillis());
    hc.setConnectionTimeout(s.connectionTimeout().toMillis());
    // Start even when the database is down; requests then fail with BackendUnavailable.
    hc.setInitializationFailTimeout(-1);
    return new HikariDataSource(hc);
  }
}
