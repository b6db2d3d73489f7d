package io.intellixity.unisql.jdbc;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and timeouts of the process-wide connection pool.
 *
 * @param connectionTimeout how long a caller may wait to borrow a connection before the pool gives up
 */
public record JdbcPoolSettings(String poolName,
                               String jdbcUrl,
                               String username,
                               String password,
                               int maximumPoolSize,
                               int minimumIdle,
                               Duration idleTimeout,
                               Duration connectionTimeout) {
  public JdbcPoolSettings {
    Objects.requireNonNull(poolName, "poolName");
    Objects.requireNonNull(jdbcUrl, "jdbcUrl");
    Objects.requireNonNull(idleTimeout, "idleTimeout");
    Objects.requireNonNull(connectionTimeout, "connectionTimeout");
    if (jdbcUrl.isBlank()) throw new IllegalArgumentException("jdbcUrl is blank");
    if (maximumPoolSize <= 0) throw new IllegalArgumentException("maximumPoolSize must be > 0");
    if (minimumIdle < 0 || minimumIdle > maximumPoolSize) {
      throw new IllegalArgumentException("minimumIdle must be between 0 and maximumPoolSize");
    }
  }
}
