package io.intellixity.unisql.jdbc;

import io.intellixity.unisql.exec.handle.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Transactional backend handle around the process-wide pool.\n
 *
 * The pool's lifecycle belongs to whoever built it, not to the handle.\n
 */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private final String id;
  private final DataSource pool;
  private final String defaultSchema;

  public JdbcHandle(String id, DataSource pool, String defaultSchema) {
    this.id = Objects.requireNonNull(id, "id");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.defaultSchema = (defaultSchema == null || defaultSchema.isBlank()) ? null : defaultSchema.trim();
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return pool; }
  @Override public String namespace() { return defaultSchema; }

  @Override
  public String toString() {
    return "JdbcHandle{" + label() + "}";
  }
}
