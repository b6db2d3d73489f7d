package io.intellixity.unisql.spi.exec;

import io.intellixity.unisql.exec.BackendDriver;
import io.intellixity.unisql.exec.handle.EngineHandle;
import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method base for backend drivers.\n
 *
 * Responsibilities:\n
 * - Argument checks and wall-clock timing of {@link #executeQuery(String)}\n
 * - DEBUG tracing of statements, durations and row counts (never row values)\n
 * - Delegation to backend-specific hooks, which translate native errors into {@link FederationException}s\n
 */
public abstract class AbstractBackendDriver<H extends EngineHandle<?>> implements BackendDriver<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractBackendDriver.class);

  private final H handle;
  private final Source source;

  protected AbstractBackendDriver(H handle, Source source) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.source = Objects.requireNonNull(source, "source");
  }

  @Override public H handle() { return handle; }
  @Override public Source source() { return source; }

  @Override
  public final QueryResult executeQuery(String sql) {
    Objects.requireNonNull(sql, "sql");
    if (sql.isBlank()) throw new IllegalArgumentException("sql is blank");

    long start = System.nanoTime();
    debugSql("QUERY", sql);
    QueryResult result;
    try {
      result = doExecute(sql);
    } catch (FederationException e) {
      debugFailed("QUERY", e, System.nanoTime() - start);
      throw e;
    }
    long durationNanos = System.nanoTime() - start;
    debugDone("QUERY", result.rowCount(), durationNanos);
    return result.withExecutionTimeMs(durationNanos / 1_000_000);
  }

  @Override
  public final Map<String, List<String>> listTables() {
    long start = System.nanoTime();
    Map<String, List<String>> tables = doListTables();
    if (log.isDebugEnabled()) {
      long count = tables.values().stream().mapToLong(List::size).sum();
      debugDone("LIST_TABLES", count, System.nanoTime() - start);
    }
    return tables;
  }

  @Override
  public final void probe() {
    long start = System.nanoTime();
    doProbe();
    debugDone("PROBE", 0, System.nanoTime() - start);
  }

  /** Execute a statement and materialise its rows. */
  protected abstract QueryResult doExecute(String sql);

  protected abstract Map<String, List<String>> doListTables();

  protected abstract void doProbe();

  private void debugSql(String op, String sql) {
    if (!log.isDebugEnabled()) return;
    log.debug("unisql.{} op={} handle={} sql={}", source.wireName(), op, handle.label(), sql);
  }

  private void debugDone(String op, long count, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("unisql.{}_done op={} handle={} durationMs={} count={}",
        source.wireName(), op, handle.label(), durationNanos / 1_000_000.0, count);
  }

  private void debugFailed(String op, FederationException e, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("unisql.{}_failed op={} handle={} durationMs={} error={}",
        source.wireName(), op, handle.label(), durationNanos / 1_000_000.0, e.getClass().getSimpleName());
  }
}
