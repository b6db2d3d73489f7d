package io.intellixity.unisql.exec;

import io.intellixity.unisql.exec.handle.EngineHandle;
import io.intellixity.unisql.query.QueryResult;

/**
 * Backend driver for warehouses that run statements asynchronously.\n
 *
 * Lifecycle: {@link #submitStatement(String)} returns immediately, callers poll
 * {@link #pollStatus(StatementHandle)} until a terminal status, then call
 * {@link #fetchResult(StatementHandle)} once.\n
 */
public interface WarehouseDriver<H extends EngineHandle<?>> extends BackendDriver<H> {
  StatementHandle submitStatement(String sql);

  StatementDescription pollStatus(StatementHandle handle);

  /** Retrieve the result of a FINISHED statement. A handle can be fetched at most once. */
  QueryResult fetchResult(StatementHandle handle);
}
