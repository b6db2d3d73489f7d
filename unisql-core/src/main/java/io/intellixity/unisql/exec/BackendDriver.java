package io.intellixity.unisql.exec;

import io.intellixity.unisql.exec.handle.EngineHandle;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;

import java.util.List;
import java.util.Map;

/** Executes single-source SQL against one backend. */
public interface BackendDriver<H extends EngineHandle<?>> {
  /** Returns the engine handle used by this instance. */
  H handle();

  /** Which backend this driver talks to. */
  Source source();

  /** Run one statement in the backend's native dialect. */
  QueryResult executeQuery(String sql);

  /** Schema name to table names, in the backend's catalog order. */
  Map<String, List<String>> listTables();

  /** Round-trip a trivial statement; throws if the backend cannot be reached. */
  void probe();
}
