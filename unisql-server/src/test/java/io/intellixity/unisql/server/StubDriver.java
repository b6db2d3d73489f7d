package io.intellixity.unisql.server;

import io.intellixity.unisql.exec.BackendDriver;
import io.intellixity.unisql.exec.handle.EngineHandle;
import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** In-memory backend for wiring tests; fails every call while {@link #failure} is set. */
public final class StubDriver implements BackendDriver<StubDriver.Handle> {
  public record Handle(String id, String namespace) implements EngineHandle<Object> {
    @Override public Object client() { return "stub"; }
  }

  private final Handle handle;
  private final Source source;
  public final List<String> executed = Collections.synchronizedList(new ArrayList<>());
  public volatile Function<String, QueryResult> answer;
  public volatile Map<String, List<String>> tables = new LinkedHashMap<>();
  public volatile RuntimeException failure;
  public volatile int failuresBeforeSuccess;
  public volatile int probeCalls;

  public StubDriver(Source source) {
    this.source = source;
    this.handle = new Handle(source.wireName(), "ns");
    this.answer = sql -> QueryResult.of(List.of(), List.of(), source);
  }

  public static Map<String, Object> row(Object... kv) {
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
    return m;
  }

  @Override public Handle handle() { return handle; }
  @Override public Source source() { return source; }

  @Override
  public QueryResult executeQuery(String sql) {
    executed.add(sql);
    if (failure != null) throw failure;
    return answer.apply(sql);
  }

  @Override
  public Map<String, List<String>> listTables() {
    if (failure instanceof FederationException fe) throw fe;
    return tables;
  }

  @Override
  public void probe() {
    probeCalls++;
    if (failuresBeforeSuccess > 0) {
      failuresBeforeSuccess--;
      throw new IllegalStateException(source.displayName() + " not ready");
    }
    if (failure != null) throw failure;
  }
}
