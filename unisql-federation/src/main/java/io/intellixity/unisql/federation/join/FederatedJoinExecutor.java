package io.intellixity.unisql.federation.join;

import io.intellixity.unisql.exec.BackendDriver;
import io.intellixity.unisql.federation.parse.JoinSpec;
import io.intellixity.unisql.federation.parse.TableRef;
import io.intellixity.unisql.query.FederatedQueryException;
import io.intellixity.unisql.query.QueryResult;
import io.intellixity.unisql.query.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a parsed cross-source join: one pushed-down sub-query per backend, both in flight at once, then
 * {@link HashJoin}.\n
 *
 * Both sub-queries always run to completion. If either fails the whole join fails; no partial rows are
 * returned.\n
 */
public final class FederatedJoinExecutor {
  private static final Logger log = LoggerFactory.getLogger(FederatedJoinExecutor.class);

  private final BackendDriver<?> warehouse;
  private final BackendDriver<?> transactional;
  private final Executor executor;

  public FederatedJoinExecutor(BackendDriver<?> warehouse, BackendDriver<?> transactional, Executor executor) {
    this.warehouse = Objects.requireNonNull(warehouse, "warehouse");
    this.transactional = Objects.requireNonNull(transactional, "transactional");
    this.executor = Objects.requireNonNull(executor, "executor");
    if (warehouse.source() != Source.WAREHOUSE) throw new IllegalArgumentException("warehouse driver has source " + warehouse.source());
    if (transactional.source() != Source.TRANSACTIONAL) {
      throw new IllegalArgumentException("transactional driver has source " + transactional.source());
    }
  }

  public QueryResult execute(JoinSpec spec) {
    Objects.requireNonNull(spec, "spec");
    long start = System.nanoTime();
    String wSql = warehouseSql(spec);
    String tSql = transactionalSql(spec);
    log.debug("unisql.federation op=SUB_QUERIES warehouse={} transactional={}", wSql, tSql);

    CompletableFuture<QueryResult> w;
    CompletableFuture<QueryResult> t;
    try {
      w = CompletableFuture.supplyAsync(() -> warehouse.executeQuery(wSql), executor);
      t = CompletableFuture.supplyAsync(() -> transactional.executeQuery(tSql), executor);
    } catch (RejectedExecutionException e) {
      throw new FederatedQueryException("Cross-source query failed: sub-query executor rejected the task", e);
    }

    try {
      CompletableFuture.allOf(w, t).join();
    } catch (CompletionException e) {
      throw failure(w, t);
    }

    QueryResult wr = w.join();
    QueryResult tr = t.join();
    QueryResult joined = HashJoin.join(spec, wr, tr);
    long ms = (System.nanoTime() - start) / 1_000_000;
    log.debug("unisql.federation_done op=JOIN type={} warehouseRows={} transactionalRows={} joinedRows={} durationMs={}",
        spec.joinType(), wr.rowCount(), tr.rowCount(), joined.rowCount(), ms);
    return joined.withExecutionTimeMs(ms);
  }

  static String warehouseSql(JoinSpec spec) {
    TableRef ref = spec.warehouse();
    return withWhere("SELECT * FROM " + ref.schema() + "." + ref.table(), spec.warehouseConjuncts());
  }

  static String transactionalSql(JoinSpec spec) {
    TableRef ref = spec.transactional();
    return withWhere("SELECT * FROM [" + ref.schema() + "].[" + ref.table() + "]", spec.transactionalConjuncts());
  }

  private static String withWhere(String select, List<String> conjuncts) {
    if (conjuncts.isEmpty()) return select;
    return select + " WHERE " + String.join(" AND ", conjuncts);
  }

  /** allOf only completes once both sides are done, so each future can be inspected without blocking. */
  private static FederatedQueryException failure(CompletableFuture<QueryResult> w, CompletableFuture<QueryResult> t) {
    Throwable wErr = causeOf(w);
    Throwable tErr = causeOf(t);
    Throwable primary = wErr != null ? wErr : tErr;
    FederatedQueryException ex = new FederatedQueryException("Cross-source query failed: " + primary.getMessage(), primary);
    if (wErr != null && tErr != null) ex.addSuppressed(tErr);
    return ex;
  }

  private static Throwable causeOf(CompletableFuture<QueryResult> f) {
    if (!f.isCompletedExceptionally()) return null;
    Throwable err = f.handle((r, e) -> e).join();
    while (err instanceof CompletionException && err.getCause() != null) err = err.getCause();
    return err;
  }
}
