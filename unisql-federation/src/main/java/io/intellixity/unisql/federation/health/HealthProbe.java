package io.intellixity.unisql.federation.health;

import io.intellixity.unisql.exec.BackendDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Probes both backends concurrently. Never throws for a backend failure; the report carries it.\n
 *
 * A probe still running after the timeout is reported as down. Its task keeps its thread until the driver
 * gives up, so the executor should not be the one serving queries.\n
 */
public final class HealthProbe {
  private static final Logger log = LoggerFactory.getLogger(HealthProbe.class);

  private final BackendDriver<?> warehouse;
  private final BackendDriver<?> transactional;
  private final Executor executor;
  private final Duration timeout;

  public HealthProbe(BackendDriver<?> warehouse, BackendDriver<?> transactional, Executor executor, Duration timeout) {
    this.warehouse = Objects.requireNonNull(warehouse, "warehouse");
    this.transactional = Objects.requireNonNull(transactional, "transactional");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) throw new IllegalArgumentException("timeout must be > 0");
  }

  public HealthReport check() {
    CompletableFuture<BackendHealth> w = probeAsync(warehouse);
    CompletableFuture<BackendHealth> t = probeAsync(transactional);
    return new HealthReport(w.join(), t.join());
  }

  private CompletableFuture<BackendHealth> probeAsync(BackendDriver<?> driver) {
    BackendHealth timedOut = BackendHealth.down("Probe timed out after " + timeout.toMillis() + " ms");
    return CompletableFuture.supplyAsync(() -> probe(driver), executor)
        .completeOnTimeout(timedOut, timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Single blocking probe of one backend. */
  public static BackendHealth probe(BackendDriver<?> driver) {
    try {
      driver.probe();
      return BackendHealth.up();
    } catch (RuntimeException e) {
      String msg = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
      log.debug("unisql.health op=PROBE source={} connected=false error={}", driver.source().wireName(), msg);
      return BackendHealth.down(msg);
    }
  }
}
