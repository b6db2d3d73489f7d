package io.intellixity.unisql.server.startup;

import io.intellixity.unisql.exec.BackendDriver;
import io.intellixity.unisql.federation.health.BackendHealth;
import io.intellixity.unisql.federation.health.HealthProbe;
import io.intellixity.unisql.server.config.UnisqlProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Probes every backend once the context is up, retrying with a fixed backoff.\n
 *
 * Attempts run on the probe executor, never on the threads that serve federated sub-queries.\n
 *
 * Runs in the background and never fails startup: an unreachable backend is logged and requests against it
 * fail on their own.\n
 */
@Component
public final class BackendConnectivityCheck implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(BackendConnectivityCheck.class);

  /** Pause between attempts; replaced in tests. */
  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
  }

  private final List<BackendDriver<?>> drivers;
  private final ExecutorService executor;
  private final UnisqlProperties.Startup settings;
  private final Sleeper sleeper;

  @Autowired
  public BackendConnectivityCheck(List<BackendDriver<?>> drivers,
                                  @Qualifier("probeExecutor") ExecutorService probeExecutor,
                                  UnisqlProperties props) {
    this(drivers, probeExecutor, props.getStartup(), d -> Thread.sleep(d.toMillis()));
  }

  BackendConnectivityCheck(List<? extends BackendDriver<?>> drivers,
                           ExecutorService executor,
                           UnisqlProperties.Startup settings,
                           Sleeper sleeper) {
    this.drivers = List.copyOf(drivers);
    this.executor = Objects.requireNonNull(executor, "executor");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!settings.isProbeEnabled()) {
      log.info("unisql.startup op=CONNECTIVITY_CHECK skipped=true");
      return;
    }
    for (BackendDriver<?> d : drivers) CompletableFuture.runAsync(() -> awaitConnected(d), executor);
  }

  /** Returns true once a probe succeeds, false after the last attempt fails. */
  boolean awaitConnected(BackendDriver<?> driver) {
    String source = driver.source().wireName();
    int attempts = Math.max(1, settings.getProbeAttempts());
    String lastError = null;
    for (int attempt = 1; attempt <= attempts; attempt++) {
      BackendHealth h = HealthProbe.probe(driver);
      if (h.connected()) {
        log.info("unisql.startup op=CONNECTIVITY_CHECK source={} connected=true attempts={}", source, attempt);
        return true;
      }
      lastError = h.error();
      if (attempt < attempts) {
        try {
          sleeper.sleep(settings.getProbeBackoff());
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          log.warn("unisql.startup op=CONNECTIVITY_CHECK source={} interrupted=true", source);
          return false;
        }
      }
    }
    log.warn("unisql.startup op=CONNECTIVITY_CHECK source={} connected=false attempts={} error={}", source, attempts, lastError);
    return false;
  }
}
