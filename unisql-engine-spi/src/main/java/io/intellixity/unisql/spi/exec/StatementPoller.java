package io.intellixity.unisql.spi.exec;

import io.intellixity.unisql.exec.BackendQueryException;
import io.intellixity.unisql.exec.StatementAbortedException;
import io.intellixity.unisql.exec.StatementDescription;
import io.intellixity.unisql.exec.StatementFailedException;
import io.intellixity.unisql.exec.StatementHandle;
import io.intellixity.unisql.exec.StatementTimedOutException;
import io.intellixity.unisql.query.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Drives a submitted statement to a terminal status.\n
 *
 * Submitted -> RUNNING* -> FINISHED | FAILED | ABORTED, or timed out once maxWait has elapsed.\n
 * FINISHED returns the final description; every other exit throws.\n
 */
public final class StatementPoller {
  private static final Logger log = LoggerFactory.getLogger(StatementPoller.class);

  /** Blocking pause between polls; replaced in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
  }

  private final Source source;
  private final PollingOptions options;
  private final LongSupplier nanoClock;
  private final Sleeper sleeper;

  public StatementPoller(Source source, PollingOptions options) {
    this(source, options, System::nanoTime, d -> Thread.sleep(d.toMillis(), d.toNanosPart() % 1_000_000));
  }

  public StatementPoller(Source source, PollingOptions options, LongSupplier nanoClock, Sleeper sleeper) {
    this.source = Objects.requireNonNull(source, "source");
    this.options = Objects.requireNonNull(options, "options");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public PollingOptions options() { return options; }

  public StatementDescription await(StatementHandle handle, Function<StatementHandle, StatementDescription> status) {
    return await(handle, status, options.maxWait());
  }

  public StatementDescription await(StatementHandle handle,
                                    Function<StatementHandle, StatementDescription> status,
                                    Duration maxWait) {
    Objects.requireNonNull(handle, "handle");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(maxWait, "maxWait");

    long startedAt = nanoClock.getAsLong();
    long deadline = startedAt + maxWait.toNanos();
    long interval = options.pollInterval().toNanos();
    int polls = 0;

    while (true) {
      StatementDescription d = Objects.requireNonNull(status.apply(handle), "status description");
      polls++;
      switch (d.status()) {
        case FINISHED -> {
          if (log.isDebugEnabled()) {
            log.debug("unisql.poll_done statementId={} polls={} durationMs={}",
                handle.id(), polls, (nanoClock.getAsLong() - startedAt) / 1_000_000.0);
          }
          return d;
        }
        case FAILED -> throw new StatementFailedException(source, handle.id(), d.error());
        case ABORTED -> throw new StatementAbortedException(source, handle.id());
        case RUNNING -> { }
      }

      long remaining = deadline - nanoClock.getAsLong();
      if (remaining <= 0) {
        log.debug("unisql.poll_timeout statementId={} polls={} maxWaitMs={}", handle.id(), polls, maxWait.toMillis());
        throw new StatementTimedOutException(source, handle.id(), maxWait);
      }
      try {
        sleeper.sleep(Duration.ofNanos(Math.min(interval, remaining)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new BackendQueryException(source, "Interrupted while waiting for statement " + handle.id(), e);
      }
    }
  }
}
