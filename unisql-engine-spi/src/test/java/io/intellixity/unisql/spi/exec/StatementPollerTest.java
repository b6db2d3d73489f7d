package io.intellixity.unisql.spi.exec;

import io.intellixity.unisql.exec.BackendQueryException;
import io.intellixity.unisql.exec.StatementAbortedException;
import io.intellixity.unisql.exec.StatementDescription;
import io.intellixity.unisql.exec.StatementFailedException;
import io.intellixity.unisql.exec.StatementHandle;
import io.intellixity.unisql.exec.StatementTimedOutException;
import io.intellixity.unisql.query.Source;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class StatementPollerTest {

  /** Virtual clock: sleeping advances time instead of blocking. */
  private static final class VirtualTime {
    final AtomicLong now = new AtomicLong();
    final List<Duration> sleeps = new ArrayList<>();

    StatementPoller poller(PollingOptions options) {
      return new StatementPoller(Source.WAREHOUSE, options, now::get, d -> {
        sleeps.add(d);
        now.addAndGet(d.toNanos());
      });
    }
  }

  private static PollingOptions options(long intervalMs, long maxWaitMs) {
    return new PollingOptions(Duration.ofMillis(intervalMs), Duration.ofMillis(maxWaitMs));
  }

  @Test
  void returnsFinishedDescription_afterRunningPolls() {
    VirtualTime t = new VirtualTime();
    Deque<StatementDescription> script = new ArrayDeque<>(List.of(
        StatementDescription.running(),
        StatementDescription.running(),
        StatementDescription.finished(true, 42)));

    StatementDescription d = t.poller(options(500, 60_000)).await(new StatementHandle("s-1"), h -> script.pop());

    assertTrue(d.hasResultSet());
    assertEquals(42, d.resultRows());
    assertEquals(2, t.sleeps.size());
    assertEquals(Duration.ofMillis(500), t.sleeps.get(0));
  }

  @Test
  void failedStatus_raisesWithBackendErrorText() {
    VirtualTime t = new VirtualTime();
    StatementFailedException ex = assertThrows(StatementFailedException.class,
        () -> t.poller(options(500, 60_000)).await(new StatementHandle("s-2"),
            h -> StatementDescription.failed("ERROR: relation \"public.nope\" does not exist")));

    assertTrue(ex.getMessage().contains("relation \"public.nope\" does not exist"));
    assertEquals("s-2", ex.statementId());
    assertEquals(Source.WAREHOUSE, ex.source());
  }

  @Test
  void abortedStatus_raisesDistinctError() {
    VirtualTime t = new VirtualTime();
    StatementAbortedException ex = assertThrows(StatementAbortedException.class,
        () -> t.poller(options(500, 60_000)).await(new StatementHandle("s-3"), h -> StatementDescription.aborted()));
    assertEquals("Query was aborted", ex.getMessage());
  }

  @Test
  void neverFinishing_timesOutInsteadOfLoopingForever() {
    VirtualTime t = new VirtualTime();
    AtomicInteger polls = new AtomicInteger();

    StatementTimedOutException ex = assertThrows(StatementTimedOutException.class,
        () -> t.poller(options(1_000, 5_000)).await(new StatementHandle("s-4"), h -> {
          polls.incrementAndGet();
          return StatementDescription.running();
        }));

    assertEquals(Duration.ofMillis(5_000), ex.maxWait());
    // Initial poll plus one per elapsed second.
    assertEquals(6, polls.get());
    assertEquals(Duration.ofSeconds(5).toNanos(), t.now.get());
  }

  @Test
  void lastSleep_isClampedToRemainingWait() {
    VirtualTime t = new VirtualTime();
    assertThrows(StatementTimedOutException.class,
        () -> t.poller(options(1_000, 2_500)).await(new StatementHandle("s-5"), h -> StatementDescription.running()));

    assertEquals(List.of(Duration.ofMillis(1_000), Duration.ofMillis(1_000), Duration.ofMillis(500)), t.sleeps);
  }

  @Test
  void perCallMaxWait_overridesDefault() {
    VirtualTime t = new VirtualTime();
    StatementTimedOutException ex = assertThrows(StatementTimedOutException.class,
        () -> t.poller(options(500, 60_000)).await(new StatementHandle("s-6"),
            h -> StatementDescription.running(), Duration.ofSeconds(1)));
    assertEquals(Duration.ofSeconds(1), ex.maxWait());
  }

  @Test
  void interruptedSleep_restoresFlagAndFails() {
    StatementPoller p = new StatementPoller(Source.WAREHOUSE, options(500, 60_000), System::nanoTime,
        d -> { throw new InterruptedException("stop"); });
    try {
      assertThrows(BackendQueryException.class,
          () -> p.await(new StatementHandle("s-7"), h -> StatementDescription.running()));
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void rejectsNonPositiveIntervals() {
    assertThrows(IllegalArgumentException.class, () -> options(0, 1_000));
    assertThrows(IllegalArgumentException.class, () -> options(500, 0));
  }
}
