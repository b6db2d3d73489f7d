package io.intellixity.unisql.spi.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-interval polling configuration for asynchronous statements.
 *
 * @param pollInterval pause between status polls
 * @param maxWait upper bound on total polling time before the statement is abandoned
 */
public record PollingOptions(Duration pollInterval, Duration maxWait) {
  public PollingOptions {
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(maxWait, "maxWait");
    if (pollInterval.isNegative() || pollInterval.isZero()) throw new IllegalArgumentException("pollInterval must be > 0");
    if (maxWait.isNegative() || maxWait.isZero()) throw new IllegalArgumentException("maxWait must be > 0");
  }
}
