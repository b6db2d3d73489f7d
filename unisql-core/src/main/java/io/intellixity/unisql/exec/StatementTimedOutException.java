package io.intellixity.unisql.exec;

import io.intellixity.unisql.query.Source;

import java.time.Duration;

/**
 * A statement did not reach a terminal status within the caller's max wait.\n
 *
 * The handle is abandoned; no cancel call is sent to the backend.\n
 */
public final class StatementTimedOutException extends BackendQueryException {
  private final String statementId;
  private final Duration maxWait;

  public StatementTimedOutException(Source source, String statementId, Duration maxWait) {
    super(source, "Query timeout: statement " + statementId + " did not finish within " + maxWait.toMillis() + "ms");
    this.statementId = statementId;
    this.maxWait = maxWait;
  }

  public String statementId() { return statementId; }

  public Duration maxWait() { return maxWait; }
}
