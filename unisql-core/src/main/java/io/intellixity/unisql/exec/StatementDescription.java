package io.intellixity.unisql.exec;

import java.util.Objects;

/**
 * One poll of a warehouse statement.
 *
 * @param error backend error text, set only for {@link StatementStatus#FAILED}
 * @param hasResultSet false for statements that produce no rows (DDL/DML)
 * @param resultRows rows returned or affected, as reported by the backend (-1 when unknown)
 */
public record StatementDescription(StatementStatus status, String error, boolean hasResultSet, long resultRows) {
  public StatementDescription {
    Objects.requireNonNull(status, "status");
  }

  public static StatementDescription running() {
    return new StatementDescription(StatementStatus.RUNNING, null, false, -1);
  }

  public static StatementDescription finished(boolean hasResultSet, long resultRows) {
    return new StatementDescription(StatementStatus.FINISHED, null, hasResultSet, resultRows);
  }

  public static StatementDescription failed(String error) {
    return new StatementDescription(StatementStatus.FAILED, error, false, -1);
  }

  public static StatementDescription aborted() {
    return new StatementDescription(StatementStatus.ABORTED, null, false, -1);
  }
}
