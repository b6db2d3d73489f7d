package io.intellixity.unisql.exec;

import io.intellixity.unisql.query.Source;

/** The warehouse reported FAILED for a statement; the message carries the backend's error text. */
public final class StatementFailedException extends BackendQueryException {
  private final String statementId;
  private final String backendError;

  public StatementFailedException(Source source, String statementId, String backendError) {
    super(source, "Query failed: " + backendError);
    this.statementId = statementId;
    this.backendError = backendError;
  }

  public String statementId() { return statementId; }

  public String backendError() { return backendError; }
}
