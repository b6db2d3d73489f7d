package io.intellixity.unisql.exec;

import io.intellixity.unisql.query.Source;

public final class StatementAbortedException extends BackendQueryException {
  private final String statementId;

  public StatementAbortedException(Source source, String statementId) {
    super(source, "Query was aborted");
    this.statementId = statementId;
  }

  public String statementId() { return statementId; }
}
