package io.intellixity.unisql.exec;

public enum StatementStatus {
  RUNNING,
  FINISHED,
  FAILED,
  ABORTED
}
