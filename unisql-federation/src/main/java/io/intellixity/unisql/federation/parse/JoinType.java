package io.intellixity.unisql.federation.parse;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT,
  FULL;

  /** Unmatched warehouse rows are kept with null transactional columns. */
  public boolean keepsUnmatchedWarehouseRows() {
    return this == LEFT || this == FULL;
  }

  /** Unmatched transactional rows are appended with null warehouse columns. */
  public boolean keepsUnmatchedTransactionalRows() {
    return this == RIGHT || this == FULL;
  }
}
