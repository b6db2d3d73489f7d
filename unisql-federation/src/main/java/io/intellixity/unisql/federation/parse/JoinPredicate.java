package io.intellixity.unisql.federation.parse;

import java.util.Objects;

/** Equality join condition, already oriented: one column per backend. */
public record JoinPredicate(String warehouseColumn, String transactionalColumn) {
  public JoinPredicate {
    Objects.requireNonNull(warehouseColumn, "warehouseColumn");
    Objects.requireNonNull(transactionalColumn, "transactionalColumn");
  }
}
