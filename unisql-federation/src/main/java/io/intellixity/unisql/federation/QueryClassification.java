package io.intellixity.unisql.federation;

import io.intellixity.unisql.query.Source;

/** Outcome of lexical source detection. */
public enum QueryClassification {
  WAREHOUSE,
  TRANSACTIONAL,
  CROSS,
  UNPREFIXED;

  /** Backend for single-source classifications; CROSS and UNPREFIXED have none. */
  public Source source() {
    return switch (this) {
      case WAREHOUSE -> Source.WAREHOUSE;
      case TRANSACTIONAL -> Source.TRANSACTIONAL;
      case CROSS -> Source.CROSS;
      case UNPREFIXED -> throw new IllegalStateException("Unprefixed query has no source");
    };
  }
}
