package io.intellixity.unisql.federation;

import io.intellixity.unisql.federation.parse.JoinSpec;
import io.intellixity.unisql.query.Source;

import java.util.Objects;

/**
 * Routing decision for one query.\n
 *
 * Single-source routes carry the backend SQL to run; cross-source routes carry the parsed join instead.\n
 */
public record RoutedQuery(QueryClassification classification, Source target, String backendSql, JoinSpec join) {
  public RoutedQuery {
    Objects.requireNonNull(classification, "classification");
    Objects.requireNonNull(target, "target");
    if (target == Source.CROSS) Objects.requireNonNull(join, "join");
    else Objects.requireNonNull(backendSql, "backendSql");
  }

  static RoutedQuery single(QueryClassification classification, Source target, String backendSql) {
    return new RoutedQuery(classification, target, backendSql, null);
  }

  static RoutedQuery cross(JoinSpec join) {
    return new RoutedQuery(QueryClassification.CROSS, Source.CROSS, null, join);
  }
}
