package io.intellixity.unisql.federation.parse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Parsed cross-source join.\n
 *
 * whereFragmentsByAlias holds, per alias, the WHERE conjuncts pushed down to that side with the alias prefix
 * removed. selectColumns is kept verbatim and is not applied to the joined output.\n
 */
public record JoinSpec(TableRef warehouse,
                       TableRef transactional,
                       JoinType joinType,
                       JoinPredicate predicate,
                       String selectColumns,
                       Map<String, List<String>> whereFragmentsByAlias,
                       OptionalInt limit) {
  public JoinSpec {
    Objects.requireNonNull(warehouse, "warehouse");
    Objects.requireNonNull(transactional, "transactional");
    Objects.requireNonNull(joinType, "joinType");
    Objects.requireNonNull(predicate, "predicate");
    Objects.requireNonNull(selectColumns, "selectColumns");
    Objects.requireNonNull(limit, "limit");
    if (warehouse.hasAlias(transactional.alias())) {
      throw new IllegalArgumentException("Join sides share alias " + warehouse.alias());
    }
    Map<String, List<String>> copy = new LinkedHashMap<>();
    copy.put(warehouse.alias(), List.of());
    copy.put(transactional.alias(), List.of());
    if (whereFragmentsByAlias != null) {
      whereFragmentsByAlias.forEach((alias, fragments) -> copy.put(alias, List.copyOf(fragments)));
    }
    whereFragmentsByAlias = Map.copyOf(copy);
    if (limit.isPresent() && limit.getAsInt() < 0) throw new IllegalArgumentException("limit must be >= 0");
  }

  public List<String> warehouseConjuncts() {
    return whereFragmentsByAlias.get(warehouse.alias());
  }

  public List<String> transactionalConjuncts() {
    return whereFragmentsByAlias.get(transactional.alias());
  }
}
