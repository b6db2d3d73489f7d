package io.intellixity.unisql.federation.parse;

import io.intellixity.unisql.query.QueryParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Partitions an AND-joined WHERE clause between the two join aliases for pushdown.\n
 *
 * The clause is split on the literal token {@code AND}; parentheses, {@code OR} and {@code BETWEEN ... AND}
 * are not understood. Each conjunct goes to the side whose {@code alias.} it mentions, with that prefix removed.\n
 */
public final class PredicateSplitter {
  private static final Logger log = LoggerFactory.getLogger(PredicateSplitter.class);
  private static final Pattern AND = Pattern.compile("\\s+AND\\s+", Pattern.CASE_INSENSITIVE);

  /** Conjuncts per side, in clause order. */
  public record Split(List<String> left, List<String> right, List<String> unmatched) {
    public Split {
      left = List.copyOf(left);
      right = List.copyOf(right);
      unmatched = List.copyOf(unmatched);
    }
  }

  private final UnmatchedConjunctPolicy policy;

  public PredicateSplitter(UnmatchedConjunctPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy");
  }

  public PredicateSplitter() {
    this(UnmatchedConjunctPolicy.DROP);
  }

  public Split split(String whereClause, String leftAlias, String rightAlias) {
    Objects.requireNonNull(leftAlias, "leftAlias");
    Objects.requireNonNull(rightAlias, "rightAlias");
    List<String> left = new ArrayList<>();
    List<String> right = new ArrayList<>();
    List<String> unmatched = new ArrayList<>();
    if (whereClause == null || whereClause.isBlank()) return new Split(left, right, unmatched);

    Pattern leftRef = aliasRef(leftAlias);
    Pattern rightRef = aliasRef(rightAlias);
    for (String raw : AND.split(whereClause.trim())) {
      String conjunct = raw.trim();
      if (conjunct.isEmpty()) continue;
      boolean l = leftRef.matcher(conjunct).find();
      boolean r = rightRef.matcher(conjunct).find();
      if (l && r) {
        throw QueryParseException.unsupported("WHERE condition '" + conjunct + "' references both "
            + leftAlias + " and " + rightAlias + "; only single-table conditions can be pushed down");
      }
      if (l) left.add(leftRef.matcher(conjunct).replaceAll(""));
      else if (r) right.add(rightRef.matcher(conjunct).replaceAll(""));
      else unmatched.add(conjunct);
    }

    if (!unmatched.isEmpty()) {
      if (policy == UnmatchedConjunctPolicy.REJECT) {
        throw QueryParseException.unsupported("WHERE condition '" + unmatched.get(0) + "' references neither "
            + leftAlias + " nor " + rightAlias);
      }
      log.warn("unisql.federation op=SPLIT_WHERE dropped={} aliases={},{}", unmatched, leftAlias, rightAlias);
    }
    return new Split(left, right, unmatched);
  }

  private static Pattern aliasRef(String alias) {
    return Pattern.compile("\\b" + Pattern.quote(alias) + "\\.", Pattern.CASE_INSENSITIVE);
  }
}
