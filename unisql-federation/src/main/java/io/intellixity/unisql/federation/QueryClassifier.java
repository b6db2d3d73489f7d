package io.intellixity.unisql.federation;

import io.intellixity.unisql.query.Source;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Detects which backend(s) a query addresses from its {@code rs.} / {@code ss.} table prefixes.\n
 *
 * Purely lexical: a prefix inside a string literal or comment still counts, and one hidden by
 * unusual quoting does not.\n
 */
public final class QueryClassifier {
  static final Pattern WAREHOUSE_REF = Pattern.compile("\\brs\\.[a-z0-9_]+\\.[a-z0-9_]+", Pattern.CASE_INSENSITIVE);
  static final Pattern TRANSACTIONAL_BRACKETED_REF = Pattern.compile("\\bss\\.\\[[^\\]]+\\]\\.[a-z0-9_]+", Pattern.CASE_INSENSITIVE);
  static final Pattern TRANSACTIONAL_REF = Pattern.compile("\\bss\\.[a-z0-9_]+\\.[a-z0-9_]+", Pattern.CASE_INSENSITIVE);

  public QueryClassification classify(String sql) {
    Objects.requireNonNull(sql, "sql");
    boolean warehouse = WAREHOUSE_REF.matcher(sql).find();
    boolean transactional = TRANSACTIONAL_BRACKETED_REF.matcher(sql).find() || TRANSACTIONAL_REF.matcher(sql).find();
    if (warehouse && transactional) return QueryClassification.CROSS;
    if (warehouse) return QueryClassification.WAREHOUSE;
    if (transactional) return QueryClassification.TRANSACTIONAL;
    return QueryClassification.UNPREFIXED;
  }

  /**
   * Best-effort backend guess for a query without prefixes: {@code limit} without {@code top} suggests the
   * warehouse, anything else goes to the transactional backend.
   */
  public Source guessUnprefixed(String sql) {
    String lower = sql.toLowerCase(Locale.ROOT);
    if (lower.contains("limit ") && !lower.contains("top ")) return Source.WAREHOUSE;
    return Source.TRANSACTIONAL;
  }
}
