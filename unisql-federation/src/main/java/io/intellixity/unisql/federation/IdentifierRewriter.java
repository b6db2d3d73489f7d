package io.intellixity.unisql.federation;

import io.intellixity.unisql.query.Source;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Strips source prefixes and renders table references in the target backend's identifier syntax.\n
 *
 * Substitution is textual; everything outside a matched reference is left byte-for-byte intact.\n
 */
public final class IdentifierRewriter {
  private static final Pattern WAREHOUSE_REF = Pattern.compile("\\brs\\.([a-z0-9_]+)\\.([a-z0-9_]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRANSACTIONAL_BRACKETED_REF = Pattern.compile("\\bss\\.\\[([^\\]]+)\\]\\.([a-z0-9_]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern TRANSACTIONAL_REF = Pattern.compile("\\bss\\.([a-z0-9_]+)\\.([a-z0-9_]+)", Pattern.CASE_INSENSITIVE);

  public String rewrite(String sql, Source target) {
    Objects.requireNonNull(sql, "sql");
    Objects.requireNonNull(target, "target");
    return switch (target) {
      case WAREHOUSE -> WAREHOUSE_REF.matcher(sql).replaceAll("$1.$2");
      case TRANSACTIONAL -> {
        String bracketed = TRANSACTIONAL_BRACKETED_REF.matcher(sql).replaceAll("[$1].[$2]");
        yield TRANSACTIONAL_REF.matcher(bracketed).replaceAll("[$1].[$2]");
      }
      case CROSS -> throw new IllegalArgumentException("Cross-source queries are not rewritten as a whole");
    };
  }
}
