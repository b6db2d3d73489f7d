package io.intellixity.unisql.federation.parse;

/** What to do with a WHERE conjunct that references neither join alias. */
public enum UnmatchedConjunctPolicy {
  /** Leave it out of both sub-queries and log a warning. */
  DROP,
  /** Fail the query with a parse error. */
  REJECT
}
