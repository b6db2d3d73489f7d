package io.intellixity.unisql.query;

/** Raised when a cross-source query does not match the supported join grammar. */
public final class QueryParseException extends FederationException {
  public static final String SUPPORTED_FORMAT =
      "SELECT * FROM rs.schema.table alias1 [INNER|LEFT|RIGHT|FULL] JOIN ss.[schema].table alias2 "
          + "ON alias1.col = alias2.col [WHERE ...] [LIMIT n]";

  public QueryParseException(String message) {
    super(message);
  }

  /** Message that names the problem and repeats the supported format. */
  public static QueryParseException unsupported(String problem) {
    return new QueryParseException("Could not parse cross-source query: " + problem
        + ". Supported format: " + SUPPORTED_FORMAT);
  }
}
