package io.intellixity.unisql.query;

/**
 * Schema-qualification prefix that routes a table reference to a backend: {@code <prefix>.<schema>.<table>}.\n
 *
 * Clients embed these literally, so the tokens never change.\n
 */
public enum SourcePrefix {
  WAREHOUSE("rs", Source.WAREHOUSE),
  TRANSACTIONAL("ss", Source.TRANSACTIONAL);

  private final String token;
  private final Source source;

  SourcePrefix(String token, Source source) {
    this.token = token;
    this.source = source;
  }

  public String token() { return token; }

  public Source source() { return source; }

  /** Example of a fully qualified reference, used in help and error text. */
  public String format() {
    return token + ".schema.table";
  }
}
