package io.intellixity.unisql.query;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which backend produced a {@link QueryResult}. */
public enum Source {
  WAREHOUSE("redshift", "Redshift"),
  TRANSACTIONAL("sqlserver", "SQL Server"),
  CROSS("cross", "Cross-source");

  private final String wireName;
  private final String displayName;

  Source(String wireName, String displayName) {
    this.wireName = wireName;
    this.displayName = displayName;
  }

  @JsonValue
  public String wireName() { return wireName; }

  public String displayName() { return displayName; }

  public static Source fromWireName(String name) {
    for (Source s : values()) {
      if (s.wireName.equalsIgnoreCase(name)) return s;
    }
    throw new IllegalArgumentException("Unknown source: " + name);
  }
}
