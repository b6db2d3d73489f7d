package io.intellixity.unisql.federation.schema;

import java.time.Duration;
import java.time.Instant;

/** State of one backend's cached table listing; timestamps are null when nothing is cached. */
public record SchemaCacheInfo(boolean exists, Instant cachedAt, Instant expiresAt, Duration age, int tableCount) {
  static SchemaCacheInfo absent() {
    return new SchemaCacheInfo(false, null, null, null, 0);
  }
}
