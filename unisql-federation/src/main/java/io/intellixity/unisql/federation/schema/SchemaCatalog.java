package io.intellixity.unisql.federation.schema;

import io.intellixity.unisql.exec.BackendDriver;
import io.intellixity.unisql.federation.internal.LruTtlCache;
import io.intellixity.unisql.query.FederationException;
import io.intellixity.unisql.query.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * TTL-cached schema-to-tables snapshot per backend.\n
 *
 * A listing failure is logged and answered with an empty map that is not cached, so the next call retries.
 * The query path never consults this catalog.\n
 */
public final class SchemaCatalog {
  private static final Logger log = LoggerFactory.getLogger(SchemaCatalog.class);

  private final Map<Source, BackendDriver<?>> drivers = new EnumMap<>(Source.class);
  private final LruTtlCache<Source, Map<String, List<String>>> cache;

  public SchemaCatalog(BackendDriver<?> warehouse, BackendDriver<?> transactional, Duration ttl) {
    this(warehouse, transactional, ttl, System::currentTimeMillis);
  }

  public SchemaCatalog(BackendDriver<?> warehouse, BackendDriver<?> transactional, Duration ttl, LongSupplier nowMillis) {
    drivers.put(Source.WAREHOUSE, Objects.requireNonNull(warehouse, "warehouse"));
    drivers.put(Source.TRANSACTIONAL, Objects.requireNonNull(transactional, "transactional"));
    this.cache = new LruTtlCache<>(drivers.size(), Objects.requireNonNull(ttl, "ttl").toMillis(), nowMillis);
  }

  /** Backends with a catalog, in display order. */
  public List<Source> sources() {
    return List.copyOf(drivers.keySet());
  }

  public Map<String, List<String>> tables(Source source, boolean refresh) {
    BackendDriver<?> driver = driver(source);
    if (!refresh) {
      Map<String, List<String>> cached = cache.get(source);
      if (cached != null) return cached;
    }
    Map<String, List<String>> fresh;
    try {
      fresh = freeze(driver.listTables());
    } catch (FederationException e) {
      log.warn("unisql.schema op=LIST_TABLES source={} error={}", source.wireName(), e.getMessage());
      return Map.of();
    }
    cache.put(source, fresh);
    log.debug("unisql.schema op=CACHE_PUT source={} schemas={} tables={}", source.wireName(), fresh.size(), tableCount(fresh));
    return fresh;
  }

  /** Both backends, warehouse first. */
  public Map<Source, Map<String, List<String>>> all(boolean refresh) {
    Map<Source, Map<String, List<String>>> out = new LinkedHashMap<>();
    for (Source s : drivers.keySet()) out.put(s, tables(s, refresh));
    return out;
  }

  public SchemaCacheInfo info(Source source) {
    driver(source);
    LruTtlCache.Cached<Map<String, List<String>>> e = cache.getEntry(source);
    if (e == null) return SchemaCacheInfo.absent();
    Instant cachedAt = Instant.ofEpochMilli(e.writtenAtMillis());
    return new SchemaCacheInfo(true,
        cachedAt,
        cachedAt.plusMillis(cache.ttlMillis()),
        Duration.ofMillis(Math.max(0, cache.now() - e.writtenAtMillis())),
        tableCount(e.value()));
  }

  /** Returns whether an entry was cached. */
  public boolean clear(Source source) {
    driver(source);
    boolean removed = cache.invalidate(source);
    if (removed) log.debug("unisql.schema op=CACHE_CLEAR source={}", source.wireName());
    return removed;
  }

  public void clearAll() {
    cache.clear();
    log.debug("unisql.schema op=CACHE_CLEAR source=all");
  }

  public static int tableCount(Map<String, List<String>> tables) {
    int n = 0;
    for (List<String> t : tables.values()) n += t.size();
    return n;
  }

  private BackendDriver<?> driver(Source source) {
    BackendDriver<?> d = drivers.get(Objects.requireNonNull(source, "source"));
    if (d == null) throw new IllegalArgumentException("No schema catalog for source " + source.wireName());
    return d;
  }

  private static Map<String, List<String>> freeze(Map<String, List<String>> tables) {
    Map<String, List<String>> copy = new LinkedHashMap<>();
    tables.forEach((schema, names) -> copy.put(schema, List.copyOf(new ArrayList<>(names))));
    return Collections.unmodifiableMap(copy);
  }
}
