package io.intellixity.unisql.federation.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Small synchronized LRU cache with expire-after-write.\n
 *
 * Entries remember when they were written so callers can report cache age.\n
 */
public final class LruTtlCache<K, V> {
  /** A live entry and its write time in epoch millis. */
  public record Cached<V>(V value, long writtenAtMillis) {}

  private final int maxEntries;
  private final long ttlMillis;
  private final LongSupplier nowMillis;

  private final LinkedHashMap<K, Cached<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  public LruTtlCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis <= 0) throw new IllegalArgumentException("ttlMillis must be > 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public long ttlMillis() { return ttlMillis; }

  public long now() { return nowMillis.getAsLong(); }

  public synchronized Cached<V> getEntry(K key) {
    Objects.requireNonNull(key, "key");
    pruneExpired(nowMillis.getAsLong());
    return map.get(key);
  }

  public V get(K key) {
    Cached<V> e = getEntry(key);
    return e == null ? null : e.value();
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    map.put(key, new Cached<>(value, now));
    while (map.size() > maxEntries) {
      Iterator<K> eldest = map.keySet().iterator();
      eldest.next();
      eldest.remove();
    }
  }

  public synchronized boolean invalidate(K key) {
    return map.remove(key) != null;
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private void pruneExpired(long now) {
    Iterator<Map.Entry<K, Cached<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (now - it.next().getValue().writtenAtMillis() >= ttlMillis) it.remove();
    }
  }
}
