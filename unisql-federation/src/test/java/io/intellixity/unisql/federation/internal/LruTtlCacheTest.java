package io.intellixity.unisql.federation.internal;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

final class LruTtlCacheTest {
  private final AtomicLong now = new AtomicLong();

  @Test
  void expiresAfterWrite() {
    LruTtlCache<String, String> c = new LruTtlCache<>(10, 100, now::get);
    c.put("a", "1");
    now.set(99);
    assertEquals("1", c.get("a"));
    assertEquals(0, c.getEntry("a").writtenAtMillis());
    now.set(100);
    assertNull(c.get("a"));
    assertEquals(0, c.size());
  }

  @Test
  void evictsLeastRecentlyUsed() {
    LruTtlCache<String, String> c = new LruTtlCache<>(2, 1_000, now::get);
    c.put("a", "1");
    c.put("b", "2");
    c.get("a");
    c.put("c", "3");
    assertEquals("1", c.get("a"));
    assertNull(c.get("b"));
    assertEquals("3", c.get("c"));
  }

  @Test
  void invalidateAndClear() {
    LruTtlCache<String, String> c = new LruTtlCache<>(4, 1_000, now::get);
    c.put("a", "1");
    c.put("b", "2");
    assertTrue(c.invalidate("a"));
    assertFalse(c.invalidate("a"));
    c.clear();
    assertEquals(0, c.size());
  }

  @Test
  void rejectsBadSettings() {
    assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(0, 1));
    assertThrows(IllegalArgumentException.class, () -> new LruTtlCache<String, String>(1, 0));
  }
}
