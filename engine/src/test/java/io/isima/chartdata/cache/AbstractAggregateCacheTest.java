/*
 * Copyright (C) 2025 Isima, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.isima.chartdata.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.Test;

public abstract class AbstractAggregateCacheTest {

  protected static CacheItem item(String key, long startedAt) {
    return new CacheItem(
        key, List.of(Map.of("version", startedAt)), startedAt, startedAt + 5, startedAt, false);
  }

  protected static class CacheBeater extends Thread {
    private static final int KEY_RANGE = 64;

    private final AggregateCache cache;
    private final AtomicLong clock;
    private final Map<String, Long> latest;
    private final int iteration;
    private final Random random = new Random();

    public CacheBeater(
        AggregateCache cache, AtomicLong clock, Map<String, Long> latest, int iteration) {
      this.cache = cache;
      this.clock = clock;
      this.latest = latest;
      this.iteration = iteration;
    }

    @Override
    public void run() {
      for (int i = 0; i < iteration; ++i) {
        final String key = "key" + random.nextInt(KEY_RANGE);
        final long startedAt = clock.getAndIncrement();
        cache.put(item(key, startedAt));
        latest.merge(key, startedAt, Math::max);
      }
    }
  }

  protected abstract void verifyImplementationSpecifics(AggregateCache cache);

  protected abstract AggregateCache createCache(int size);

  protected void capacityCheck(AggregateCache cache, int size) {
    assertEquals(size, cache.capacity());
  }

  @Test
  public void testBasic() {
    final AggregateCache cache = createCache(256);
    capacityCheck(cache, 256);

    // put entries
    for (int i = 0; i < 128; ++i) {
      cache.put(item("key" + i, 1000));
    }
    assertEquals(128, cache.count());

    // get entries
    for (int i = 0; i < 128; ++i) {
      final CacheItem found = cache.get("key" + i);
      assertNotNull(found);
      assertEquals("key" + i, found.getKey());
    }
    assertNull(cache.get("key512"));

    // newer computations replace, older ones are ignored
    cache.put(item("key0", 2000));
    assertEquals(2000, cache.get("key0").getStartedAt());
    cache.put(item("key0", 1500));
    assertEquals(2000, cache.get("key0").getStartedAt());

    // same version replaces
    final CacheItem sameVersion = item("key0", 2000);
    cache.put(sameVersion);
    assertSame(sameVersion, cache.get("key0"));

    verifyImplementationSpecifics(cache);
  }

  @Test
  public void testEvictAndInvalidate() {
    final AggregateCache cache = createCache(16);
    final CacheItem first = item("a", 10);
    cache.put(first);
    cache.put(item("b", 10));

    final CacheItem second = item("a", 20);
    cache.put(second);
    assertFalse(cache.evict("a", first));
    assertSame(second, cache.get("a"));
    assertTrue(cache.evict("a", second));
    assertNull(cache.get("a"));

    cache.invalidate("b");
    assertNull(cache.get("b"));
    cache.invalidate("nonexistent");

    cache.put(item("c", 10));
    cache.put(item("d", 10));
    cache.invalidateAll();
    assertEquals(0, cache.count());
  }

  @Test
  public void testExpiry() {
    final CacheItem cached = new CacheItem("k", List.of(), 100, 200, 150, true);
    assertFalse(cached.isExpired(200, 50));
    assertFalse(cached.isExpired(249, 50));
    assertTrue(cached.isExpired(250, 50));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullKey() {
    createCache(4).put(new CacheItem(null, List.of(), 0, 0, 0, false));
  }

  @Test
  public void testConcurrentPutsKeepNewest() throws InterruptedException {
    final AggregateCache cache = createCache(128);
    final AtomicLong clock = new AtomicLong(1);
    final Map<String, Long> latest = new ConcurrentHashMap<>();
    final List<CacheBeater> beaters = new ArrayList<>();
    for (int i = 0; i < 8; ++i) {
      beaters.add(new CacheBeater(cache, clock, latest, 2000));
    }
    for (var beater : beaters) {
      beater.start();
    }
    for (var beater : beaters) {
      beater.join();
    }
    for (var entry : latest.entrySet()) {
      final CacheItem found = cache.get(entry.getKey());
      assertNotNull(found);
      assertEquals(entry.getValue().longValue(), found.getStartedAt());
    }
  }
}
