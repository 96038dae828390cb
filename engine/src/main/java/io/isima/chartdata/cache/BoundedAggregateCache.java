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

import com.google.common.base.Preconditions;
import com.googlecode.concurrentlinkedhashmap.ConcurrentLinkedHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cache that keeps at most a fixed number of entries, evicting the least recently used one.
 *
 * <p>All methods must be implemented to be thread safe.
 */
public class BoundedAggregateCache implements AggregateCache {
  private static final Logger logger = LoggerFactory.getLogger(BoundedAggregateCache.class);

  protected final ConcurrentMap<String, CacheItem> cache;

  private final int maxItems;

  /**
   * Constructor of the class.
   *
   * @param maxItems Maximum number of cache items.
   */
  public BoundedAggregateCache(int maxItems) {
    Preconditions.checkArgument(maxItems > 0, "maxItems must be positive");
    cache =
        new ConcurrentLinkedHashMap.Builder<String, CacheItem>()
            .maximumWeightedCapacity(maxItems)
            .listener((key, item) -> logger.trace("evicted {}", item))
            .build();
    this.maxItems = maxItems;
  }

  @Override
  public CacheItem get(String key) {
    Preconditions.checkArgument(key != null, "Lookup key may not be null");
    return cache.get(key);
  }

  @Override
  public void put(CacheItem item) {
    Preconditions.checkArgument(item != null, "item may not be null");
    Preconditions.checkArgument(item.getKey() != null, "key may not be null");
    final String key = item.getKey();
    while (true) {
      final var existing = cache.putIfAbsent(key, item);
      if (existing == null) {
        logger.trace("put {}", item);
        return;
      }
      if (item.getStartedAt() < existing.getStartedAt()) {
        logger.trace("kept newer {} over {}", existing, item);
        return;
      }
      if (cache.replace(key, existing, item)) {
        logger.trace("replaced {} by {}", existing, item);
        return;
      }
    }
  }

  @Override
  public boolean evict(String key, CacheItem expected) {
    Preconditions.checkArgument(key != null, "key may not be null");
    return cache.remove(key, expected);
  }

  @Override
  public void invalidate(String key) {
    Preconditions.checkArgument(key != null, "key may not be null");
    cache.remove(key);
  }

  @Override
  public void invalidateAll() {
    cache.clear();
  }

  @Override
  public int count() {
    return cache.size();
  }

  @Override
  public int capacity() {
    return maxItems;
  }
}
