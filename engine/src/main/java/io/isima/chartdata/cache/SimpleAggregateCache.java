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
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Unbounded cache on a {@link ConcurrentHashMap}. Entries leave only by expiry or invalidation. */
class SimpleAggregateCache implements AggregateCache {

  private final ConcurrentMap<String, CacheItem> cache;

  public SimpleAggregateCache() {
    cache = new ConcurrentHashMap<>();
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
    // newer item wins
    cache.merge(
        item.getKey(),
        item,
        (existing, toPut) -> toPut.getStartedAt() >= existing.getStartedAt() ? toPut : existing);
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
    return Integer.MAX_VALUE;
  }
}
