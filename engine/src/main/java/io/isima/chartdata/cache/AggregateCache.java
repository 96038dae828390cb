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

/**
 * Process-wide store of computed pipeline results.
 *
 * <p>All methods must be implemented to be thread safe.
 */
public interface AggregateCache {

  /**
   * Creates a cache.
   *
   * @param maxEntries Maximum number of entries; zero or negative for an unbounded cache
   * @return The cache
   */
  static AggregateCache create(int maxEntries) {
    if (maxEntries > 0) {
      return new BoundedAggregateCache(maxEntries);
    }
    return new SimpleAggregateCache();
  }

  /**
   * Method to get an item in the cache specified by a key.
   *
   * @param key Cache key
   * @return The item if an entry with the specified key exists, otherwise null
   */
  CacheItem get(String key);

  /**
   * Puts an item.
   *
   * <p>If an item for the key exists, the method replaces it only if the computation of the given
   * item started no earlier than the existing one's. A slow computation that finishes late does not
   * overwrite a result of a computation started after it.
   *
   * @param item The item to put
   * @throws IllegalArgumentException When the item or its key is null
   */
  void put(CacheItem item);

  /**
   * Removes the entry of the key if it is still the given item.
   *
   * @return true if the entry was removed
   */
  boolean evict(String key, CacheItem expected);

  /** Removes the entry of the key if it exists. */
  void invalidate(String key);

  /** Removes all entries. */
  void invalidateAll();

  /**
   * Return number of cache entries.
   *
   * @return number of cache entries
   */
  int count();

  /** Returns capacity. */
  int capacity();
}
