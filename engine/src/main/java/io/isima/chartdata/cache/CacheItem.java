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

import java.util.List;
import java.util.Map;
import lombok.ToString;

/** Computed pipeline result held by an {@link AggregateCache}. Instances are immutable. */
@ToString(exclude = "rows")
public class CacheItem {

  private final String key;
  private final List<Map<String, Object>> rows;
  private final long startedAt;
  private final long computedAt;
  private final long refreshedAt;
  private final boolean sourceWasCached;

  /**
   * Cache item constructor.
   *
   * @param key Cache key
   * @param rows Output rows; must be unmodifiable
   * @param startedAt Time the computation started in epoch milliseconds; used as the version
   * @param computedAt Time the computation completed in epoch milliseconds; the TTL counts from
   *     this time
   * @param refreshedAt Data refresh time reported to the renderer
   * @param sourceWasCached Whether the row source reported its own refresh time
   */
  public CacheItem(
      String key,
      List<Map<String, Object>> rows,
      long startedAt,
      long computedAt,
      long refreshedAt,
      boolean sourceWasCached) {
    this.key = key;
    this.rows = rows;
    this.startedAt = startedAt;
    this.computedAt = computedAt;
    this.refreshedAt = refreshedAt;
    this.sourceWasCached = sourceWasCached;
  }

  public String getKey() {
    return key;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public long getStartedAt() {
    return startedAt;
  }

  public long getComputedAt() {
    return computedAt;
  }

  public long getRefreshedAt() {
    return refreshedAt;
  }

  public boolean isSourceWasCached() {
    return sourceWasCached;
  }

  /** Returns true if the item is older than the TTL at the given time. */
  public boolean isExpired(long now, long ttlMillis) {
    return now - computedAt >= ttlMillis;
  }
}
