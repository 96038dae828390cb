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

import java.util.concurrent.atomic.AtomicLong;
import lombok.ToString;

/** Counters of cache activity. */
@ToString
public class CacheStats {
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();
  // requests that awaited a computation started by another request
  private final AtomicLong joins = new AtomicLong();
  private final AtomicLong computations = new AtomicLong();
  private final AtomicLong failures = new AtomicLong();

  public void recordHit() {
    hits.incrementAndGet();
  }

  public void recordMiss() {
    misses.incrementAndGet();
  }

  public void recordJoin() {
    joins.incrementAndGet();
  }

  public void recordComputation() {
    computations.incrementAndGet();
  }

  public void recordFailure() {
    failures.incrementAndGet();
  }

  public long getHits() {
    return hits.get();
  }

  public long getMisses() {
    return misses.get();
  }

  public long getJoins() {
    return joins.get();
  }

  public long getComputations() {
    return computations.get();
  }

  public long getFailures() {
    return failures.get();
  }
}
