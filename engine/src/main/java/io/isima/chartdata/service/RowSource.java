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
package io.isima.chartdata.service;

import java.util.concurrent.CompletableFuture;

/**
 * Caller supplied asynchronous row fetcher.
 *
 * <p>Fetching is the only point where a computation waits. The service invokes the source at most
 * once per computation, and never while another computation of the same cache key is running,
 * unless the request bypasses the cache.
 */
@FunctionalInterface
public interface RowSource {

  /**
   * Starts fetching rows.
   *
   * @return Future of the rows; completes exceptionally when the fetch fails
   */
  CompletableFuture<SourceData> fetch();
}
