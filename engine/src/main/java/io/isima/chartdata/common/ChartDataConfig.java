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
package io.isima.chartdata.common;

import java.util.Properties;

/** Chart data engine configuration value provider. */
public class ChartDataConfig {

  public static final String CACHE_TTL_MILLIS = "io.isima.chartdata.cache.ttlMillis";
  public static final long DEFAULT_CACHE_TTL_MILLIS = 5 * 60 * 1000L;

  // zero means unbounded
  public static final String CACHE_MAX_ENTRIES = "io.isima.chartdata.cache.maxEntries";

  public static final String EXPRESSION_MAX_LENGTH = "io.isima.chartdata.expression.maxLength";
  public static final int DEFAULT_EXPRESSION_MAX_LENGTH = 500;

  public static final String EXPRESSION_MAX_DEPTH = "io.isima.chartdata.expression.maxDepth";
  public static final int DEFAULT_EXPRESSION_MAX_DEPTH = 64;

  public static final String EXPRESSION_TIMEOUT_MILLIS =
      "io.isima.chartdata.expression.timeoutMillis";
  public static final long DEFAULT_EXPRESSION_TIMEOUT_MILLIS = 100;

  public static final String ZERO_LIMIT_RETURNS_EMPTY =
      "io.isima.chartdata.query.zeroLimitReturnsEmpty";

  protected static ChartDataConfigBase getInstance() {
    return ChartDataConfigBase.getInstance();
  }

  public static void setProperties(Properties properties) {
    ChartDataConfigBase.setProperties(properties);
  }

  public static long cacheTtlMillis() {
    return getInstance().getLong(CACHE_TTL_MILLIS, DEFAULT_CACHE_TTL_MILLIS);
  }

  public static int cacheMaxEntries() {
    return getInstance().getInt(CACHE_MAX_ENTRIES, 0, 0, Integer.MAX_VALUE);
  }

  public static int expressionMaxLength() {
    return getInstance()
        .getInt(EXPRESSION_MAX_LENGTH, DEFAULT_EXPRESSION_MAX_LENGTH, 1, Integer.MAX_VALUE);
  }

  public static int expressionMaxDepth() {
    return getInstance().getInt(EXPRESSION_MAX_DEPTH, DEFAULT_EXPRESSION_MAX_DEPTH, 1, 1024);
  }

  public static long expressionTimeoutMillis() {
    return getInstance().getLong(EXPRESSION_TIMEOUT_MILLIS, DEFAULT_EXPRESSION_TIMEOUT_MILLIS);
  }

  /**
   * Whether a limit of zero truncates the result to no rows.
   *
   * <p>By default a zero limit is treated the same as an absent limit.
   */
  public static boolean zeroLimitReturnsEmpty() {
    return getInstance().getBoolean(ZERO_LIMIT_RETURNS_EMPTY, false);
  }
}
