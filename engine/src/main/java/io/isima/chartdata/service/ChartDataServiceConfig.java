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

import io.isima.chartdata.common.ChartDataConfig;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/** Parameters of a {@link ChartDataService} instance. */
@Getter
@Builder
@ToString
public class ChartDataServiceConfig {
  @Builder.Default private final long cacheTtlMillis = ChartDataConfig.DEFAULT_CACHE_TTL_MILLIS;

  // zero means unbounded
  @Builder.Default private final int cacheMaxEntries = 0;

  @Builder.Default
  private final int expressionMaxLength = ChartDataConfig.DEFAULT_EXPRESSION_MAX_LENGTH;

  @Builder.Default
  private final int expressionMaxDepth = ChartDataConfig.DEFAULT_EXPRESSION_MAX_DEPTH;

  @Builder.Default
  private final long expressionTimeoutMillis = ChartDataConfig.DEFAULT_EXPRESSION_TIMEOUT_MILLIS;

  @Builder.Default private final boolean zeroLimitReturnsEmpty = false;

  /** Builds a configuration from the properties given to {@link ChartDataConfig}. */
  public static ChartDataServiceConfig fromProperties() {
    return ChartDataServiceConfig.builder()
        .cacheTtlMillis(ChartDataConfig.cacheTtlMillis())
        .cacheMaxEntries(ChartDataConfig.cacheMaxEntries())
        .expressionMaxLength(ChartDataConfig.expressionMaxLength())
        .expressionMaxDepth(ChartDataConfig.expressionMaxDepth())
        .expressionTimeoutMillis(ChartDataConfig.expressionTimeoutMillis())
        .zeroLimitReturnsEmpty(ChartDataConfig.zeroLimitReturnsEmpty())
        .build();
  }
}
