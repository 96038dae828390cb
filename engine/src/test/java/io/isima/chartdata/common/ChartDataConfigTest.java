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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import io.isima.chartdata.service.ChartDataServiceConfig;
import java.util.Properties;
import org.junit.After;
import org.junit.Test;

public class ChartDataConfigTest {

  @After
  public void tearDown() {
    ChartDataConfig.setProperties(System.getProperties());
  }

  @Test
  public void testDefaults() {
    ChartDataConfig.setProperties(new Properties());
    assertEquals(300000L, ChartDataConfig.cacheTtlMillis());
    assertEquals(0, ChartDataConfig.cacheMaxEntries());
    assertEquals(500, ChartDataConfig.expressionMaxLength());
    assertEquals(64, ChartDataConfig.expressionMaxDepth());
    assertEquals(100L, ChartDataConfig.expressionTimeoutMillis());
    assertFalse(ChartDataConfig.zeroLimitReturnsEmpty());
  }

  @Test
  public void testOverrides() {
    final var properties = new Properties();
    properties.setProperty(ChartDataConfig.CACHE_TTL_MILLIS, " 1000 ");
    properties.setProperty(ChartDataConfig.CACHE_MAX_ENTRIES, "50");
    properties.setProperty(ChartDataConfig.EXPRESSION_MAX_DEPTH, "8");
    properties.setProperty(ChartDataConfig.ZERO_LIMIT_RETURNS_EMPTY, "true");
    ChartDataConfig.setProperties(properties);

    final var config = ChartDataServiceConfig.fromProperties();
    assertEquals(1000L, config.getCacheTtlMillis());
    assertEquals(50, config.getCacheMaxEntries());
    assertEquals(8, config.getExpressionMaxDepth());
    assertEquals(500, config.getExpressionMaxLength());
    assertTrue(config.isZeroLimitReturnsEmpty());
  }

  @Test(expected = RuntimeException.class)
  public void testOutOfRange() {
    final var properties = new Properties();
    properties.setProperty(ChartDataConfig.EXPRESSION_MAX_DEPTH, "0");
    ChartDataConfig.setProperties(properties);
    ChartDataConfig.expressionMaxDepth();
  }

  @Test(expected = RuntimeException.class)
  public void testMalformedNumber() {
    final var properties = new Properties();
    properties.setProperty(ChartDataConfig.CACHE_TTL_MILLIS, "five minutes");
    ChartDataConfig.setProperties(properties);
    ChartDataConfig.cacheTtlMillis();
  }
}
