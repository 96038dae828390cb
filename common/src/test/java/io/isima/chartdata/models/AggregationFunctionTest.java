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
package io.isima.chartdata.models;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class AggregationFunctionTest {

  @Test
  public void testForName() {
    assertEquals(AggregationFunction.SUM, AggregationFunction.forName("sum"));
    assertEquals(AggregationFunction.MAX, AggregationFunction.forName("MAX"));
    assertEquals(AggregationFunction.FIRST, AggregationFunction.forName(" first "));
    assertNull(AggregationFunction.forName("median"));
    assertNull(AggregationFunction.forName(null));
  }

  @Test
  public void testMeanIsAvg() {
    assertEquals(AggregationFunction.AVG, AggregationFunction.forName("mean"));
  }

  @Test
  public void testRequiresColumn() {
    assertFalse(AggregationFunction.COUNT.requiresColumn());
    assertTrue(AggregationFunction.LAST.requiresColumn());
  }
}
