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
package io.isima.chartdata.query.aggregate;

import static org.junit.Assert.assertEquals;

import io.isima.chartdata.models.AggregationFunction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.Test;

public class ReducersTest {

  private static Object reduce(AggregationFunction function, List<Map<String, Object>> rows) {
    final Reducer reducer = Reducers.create(function, "v");
    Object acc = null;
    for (var row : rows) {
      acc = reducer.consume(acc, row);
    }
    return reducer.finish(acc);
  }

  @Test
  public void testMinMaxIgnoreInputOrderOnMixedValues() {
    final List<Map<String, Object>> rows = new ArrayList<>();
    for (Object value : List.of(10, "9", "100x", "N/A", 3.5, "2024-01-15", true)) {
      rows.add(Map.of("v", value));
    }
    final var random = new Random(7);
    for (int i = 0; i < 50; ++i) {
      Collections.shuffle(rows, random);
      assertEquals(3.5, reduce(AggregationFunction.MIN, rows));
      assertEquals("N/A", reduce(AggregationFunction.MAX, rows));
    }
  }

  @Test
  public void testSumTreatsNonNumericAsZero() {
    final List<Map<String, Object>> rows =
        List.of(Map.of("v", 2), Map.of("v", "3.5"), Map.of("v", "N/A"));
    assertEquals(5.5, (Double) reduce(AggregationFunction.SUM, rows), 1e-9);
    assertEquals(3L, reduce(AggregationFunction.COUNT, rows));
  }
}
