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

import java.util.HashMap;
import java.util.Map;

/** Aggregation functions that an aggregated measure can apply to a source column. */
public enum AggregationFunction {
  SUM,
  AVG,
  COUNT,
  MIN,
  MAX,
  FIRST,
  LAST;

  private static final Map<String, AggregationFunction> byName = createNameMap();

  private static Map<String, AggregationFunction> createNameMap() {
    final var map = new HashMap<String, AggregationFunction>();
    for (final var value : values()) {
      map.put(value.stringify(), value);
    }
    map.put("mean", AVG);
    return map;
  }

  /**
   * Resolves an aggregation function by name, case insensitively.
   *
   * @param name Function name such as "sum" or "avg"; "mean" is accepted as an alias of "avg"
   * @return The function, or null if the name is unknown
   */
  public static AggregationFunction forName(String name) {
    if (name == null) {
      return null;
    }
    return byName.get(name.trim().toLowerCase());
  }

  /** Returns whether the function reads values of the source column. */
  public boolean requiresColumn() {
    return this != COUNT;
  }

  public String stringify() {
    return name().toLowerCase();
  }
}
