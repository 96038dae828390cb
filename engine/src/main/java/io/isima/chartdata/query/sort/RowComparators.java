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
package io.isima.chartdata.query.sort;

import io.isima.chartdata.models.SortDirection;
import io.isima.chartdata.models.SortKey;
import io.isima.chartdata.query.ValueUtils;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

public class RowComparators {

  /**
   * Generates a comparator of rows by a single field.
   *
   * <p>Null and missing values are placed after all other values regardless of the direction.
   *
   * @param key The field name
   * @param polarity 1 for ascending order, -1 for descending order
   * @return The comparator
   */
  public static Comparator<Map<String, ?>> generateMapComparator(String key, int polarity) {
    return new Comparator<>() {
      @Override
      public int compare(Map<String, ?> row1, Map<String, ?> row2) {
        final Object value1 = row1.get(key);
        final Object value2 = row2.get(key);
        if (value1 == null) {
          return value2 == null ? 0 : 1;
        }
        if (value2 == null) {
          return -1;
        }
        return ValueUtils.compare(value1, value2) * polarity;
      }
    };
  }

  /**
   * Generates a comparator for a list of sort keys. The first key is the primary one; ties fall
   * through to the following keys.
   *
   * @param sortKeys The sort keys, must not be empty
   * @return The comparator
   */
  public static Comparator<Map<String, ?>> generate(List<SortKey> sortKeys) {
    Comparator<Map<String, ?>> comparator = null;
    for (var sortKey : sortKeys) {
      final int polarity = sortKey.getDirection() == SortDirection.DESC ? -1 : 1;
      final var next = generateMapComparator(sortKey.getField(), polarity);
      comparator = comparator == null ? next : comparator.thenComparing(next);
    }
    if (comparator == null) {
      throw new IllegalArgumentException("sortKeys must not be empty");
    }
    return comparator;
  }
}
