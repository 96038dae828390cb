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

import io.isima.chartdata.models.SortKey;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Stable sort by a list of sort keys followed by truncation.
 *
 * <p>Rows that compare equal on every key keep their input order.
 */
public class SortLimitStage {
  private final Comparator<Map<String, ?>> comparator;
  // null means no limit
  private final Integer limit;

  public SortLimitStage(List<SortKey> sortKeys, Integer limit) {
    this.comparator =
        sortKeys == null || sortKeys.isEmpty() ? null : RowComparators.generate(sortKeys);
    this.limit = limit;
  }

  public Integer getLimit() {
    return limit;
  }

  public <T extends Map<String, ?>> List<T> apply(List<T> rows) {
    List<T> result = rows;
    if (comparator != null) {
      result = new ArrayList<>(rows);
      // List.sort is a stable merge sort
      result.sort(comparator);
    }
    if (limit != null && result.size() > limit) {
      result = result.subList(0, limit);
    }
    return result;
  }
}
