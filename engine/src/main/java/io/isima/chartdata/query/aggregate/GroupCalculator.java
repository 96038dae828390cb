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

import io.isima.chartdata.query.ValueUtils;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Groups rows by dimension values and reduces each group to one output row.
 *
 * <p>Dimension values are compared after {@link ValueUtils#normalizeKey}, so that numbers equal in
 * value and dates equal in instant fall in one group. The output row carries the raw dimension
 * value of the first row of the group. Groups are emitted in order of discovery.
 */
@Getter
public class GroupCalculator {
  private final List<String> dimensions;
  private final List<String> outAttributes;
  // null entries are placeholders, filled in later by the calculated measure resolver
  private final List<Reducer> reducers;

  /**
   * The constructor.
   *
   * @param dimensions Names of the group-by fields
   * @param outAttributes Names of the measures in declaration order
   * @param reducers Reducer per measure; null for a measure that is not aggregated
   */
  public GroupCalculator(List<String> dimensions, List<String> outAttributes,
      List<Reducer> reducers) {
    if (outAttributes.size() != reducers.size()) {
      throw new IllegalArgumentException("outAttributes and reducers must have the same size");
    }
    this.dimensions = dimensions;
    this.outAttributes = outAttributes;
    this.reducers = reducers;
  }

  @Getter
  public static class Context {
    private final Map<List<Object>, Object[]> groups = new LinkedHashMap<>();
  }

  public Context start() {
    return new Context();
  }

  public void consumeRow(Map<String, ?> row, Context ctx) {
    final var groups = ctx.getGroups();
    final List<Object> groupKeys = new ArrayList<>(dimensions.size());
    for (String dimension : dimensions) {
      groupKeys.add(ValueUtils.normalizeKey(row.get(dimension)));
    }
    Object[] values = groups.get(groupKeys);
    if (values == null) {
      values = new Object[dimensions.size() + outAttributes.size()];
      for (int i = 0; i < dimensions.size(); ++i) {
        values[i] = row.get(dimensions.get(i));
      }
      groups.put(groupKeys, values);
    }
    final int offset = dimensions.size();
    for (int i = 0; i < outAttributes.size(); ++i) {
      final var reducer = reducers.get(i);
      if (reducer != null) {
        values[offset + i] = reducer.consume(values[offset + i], row);
      }
    }
  }

  public List<Map<String, Object>> finish(Context ctx) {
    final var groups = ctx.getGroups();
    final List<Map<String, Object>> output = new ArrayList<>(groups.size());
    final int offset = dimensions.size();
    groups.forEach(
        (groupKeys, values) -> {
          final Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 0; i < dimensions.size(); ++i) {
            row.put(dimensions.get(i), values[i]);
          }
          for (int i = 0; i < outAttributes.size(); ++i) {
            final var reducer = reducers.get(i);
            row.put(outAttributes.get(i),
                reducer != null ? reducer.finish(values[offset + i]) : null);
          }
          output.add(row);
        });
    return output;
  }

  /** Groups and reduces the given rows. */
  public List<Map<String, Object>> calculate(List<? extends Map<String, ?>> rows) {
    final var ctx = start();
    rows.forEach((row) -> consumeRow(row, ctx));
    return finish(ctx);
  }
}
