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

import io.isima.chartdata.models.AggregationFunction;
import io.isima.chartdata.query.ValueUtils;
import java.util.Map;

/** Reducers of the aggregation functions. */
public class Reducers {

  /**
   * Creates a reducer for an aggregation function.
   *
   * <p>Sum and avg read values as numbers and treat null or non-numeric values as zero; they
   * produce a {@link Double}. Count produces a {@link Long}. Min and max ignore nulls and produce
   * null when no value is present. First and last produce the raw value of the first or last row
   * of the group in input order, including null.
   *
   * @param function The aggregation function
   * @param column Source column; ignored by count
   * @return The reducer
   */
  public static Reducer create(AggregationFunction function, String column) {
    switch (function) {
      case SUM:
        return new Reducer() {
          @Override
          public Object consume(Object acc, Map<String, ?> row) {
            final double current = acc == null ? 0.0 : (Double) acc;
            return current + numericOrZero(row.get(column));
          }

          @Override
          public Object finish(Object acc) {
            return acc == null ? Double.valueOf(0.0) : acc;
          }
        };
      case AVG:
        return new Reducer() {
          @Override
          public Object consume(Object acc, Map<String, ?> row) {
            if (acc == null) {
              acc = new AverageAccumulator();
            }
            ((AverageAccumulator) acc).accumulate(numericOrZero(row.get(column)));
            return acc;
          }

          @Override
          public Object finish(Object acc) {
            return acc == null ? Double.valueOf(0.0) : ((AverageAccumulator) acc).finish();
          }
        };
      case COUNT:
        return new Reducer() {
          @Override
          public Object consume(Object acc, Map<String, ?> row) {
            return acc != null ? ((Long) acc) + 1 : Long.valueOf(1);
          }

          @Override
          public Object finish(Object acc) {
            return acc == null ? Long.valueOf(0) : acc;
          }
        };
      case MIN:
        return (acc, row) -> {
          final Object value = row.get(column);
          if (value == null) {
            return acc;
          }
          return acc == null || ValueUtils.compare(value, acc) < 0 ? value : acc;
        };
      case MAX:
        return (acc, row) -> {
          final Object value = row.get(column);
          if (value == null) {
            return acc;
          }
          return acc == null || ValueUtils.compare(value, acc) > 0 ? value : acc;
        };
      case FIRST:
        return new Reducer() {
          @Override
          public Object consume(Object acc, Map<String, ?> row) {
            return acc != null ? acc : new Holder(row.get(column));
          }

          @Override
          public Object finish(Object acc) {
            return acc == null ? null : ((Holder) acc).value;
          }
        };
      case LAST:
        return new Reducer() {
          @Override
          public Object consume(Object acc, Map<String, ?> row) {
            return new Holder(row.get(column));
          }

          @Override
          public Object finish(Object acc) {
            return acc == null ? null : ((Holder) acc).value;
          }
        };
      default:
        throw new UnsupportedOperationException("Unsupported aggregation " + function);
    }
  }

  static double numericOrZero(Object value) {
    final Double number = ValueUtils.toDoubleOrNull(value);
    return number == null || number.isNaN() ? 0.0 : number;
  }

  // distinguishes a consumed null value from no value
  private static class Holder {
    private final Object value;

    Holder(Object value) {
      this.value = value;
    }
  }

  private static class AverageAccumulator {
    private double sum;
    private long count;

    public void accumulate(double value) {
      sum += value;
      ++count;
    }

    public Double finish() {
      return count == 0 ? 0.0 : sum / count;
    }
  }
}
