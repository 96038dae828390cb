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
package io.isima.chartdata.query.measure;

import io.isima.chartdata.models.AggregationFunction;
import io.isima.chartdata.query.aggregate.Reducer;
import io.isima.chartdata.query.aggregate.Reducers;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class AggregatedMeasure extends CompiledMeasure {
  private final String column;
  private final AggregationFunction function;

  public AggregatedMeasure(String name, String column, AggregationFunction function) {
    super(name);
    this.column = column;
    this.function = function;
  }

  @Override
  public boolean isCalculated() {
    return false;
  }

  public Reducer createReducer() {
    return Reducers.create(function, column);
  }
}
