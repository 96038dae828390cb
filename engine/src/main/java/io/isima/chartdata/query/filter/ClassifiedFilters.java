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
package io.isima.chartdata.query.filter;

import io.isima.chartdata.models.FilterTree;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Filter rules split by the pipeline stage that applies them.
 *
 * <p>Either tree may be null when no rule belongs to the stage. Both trees keep the combinator of
 * the source tree.
 */
@Getter
@AllArgsConstructor
@ToString
public class ClassifiedFilters {
  // applied to source rows before grouping (WHERE)
  private final FilterTree preAggregation;
  // applied to aggregated rows (HAVING)
  private final FilterTree postAggregation;

  public static ClassifiedFilters none() {
    return new ClassifiedFilters(null, null);
  }
}
