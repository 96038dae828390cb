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

import io.isima.chartdata.diagnostics.DiagnosticKind;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.models.FilterRule;
import io.isima.chartdata.models.FilterTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class FilterClassifier {

  /**
   * Splits a filter tree into the rules applied before and after grouping.
   *
   * <p>A rule on a measure output name is applied after grouping. A rule on a dimension name is
   * applied before grouping. A rule on any other field is applied before grouping and reported as
   * {@link DiagnosticKind#UNKNOWN_FILTER_FIELD}.
   *
   * <p>Each rule is classified by itself. An OR tree that mixes dimension and measure rules is
   * therefore evaluated as two separate OR trees, one per stage.
   *
   * @param filters The filter tree, may be null
   * @param dimensionNames Output names of the dimensions
   * @param measureNames Output names of the measures
   * @param diagnostics Collector for unknown field reports, may be null
   * @return The classified filters
   */
  public static ClassifiedFilters classify(
      FilterTree filters,
      Set<String> dimensionNames,
      Set<String> measureNames,
      Diagnostics diagnostics) {
    if (filters == null || filters.getRules() == null || filters.getRules().isEmpty()) {
      return ClassifiedFilters.none();
    }
    final List<FilterRule> pre = new ArrayList<>();
    final List<FilterRule> post = new ArrayList<>();
    for (var rule : filters.getRules()) {
      if (rule == null) {
        continue;
      }
      final String field = rule.getField();
      if (measureNames.contains(field)) {
        post.add(rule);
      } else {
        if (!dimensionNames.contains(field) && diagnostics != null) {
          diagnostics.report(
              DiagnosticKind.UNKNOWN_FILTER_FIELD,
              field,
              "field matches neither a dimension nor a measure; applied before grouping");
        }
        pre.add(rule);
      }
    }
    return new ClassifiedFilters(
        pre.isEmpty() ? null : new FilterTree(filters.getCombinator(), pre),
        post.isEmpty() ? null : new FilterTree(filters.getCombinator(), post));
  }
}
