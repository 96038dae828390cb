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

import io.isima.chartdata.diagnostics.DiagnosticKind;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.errors.exception.ExpressionException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills calculated measures of aggregated rows.
 *
 * <p>Measures are visited in declaration order. A formula sees the dimension values of the row and
 * the measures declared before it. A formula that fails on a row sets the measure to null for
 * that row and is reported as {@link DiagnosticKind#EXPRESSION_FAILURE}.
 */
public class CalculatedMeasureResolver {
  private static final Logger logger = LoggerFactory.getLogger(CalculatedMeasureResolver.class);

  private final List<String> dimensions;
  private final List<CompiledMeasure> measures;
  private final boolean hasCalculated;

  public CalculatedMeasureResolver(List<String> dimensions, List<CompiledMeasure> measures) {
    this.dimensions = dimensions;
    this.measures = measures;
    this.hasCalculated = measures.stream().anyMatch(CompiledMeasure::isCalculated);
  }

  public void resolve(List<Map<String, Object>> rows, Diagnostics diagnostics) {
    if (!hasCalculated) {
      return;
    }
    for (var row : rows) {
      resolveRow(row, diagnostics);
    }
  }

  void resolveRow(Map<String, Object> row, Diagnostics diagnostics) {
    final Map<String, Object> scope = new HashMap<>();
    for (var dimension : dimensions) {
      scope.put(dimension, row.get(dimension));
    }
    for (var measure : measures) {
      final String name = measure.getName();
      if (measure.isCalculated()) {
        final var calculated = (CalculatedMeasure) measure;
        final Object value = evaluate(calculated, scope, diagnostics);
        row.put(name, value);
      }
      scope.put(name, row.get(name));
    }
  }

  private Object evaluate(
      CalculatedMeasure measure, Map<String, Object> scope, Diagnostics diagnostics) {
    if (measure.getExpression() == null) {
      diagnostics.report(
          DiagnosticKind.EXPRESSION_FAILURE, measure.getName(), measure.getCompileError());
      return null;
    }
    try {
      return measure.getExpression().evaluate(scope);
    } catch (ExpressionException e) {
      logger.trace("Expression {} failed: {}", measure.getExpressionSource(), e.getMessage());
      diagnostics.report(DiagnosticKind.EXPRESSION_FAILURE, measure.getName(), e.getMessage());
      return null;
    }
  }
}
