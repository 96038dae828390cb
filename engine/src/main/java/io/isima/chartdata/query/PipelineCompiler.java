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
package io.isima.chartdata.query;

import com.google.common.base.Preconditions;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.errors.exception.AggregationException;
import io.isima.chartdata.errors.exception.ChartDataException;
import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.errors.exception.SpecException;
import io.isima.chartdata.grammar.CompiledExpression;
import io.isima.chartdata.grammar.ExpressionEvaluator;
import io.isima.chartdata.models.AggregationFunction;
import io.isima.chartdata.models.Dimension;
import io.isima.chartdata.models.Measure;
import io.isima.chartdata.models.PipelineSpec;
import io.isima.chartdata.query.aggregate.CompiledDimension;
import io.isima.chartdata.query.filter.FilterClassifier;
import io.isima.chartdata.query.measure.AggregatedMeasure;
import io.isima.chartdata.query.measure.CalculatedMeasure;
import io.isima.chartdata.query.measure.CompiledMeasure;
import io.isima.chartdata.query.sort.SortLimitStage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates pipeline specifications and resolves them into {@link CompiledPipeline}s.
 *
 * <p>All fatal problems of a specification are found here, before any row is fetched.
 */
public class PipelineCompiler {
  private static final Logger logger = LoggerFactory.getLogger(PipelineCompiler.class);

  private final ExpressionEvaluator evaluator;
  private final boolean zeroLimitReturnsEmpty;

  public PipelineCompiler(ExpressionEvaluator evaluator, boolean zeroLimitReturnsEmpty) {
    this.evaluator = Preconditions.checkNotNull(evaluator);
    this.zeroLimitReturnsEmpty = zeroLimitReturnsEmpty;
  }

  /**
   * Compiles a pipeline specification.
   *
   * @param spec The specification
   * @return The compiled pipeline
   * @throws SpecException when the specification is malformed
   * @throws AggregationException when a measure uses an unknown aggregation function
   */
  public CompiledPipeline compile(PipelineSpec spec) throws ChartDataException {
    Preconditions.checkNotNull(spec, "spec must not be null");
    try {
      return compileInternal(spec);
    } catch (ChartDataException e) {
      e.setContext(spec);
      throw e;
    }
  }

  private CompiledPipeline compileInternal(PipelineSpec spec) throws ChartDataException {
    final Integer limit = resolveLimit(spec.getLimit());
    final var sortKeys = spec.getSort();
    if (sortKeys != null) {
      for (var sortKey : sortKeys) {
        if (sortKey == null || StringUtils.isBlank(sortKey.getField())) {
          throw new SpecException("sort key must have a field");
        }
      }
    }
    final var sortLimit = new SortLimitStage(sortKeys, limit);

    if (spec.isPassThrough()) {
      logger.debug("Pass-through pipeline; filters={}", spec.getFilters());
      return new CompiledPipeline(
          spec,
          true,
          List.of(),
          List.of(),
          List.of(),
          FilterClassifier.classify(null, Set.of(), Set.of(), null),
          spec.getFilters(),
          sortLimit,
          List.of());
    }

    final Set<String> outputNames = new HashSet<>();
    final var dimensions = compileDimensions(spec.getDimensions(), outputNames);
    final var dimensionNames = new ArrayList<String>();
    dimensions.forEach((dimension) -> dimensionNames.add(dimension.getName()));
    final var measures = compileMeasures(spec.getMeasures(), dimensionNames, outputNames);
    final Set<String> measureNames = new LinkedHashSet<>();
    measures.forEach((measure) -> measureNames.add(measure.getName()));

    final var diagnostics = new Diagnostics();
    final var filters =
        FilterClassifier.classify(
            spec.getFilters(), new HashSet<>(dimensionNames), measureNames, diagnostics);
    logger.debug("Compiled pipeline; dimensions={}, measures={}, filters={}",
        dimensionNames, measureNames, filters);
    return new CompiledPipeline(
        spec,
        false,
        Collections.unmodifiableList(dimensions),
        Collections.unmodifiableList(dimensionNames),
        Collections.unmodifiableList(measures),
        filters,
        spec.getFilters(),
        sortLimit,
        diagnostics.getDiagnostics());
  }

  private Integer resolveLimit(Integer limit) throws SpecException {
    if (limit == null) {
      return null;
    }
    if (limit < 0) {
      throw new SpecException("limit must not be negative: " + limit);
    }
    if (limit == 0 && !zeroLimitReturnsEmpty) {
      return null;
    }
    return limit;
  }

  private List<CompiledDimension> compileDimensions(
      List<Dimension> dimensions, Set<String> outputNames) throws SpecException {
    final var result = new ArrayList<CompiledDimension>();
    if (dimensions == null) {
      return result;
    }
    for (var dimension : dimensions) {
      if (dimension == null || StringUtils.isBlank(dimension.getName())) {
        throw new SpecException("dimension must have a name");
      }
      final String name = dimension.getName();
      if (!outputNames.add(name)) {
        throw new SpecException("duplicate dimension name: " + name);
      }
      if (dimension.getTransform() != null && dimension.getExpression() != null) {
        throw new SpecException(
            "dimension " + name + " must not have both transform and expression");
      }
      if (dimension.getExpression() != null) {
        try {
          final CompiledExpression expression = evaluator.compile(dimension.getExpression());
          result.add(CompiledDimension.withExpression(dimension, expression, null));
        } catch (ExpressionException e) {
          result.add(CompiledDimension.withExpression(dimension, null, e.getMessage()));
        }
      } else {
        result.add(CompiledDimension.plain(dimension));
      }
    }
    return result;
  }

  private List<CompiledMeasure> compileMeasures(
      List<Measure> measures, List<String> dimensionNames, Set<String> outputNames)
      throws ChartDataException {
    final var result = new ArrayList<CompiledMeasure>();
    if (measures == null) {
      return result;
    }
    final Set<String> allMeasureNames = new HashSet<>();
    for (var measure : measures) {
      if (measure != null && measure.getName() != null) {
        allMeasureNames.add(measure.getName());
      }
    }
    final Set<String> available = new HashSet<>(dimensionNames);
    for (var measure : measures) {
      if (measure == null || StringUtils.isBlank(measure.getName())) {
        throw new SpecException("measure must have a name");
      }
      final String name = measure.getName();
      if (dimensionNames.contains(name)) {
        throw new SpecException("measure name " + name + " conflicts with a dimension");
      }
      if (!outputNames.add(name)) {
        throw new SpecException("duplicate measure name: " + name);
      }
      final boolean hasExpression = measure.getExpression() != null;
      final boolean hasColumn = measure.getColumn() != null || measure.getAggregation() != null;
      if (hasExpression == hasColumn) {
        throw new SpecException(
            "measure " + name + " must have either column and aggregation, or expression");
      }
      if (hasExpression) {
        result.add(compileCalculated(measure, available, allMeasureNames));
      } else {
        result.add(compileAggregated(measure));
      }
      available.add(name);
    }
    return result;
  }

  private AggregatedMeasure compileAggregated(Measure measure) throws ChartDataException {
    final String name = measure.getName();
    if (StringUtils.isBlank(measure.getAggregation())) {
      throw new SpecException("measure " + name + " must have an aggregation");
    }
    final var function = AggregationFunction.forName(measure.getAggregation());
    if (function == null) {
      throw new AggregationException(measure.getAggregation());
    }
    if (function.requiresColumn() && StringUtils.isBlank(measure.getColumn())) {
      throw new SpecException(
          "measure " + name + " must have a column for " + function.stringify());
    }
    return new AggregatedMeasure(name, measure.getColumn(), function);
  }

  private CalculatedMeasure compileCalculated(
      Measure measure, Set<String> available, Set<String> allMeasureNames) throws SpecException {
    final String name = measure.getName();
    final String source = measure.getExpression();
    final CompiledExpression expression;
    try {
      expression = evaluator.compile(source);
    } catch (ExpressionException e) {
      logger.debug("Measure {} has an invalid expression: {}", name, e.getMessage());
      return new CalculatedMeasure(name, source, e.getMessage());
    }
    for (var field : expression.getReferencedFields()) {
      if (!available.contains(field) && allMeasureNames.contains(field)) {
        throw new SpecException(
            String.format(
                "measure %s refers to %s, which is not declared before it", name, field));
      }
    }
    return new CalculatedMeasure(name, source, expression);
  }
}
