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

import com.google.common.collect.ImmutableList;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.PipelineStage;
import io.isima.chartdata.errors.exception.ChartDataException;
import io.isima.chartdata.query.aggregate.GroupCalculator;
import io.isima.chartdata.query.aggregate.Reducer;
import io.isima.chartdata.query.filter.FilterEngine;
import io.isima.chartdata.query.measure.AggregatedMeasure;
import io.isima.chartdata.query.measure.CalculatedMeasureResolver;
import io.isima.chartdata.query.measure.CompiledMeasure;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a compiled pipeline over a set of rows.
 *
 * <p>The stages are: computed dimensions, pre-aggregation filter, grouping and aggregation,
 * calculated measures, post-aggregation filter, sort and limit. Input rows are never modified;
 * the returned rows are new unmodifiable maps.
 */
public class PipelineExecutor {
  private static final Logger logger = LoggerFactory.getLogger(PipelineExecutor.class);

  /**
   * Executes a pipeline.
   *
   * @param pipeline The compiled pipeline
   * @param rows Source rows
   * @param diagnostics Collector of non-fatal issues
   * @return Output rows
   * @throws ChartDataException when a stage fails unexpectedly; the exception carries the stage
   *     and the pipeline specification
   */
  public List<Map<String, Object>> execute(
      CompiledPipeline pipeline, List<? extends Map<String, ?>> rows, Diagnostics diagnostics)
      throws ChartDataException {
    pipeline.getCompileDiagnostics().forEach(diagnostics::report);
    final List<Map<String, ?>> source = Collections.unmodifiableList(rows);
    final List<Map<String, Object>> output;
    if (pipeline.isPassThrough()) {
      output = passThrough(pipeline, source, diagnostics);
    } else {
      output = aggregate(pipeline, source, diagnostics);
    }
    final var result = ImmutableList.<Map<String, Object>>builder();
    output.forEach((row) -> result.add(Collections.unmodifiableMap(row)));
    return result.build();
  }

  private List<Map<String, Object>> passThrough(
      CompiledPipeline pipeline, List<Map<String, ?>> rows, Diagnostics diagnostics)
      throws ChartDataException {
    final var filtered =
        runStage(
            pipeline,
            PipelineStage.PRE_FILTER,
            () -> FilterEngine.apply(rows, pipeline.getAllFilters(), diagnostics));
    final var sorted =
        runStage(pipeline, PipelineStage.SORT, () -> pipeline.getSortLimit().apply(filtered));
    final List<Map<String, Object>> output = new ArrayList<>(sorted.size());
    for (var row : sorted) {
      final Map<String, Object> copy = new LinkedHashMap<>(row);
      output.add(copy);
    }
    return output;
  }

  private List<Map<String, Object>> aggregate(
      CompiledPipeline pipeline, List<Map<String, ?>> rows, Diagnostics diagnostics)
      throws ChartDataException {
    final List<Map<String, ?>> prepared =
        runStage(pipeline, PipelineStage.PRE_FILTER, () -> derive(pipeline, rows, diagnostics));

    final var filtered =
        runStage(
            pipeline,
            PipelineStage.PRE_FILTER,
            () ->
                FilterEngine.apply(
                    prepared, pipeline.getFilters().getPreAggregation(), diagnostics));

    final List<Map<String, Object>> grouped =
        runStage(
            pipeline, PipelineStage.GROUP, () -> createCalculator(pipeline).calculate(filtered));
    logger.trace("Grouped {} rows into {} groups", filtered.size(), grouped.size());

    runStage(
        pipeline,
        PipelineStage.CALCULATE,
        () -> {
          new CalculatedMeasureResolver(pipeline.getDimensionNames(), pipeline.getMeasures())
              .resolve(grouped, diagnostics);
          return null;
        });

    final var having =
        runStage(
            pipeline,
            PipelineStage.POST_FILTER,
            () ->
                FilterEngine.apply(
                    grouped, pipeline.getFilters().getPostAggregation(), diagnostics));

    return runStage(pipeline, PipelineStage.SORT, () -> pipeline.getSortLimit().apply(having));
  }

  private List<Map<String, ?>> derive(
      CompiledPipeline pipeline, List<Map<String, ?>> rows, Diagnostics diagnostics) {
    if (!pipeline.hasDerivedDimensions()) {
      return rows;
    }
    final var dimensions = pipeline.getDimensions();
    final List<Map<String, ?>> prepared = new ArrayList<>(rows.size());
    for (var row : rows) {
      final Map<String, Object> copy = new LinkedHashMap<>(row);
      for (var dimension : dimensions) {
        if (dimension.isDerived()) {
          copy.put(dimension.getName(), dimension.derive(row, diagnostics));
        }
      }
      prepared.add(copy);
    }
    return prepared;
  }

  private GroupCalculator createCalculator(CompiledPipeline pipeline) {
    final List<String> outAttributes = new ArrayList<>();
    final List<Reducer> reducers = new ArrayList<>();
    for (CompiledMeasure measure : pipeline.getMeasures()) {
      outAttributes.add(measure.getName());
      reducers.add(measure.isCalculated() ? null : ((AggregatedMeasure) measure).createReducer());
    }
    return new GroupCalculator(pipeline.getDimensionNames(), outAttributes, reducers);
  }

  private static <T> T runStage(CompiledPipeline pipeline, PipelineStage stage, Callable<T> task)
      throws ChartDataException {
    try {
      return task.call();
    } catch (ChartDataException e) {
      if (e.getStage() == null) {
        e.setStage(stage);
      }
      e.setContext(pipeline.getSpec());
      throw e;
    } catch (Exception e) {
      logger.error("Pipeline stage {} failed; spec={}", stage.stringify(), pipeline.getSpec(), e);
      throw new ChartDataException(
              PipelineError.GENERIC_PIPELINE_ERROR,
              String.format("%s stage failed: %s", stage.stringify(), e.getMessage()),
              e)
          .setStage(stage)
          .setContext(pipeline.getSpec());
    }
  }
}
