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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import io.isima.chartdata.diagnostics.DiagnosticKind;
import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.PipelineStage;
import io.isima.chartdata.errors.exception.AggregationException;
import io.isima.chartdata.errors.exception.ChartDataException;
import io.isima.chartdata.errors.exception.SpecException;
import io.isima.chartdata.grammar.ExpressionEvaluator;
import io.isima.chartdata.models.Dimension;
import io.isima.chartdata.models.DimensionTransform;
import io.isima.chartdata.models.DimensionType;
import io.isima.chartdata.models.FilterRule;
import io.isima.chartdata.models.FilterTree;
import io.isima.chartdata.models.Measure;
import io.isima.chartdata.models.PipelineSpec;
import io.isima.chartdata.query.measure.CalculatedMeasure;
import java.util.List;
import org.junit.Before;
import org.junit.Test;

public class PipelineCompilerTest {

  private PipelineCompiler compiler;

  @Before
  public void setUp() {
    compiler = new PipelineCompiler(new ExpressionEvaluator(500, 64, 100), false);
  }

  private static PipelineSpec spec(List<Dimension> dimensions, Measure... measures) {
    return PipelineSpec.builder().dimensions(dimensions).measures(List.of(measures)).build();
  }

  private void assertSpecError(PipelineSpec spec, String messagePart) {
    try {
      compiler.compile(spec);
      fail("SpecException is expected");
    } catch (SpecException e) {
      assertThat(e.getMessage(), containsString(messagePart));
      assertThat(e.getStage(), is(PipelineStage.VALIDATE));
      assertThat(e.getContext(), sameInstance(spec));
    } catch (ChartDataException e) {
      fail("unexpected exception " + e);
    }
  }

  @Test
  public void testValidSpec() throws Exception {
    final var pipeline =
        compiler.compile(
            PipelineSpec.builder()
                .dimensions(
                    List.of(
                        Dimension.of("region"),
                        Dimension.truncated(
                            "month", "date", DimensionTransform.MONTH, DimensionType.DATE)))
                .measures(
                    List.of(
                        Measure.aggregated("revenue", "sum", "revenue_total"),
                        Measure.aggregated("cost", "mean", "cost_avg"),
                        Measure.count("orders"),
                        Measure.calculated("revenue_total / orders", "per_order")))
                .filters(
                    FilterTree.and(
                        new FilterRule("region", "=", "North"),
                        new FilterRule("orders", ">", 3)))
                .limit(10)
                .build());
    assertFalse(pipeline.isPassThrough());
    assertEquals(List.of("region", "month"), pipeline.getDimensionNames());
    assertEquals(4, pipeline.getMeasures().size());
    assertTrue(pipeline.getMeasures().get(3).isCalculated());
    assertTrue(pipeline.hasDerivedDimensions());
    assertEquals(1, pipeline.getFilters().getPreAggregation().getRules().size());
    assertEquals(1, pipeline.getFilters().getPostAggregation().getRules().size());
    assertThat(pipeline.getSortLimit().getLimit(), is(10));
    assertTrue(pipeline.getCompileDiagnostics().isEmpty());
  }

  @Test
  public void testUnknownAggregation() throws Exception {
    final var spec = spec(List.of(Dimension.of("region")), Measure.aggregated("a", "median", "m"));
    try {
      compiler.compile(spec);
      fail("AggregationException is expected");
    } catch (AggregationException e) {
      assertThat(e.getErrorCode(), is(PipelineError.UNKNOWN_AGGREGATION.getErrorCode()));
      assertThat(e.getMessage(), containsString("median"));
      assertThat(e.getContext(), sameInstance(spec));
    }
  }

  @Test
  public void testMalformedMeasures() {
    assertSpecError(
        spec(List.of(), new Measure(null, null, null, "empty")), "must have either column");
    assertSpecError(
        spec(List.of(), new Measure("revenue", "sum", "revenue * 2", "both")),
        "must have either column");
    assertSpecError(spec(List.of(), Measure.aggregated(null, "sum", "s")), "must have a column");
    assertSpecError(
        spec(List.of(), Measure.aggregated("revenue", null, "s")), "must have an aggregation");
    assertSpecError(spec(List.of(), Measure.aggregated("revenue", "sum", " ")), "must have a name");
  }

  @Test
  public void testNameConflicts() {
    assertSpecError(
        spec(List.of(Dimension.of("region"), Dimension.of("region")), Measure.count("n")),
        "duplicate dimension name");
    assertSpecError(
        spec(List.of(Dimension.of("region")), Measure.count("n"), Measure.count("n")),
        "duplicate measure name");
    assertSpecError(
        spec(List.of(Dimension.of("region")), Measure.count("region")),
        "conflicts with a dimension");
  }

  @Test
  public void testForwardReference() {
    assertSpecError(
        spec(
            List.of(),
            Measure.calculated("revenue_total - cost_total", "profit"),
            Measure.aggregated("revenue", "sum", "revenue_total"),
            Measure.aggregated("cost", "sum", "cost_total")),
        "not declared before it");
    assertSpecError(
        spec(List.of(), Measure.calculated("ratio * 2", "ratio")), "not declared before it");
  }

  @Test
  public void testNegativeLimit() {
    assertSpecError(
        PipelineSpec.builder().measures(List.of(Measure.count("n"))).limit(-1).build(),
        "limit must not be negative");
  }

  @Test
  public void testZeroLimit() throws Exception {
    final var spec = PipelineSpec.builder().measures(List.of(Measure.count("n"))).limit(0).build();
    assertThat(compiler.compile(spec).getSortLimit().getLimit(), nullValue());
    final var strict = new PipelineCompiler(new ExpressionEvaluator(500, 64, 100), true);
    assertThat(strict.compile(spec).getSortLimit().getLimit(), is(0));
  }

  @Test
  public void testInvalidExpressionIsNotFatal() throws Exception {
    final var pipeline =
        compiler.compile(
            spec(
                List.of(),
                Measure.count("n"),
                Measure.calculated("n +", "broken")));
    final var measure = (CalculatedMeasure) pipeline.getMeasures().get(1);
    assertThat(measure.getExpression(), nullValue());
    assertThat(measure.getCompileError(), containsString("unexpected end of expression"));
  }

  @Test
  public void testUnknownFilterFieldIsRecorded() throws Exception {
    final var pipeline =
        compiler.compile(
            PipelineSpec.builder()
                .dimensions(List.of(Dimension.of("region")))
                .measures(List.of(Measure.count("n")))
                .filters(FilterTree.and(new FilterRule("channel", "=", "web")))
                .build());
    assertEquals(1, pipeline.getCompileDiagnostics().size());
    assertThat(
        pipeline.getCompileDiagnostics().get(0).getKind(),
        is(DiagnosticKind.UNKNOWN_FILTER_FIELD));
  }

  @Test
  public void testPassThrough() throws Exception {
    final var pipeline =
        compiler.compile(
            PipelineSpec.builder()
                .filters(FilterTree.and(new FilterRule("channel", "=", "web")))
                .build());
    assertTrue(pipeline.isPassThrough());
    assertTrue(pipeline.getCompileDiagnostics().isEmpty());
  }
}
