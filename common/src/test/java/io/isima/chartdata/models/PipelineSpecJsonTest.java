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
package io.isima.chartdata.models;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.isima.chartdata.utils.ChartDataObjectMapperProvider;
import java.util.List;
import org.junit.BeforeClass;
import org.junit.Test;

public class PipelineSpecJsonTest {

  private static ObjectMapper mapper;

  @BeforeClass
  public static void setUpBeforeClass() {
    mapper = ChartDataObjectMapperProvider.get();
  }

  @Test
  public void testFullSpec() throws Exception {
    final String src =
        "{"
            + "'dimensions': ['region', {'name': 'month', 'field': 'date', 'transform': 'month',"
            + "  'type': 'date'}],"
            + "'measures': ["
            + "  {'column': 'revenue', 'aggregation': 'sum', 'name': 'total_revenue'},"
            + "  {'aggregation': 'count', 'name': 'orders'},"
            + "  {'expression': 'total_revenue / orders', 'name': 'per_order'}],"
            + "'filters': {'combinator': 'or', 'rules': ["
            + "  {'field': 'region', 'operator': 'in', 'value': ['North', 'South']},"
            + "  {'field': 'total_revenue', 'operator': '>', 'value': 1000}]},"
            + "'sort': [{'field': 'total_revenue', 'direction': 'desc'}, {'field': 'region'}],"
            + "'limit': 10,"
            + "'title': 'ignored'"
            + "}";
    final var spec = mapper.readValue(src.replace('\'', '"'), PipelineSpec.class);

    assertEquals(2, spec.getDimensions().size());
    assertEquals(Dimension.of("region"), spec.getDimensions().get(0));
    final var month = spec.getDimensions().get(1);
    assertThat(month.getName(), is("month"));
    assertThat(month.getSourceField(), is("date"));
    assertThat(month.getTransform(), is(DimensionTransform.MONTH));
    assertThat(month.getType(), is(DimensionType.DATE));
    assertTrue(month.isComputed());

    assertEquals(3, spec.getMeasures().size());
    assertEquals(
        Measure.aggregated("revenue", "sum", "total_revenue"), spec.getMeasures().get(0));
    assertThat(spec.getMeasures().get(1).getColumn(), nullValue());
    assertEquals(
        Measure.calculated("total_revenue / orders", "per_order"), spec.getMeasures().get(2));

    assertThat(spec.getFilters().getCombinator(), is(Combinator.OR));
    assertEquals(List.of("North", "South"), spec.getFilters().getRules().get(0).getValue());
    assertEquals(1000, spec.getFilters().getRules().get(1).getValue());

    assertEquals(List.of(SortKey.desc("total_revenue"), SortKey.asc("region")), spec.getSort());
    assertThat(spec.getLimit(), is(10));
    assertFalse(spec.isPassThrough());
  }

  @Test
  public void testEmptySpecIsPassThrough() throws Exception {
    final var spec = mapper.readValue("{}", PipelineSpec.class);
    assertTrue(spec.isPassThrough());
    assertThat(spec.getLimit(), nullValue());
  }

  @Test
  public void testFilterCombinatorDefaultsToAnd() throws Exception {
    final var tree =
        mapper.readValue(
            "{\"rules\": [{\"field\": \"a\", \"operator\": \"=\", \"value\": 1}]}",
            FilterTree.class);
    assertThat(tree.getCombinator(), is(Combinator.AND));
  }

  @Test(expected = JsonProcessingException.class)
  public void testDimensionWithoutName() throws Exception {
    mapper.readValue("{\"dimensions\": [{\"field\": \"date\"}]}", PipelineSpec.class);
  }

  @Test
  public void testCanonicalSerializationIgnoresBuildOrder() throws Exception {
    final var canonical = ChartDataObjectMapperProvider.getCanonical();
    final var first =
        PipelineSpec.builder()
            .dimensions(List.of(Dimension.of("region")))
            .measures(List.of(Measure.aggregated("revenue", "sum", "total")))
            .limit(5)
            .build();
    final var second = new PipelineSpec();
    second.setLimit(5);
    second.setMeasures(List.of(Measure.aggregated("revenue", "sum", "total")));
    second.setDimensions(List.of(Dimension.of("region")));
    assertEquals(canonical.writeValueAsString(first), canonical.writeValueAsString(second));
  }
}
