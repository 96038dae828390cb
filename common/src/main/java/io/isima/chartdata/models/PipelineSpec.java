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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Fully resolved aggregation pipeline specification.
 *
 * <p>The specification describes group-by dimensions, aggregated and calculated measures, a filter
 * tree, sort keys and a row limit. Parameter placeholders must have been substituted before the
 * specification reaches the engine. All properties are optional.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class PipelineSpec {
  private List<Dimension> dimensions;

  private List<Measure> measures;

  private FilterTree filters;

  private List<SortKey> sort;

  private Integer limit;

  /** Returns true if the specification requests neither grouping nor measures. */
  @JsonIgnore
  public boolean isPassThrough() {
    return (dimensions == null || dimensions.isEmpty()) && (measures == null || measures.isEmpty());
  }
}
