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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Measure definition as written by a dashboard author.
 *
 * <p>A measure is either aggregated ({@code column} and {@code aggregation}) or calculated
 * ({@code expression}). The aggregation function is kept as a string here so that an unknown name
 * is reported by the pipeline compiler rather than by the JSON reader.
 */
@JsonInclude(Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class Measure {
  private String column;

  private String aggregation;

  private String expression;

  private String name;

  public static Measure aggregated(String column, String aggregation, String name) {
    return new Measure(column, aggregation, null, name);
  }

  public static Measure count(String name) {
    return new Measure(null, AggregationFunction.COUNT.stringify(), null, name);
  }

  public static Measure calculated(String expression, String name) {
    return new Measure(null, null, expression, name);
  }
}
