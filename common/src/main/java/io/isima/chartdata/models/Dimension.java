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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A group-by dimension.
 *
 * <p>A plain dimension refers to a row field by its name. A computed dimension reads the source
 * field and applies either a date truncation or an arithmetic expression to it; the output is
 * stored under the dimension name.
 *
 * <p>In JSON, a plain dimension may be written as a bare string.
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(using = DimensionDeserializer.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class Dimension {
  private String name;

  // source field name, the name is used when omitted
  private String field;

  private DimensionTransform transform;

  private String expression;

  private DimensionType type;

  public static Dimension of(String name) {
    return new Dimension(name, null, null, null, null);
  }

  public static Dimension truncated(
      String name, String field, DimensionTransform transform, DimensionType type) {
    return new Dimension(name, field, transform, null, type);
  }

  public static Dimension computed(String name, String expression, DimensionType type) {
    return new Dimension(name, null, null, expression, type);
  }

  @JsonIgnore
  public String getSourceField() {
    return field != null ? field : name;
  }

  @JsonIgnore
  public boolean isComputed() {
    return transform != null || expression != null;
  }
}
