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
package io.isima.chartdata.query.aggregate;

import io.isima.chartdata.diagnostics.DiagnosticKind;
import io.isima.chartdata.diagnostics.Diagnostics;
import io.isima.chartdata.errors.exception.ExpressionException;
import io.isima.chartdata.grammar.CompiledExpression;
import io.isima.chartdata.models.Dimension;
import io.isima.chartdata.models.DimensionTransform;
import io.isima.chartdata.models.DimensionType;
import io.isima.chartdata.query.ValueUtils;
import java.time.Instant;
import java.util.Map;
import lombok.Getter;

/**
 * A dimension resolved for execution.
 *
 * <p>A derived dimension produces its value from the row, by date truncation, by an arithmetic
 * expression or by type coercion of the source field. A plain dimension reads the field of its
 * name as it is.
 */
@Getter
public class CompiledDimension {
  private final String name;
  private final String sourceField;
  private final DimensionTransform transform;
  private final CompiledExpression expression;
  // set when the expression does not compile
  private final String expressionError;
  private final DimensionType type;

  private CompiledDimension(
      String name,
      String sourceField,
      DimensionTransform transform,
      CompiledExpression expression,
      String expressionError,
      DimensionType type) {
    this.name = name;
    this.sourceField = sourceField;
    this.transform = transform;
    this.expression = expression;
    this.expressionError = expressionError;
    this.type = type;
  }

  public static CompiledDimension plain(Dimension dimension) {
    return new CompiledDimension(
        dimension.getName(),
        dimension.getSourceField(),
        dimension.getTransform(),
        null,
        null,
        dimension.getType());
  }

  public static CompiledDimension withExpression(
      Dimension dimension, CompiledExpression expression, String expressionError) {
    return new CompiledDimension(
        dimension.getName(),
        dimension.getSourceField(),
        null,
        expression,
        expressionError,
        dimension.getType());
  }

  /** Returns true if the output value is not simply the row's field of the same name. */
  public boolean isDerived() {
    return transform != null
        || expression != null
        || expressionError != null
        || type != null
        || !name.equals(sourceField);
  }

  /**
   * Computes the dimension value of a row.
   *
   * <p>Failures are reported to the diagnostics and produce null.
   */
  public Object derive(Map<String, ?> row, Diagnostics diagnostics) {
    final Object raw;
    if (expressionError != null) {
      diagnostics.report(DiagnosticKind.DIMENSION_FAILURE, name, expressionError);
      return null;
    } else if (expression != null) {
      try {
        raw = expression.evaluate(row);
      } catch (ExpressionException e) {
        diagnostics.report(DiagnosticKind.DIMENSION_FAILURE, name, e.getMessage());
        return null;
      }
    } else if (transform != null) {
      final Object source = row.get(sourceField);
      if (source == null) {
        return null;
      }
      raw = DateTruncator.truncate(source, transform);
      if (raw == null) {
        diagnostics.report(
            DiagnosticKind.DIMENSION_FAILURE,
            name,
            String.format("field %s is not a date", sourceField));
        return null;
      }
    } else {
      raw = row.get(sourceField);
    }
    return coerce(raw, diagnostics);
  }

  private Object coerce(Object value, Diagnostics diagnostics) {
    if (value == null || type == null) {
      return value;
    }
    Object result = null;
    switch (type) {
      case STRING:
        result = value.toString();
        break;
      case NUMBER:
        if (value instanceof Instant) {
          result = ((Instant) value).toEpochMilli();
        } else {
          final Double number = ValueUtils.toDoubleOrNull(value);
          result = number == null ? null : ValueUtils.normalizeKey(number);
        }
        break;
      case BOOLEAN:
        if (value instanceof Boolean) {
          result = value;
        } else if (value instanceof Number) {
          result = ((Number) value).doubleValue() != 0;
        } else if ("true".equalsIgnoreCase(value.toString().trim())) {
          result = Boolean.TRUE;
        } else if ("false".equalsIgnoreCase(value.toString().trim())) {
          result = Boolean.FALSE;
        }
        break;
      case DATE:
        if (value instanceof Number) {
          result = Instant.ofEpochMilli(((Number) value).longValue());
        } else {
          result = ValueUtils.toInstantOrNull(value);
        }
        break;
      default:
        result = value;
    }
    if (result == null) {
      diagnostics.report(
          DiagnosticKind.DIMENSION_FAILURE,
          name,
          String.format("value cannot be converted to %s", type.stringify()));
    }
    return result;
  }
}
