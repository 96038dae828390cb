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
package io.isima.chartdata.grammar.utils;

import io.isima.chartdata.errors.exception.ExpressionException;
import org.apache.commons.lang3.StringUtils;

public class ComputationUtil {

  /**
   * Converts a field value to double.
   *
   * <p>Numbers are widened and numeric strings are parsed. Anything else, null included, is
   * rejected.
   */
  public static double getValueAsDouble(String fieldName, Object value)
      throws ExpressionException {
    if (value == null) {
      throw new ExpressionException("field " + fieldName + " is null");
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      final String src = ((String) value).trim();
      if (!StringUtils.isEmpty(src)) {
        try {
          return Double.parseDouble(src);
        } catch (NumberFormatException e) {
          throw new ExpressionException("field " + fieldName + " is not numeric");
        }
      }
    }
    throw new ExpressionException("field " + fieldName + " is not numeric");
  }
}
