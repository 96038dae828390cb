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

import java.util.Map;

/** Folds the rows of a group into a single output value. */
public interface Reducer {

  /**
   * Consumes a row.
   *
   * @param acc Current accumulator, null before the first row
   * @param row The row to consume
   * @return The next accumulator
   */
  Object consume(Object acc, Map<String, ?> row);

  /** Converts the final accumulator to the output value. */
  default Object finish(Object acc) {
    return acc;
  }
}
