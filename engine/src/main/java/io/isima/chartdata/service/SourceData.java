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
package io.isima.chartdata.service;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/** Rows produced by a {@link RowSource}. */
@Getter
@AllArgsConstructor
@ToString(exclude = "rows")
public class SourceData {
  private final List<? extends Map<String, ?>> rows;

  // epoch milliseconds of the upstream refresh; null when the rows are fresh
  private final Long refreshedAt;

  public static SourceData of(List<? extends Map<String, ?>> rows) {
    return new SourceData(rows, null);
  }
}
