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
package io.isima.chartdata.errors;

/** Stages of a chart data pipeline, used to tell where a fatal error happened. */
public enum PipelineStage {
  VALIDATE,
  FETCH,
  PRE_FILTER,
  GROUP,
  CALCULATE,
  POST_FILTER,
  SORT,
  CACHE;

  public String stringify() {
    return name().toLowerCase().replace('_', '-');
  }
}
