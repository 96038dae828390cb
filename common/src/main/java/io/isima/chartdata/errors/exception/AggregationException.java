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
package io.isima.chartdata.errors.exception;

import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.PipelineStage;

/**
 * Thrown when a measure uses an aggregation function the engine does not know.
 *
 * <p>This is fatal for the whole pipeline since the output shape would be wrong without the
 * measure.
 */
public class AggregationException extends ChartDataException {
  private static final long serialVersionUID = 7381990543190834612L;

  public AggregationException(String function) {
    super(PipelineError.UNKNOWN_AGGREGATION, function);
    stage = PipelineStage.VALIDATE;
  }
}
