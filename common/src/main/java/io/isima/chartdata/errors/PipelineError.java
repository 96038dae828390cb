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

public enum PipelineError implements ChartDataError {
  GENERIC_PIPELINE_ERROR("PIPELINE00", "Generic pipeline error"),
  INVALID_SPEC("PIPELINE01", "Invalid pipeline specification"),
  UNKNOWN_AGGREGATION("PIPELINE02", "Unknown aggregation function"),
  INVALID_EXPRESSION("PIPELINE03", "Invalid expression"),
  FETCH_FAILED("PIPELINE04", "Failed to fetch source rows"),
  OPERATION_CANCELED("PIPELINE05", "Operation canceled"),
  TIMEOUT("PIPELINE06", "Operation timed out"),
  ;

  private final String errorCode;
  private final String message;

  private PipelineError(String errorCode, String message) {
    this.errorCode = errorCode;
    this.message = message;
  }

  @Override
  public String getErrorCode() {
    return errorCode;
  }

  @Override
  public String getErrorMessage() {
    return message;
  }
}
