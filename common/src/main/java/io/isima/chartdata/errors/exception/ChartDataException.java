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

import io.isima.chartdata.errors.ChartDataError;
import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.PipelineStage;
import java.util.Objects;
import lombok.Getter;
import lombok.Setter;

/**
 * An exception thrown when a chart data pipeline fails.
 *
 * <p>The host is expected to render the chart in an error state when it receives this exception.
 * The stage and context properties carry enough information to tell which part of the pipeline
 * failed and for which specification.
 */
public class ChartDataException extends Exception implements ChartDataError {

  private static final long serialVersionUID = 4620316925093711873L;

  protected final ChartDataError info;

  protected String mymessage;
  // Internal error message used for troubleshooting, not shown in the chart
  @Setter @Getter protected String internalMessage;

  protected PipelineStage stage;
  protected Object context;

  public ChartDataException(String message) {
    this.info = PipelineError.GENERIC_PIPELINE_ERROR;
    mymessage = message;
  }

  public ChartDataException(String message, Throwable t) {
    super(t);
    this.info = PipelineError.GENERIC_PIPELINE_ERROR;
    mymessage = message;
  }

  public ChartDataException(ChartDataError info) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public ChartDataException(ChartDataError info, String additionalMessage) {
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public ChartDataException(ChartDataError info, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage();
    this.info = info;
  }

  public ChartDataException(ChartDataError info, String additionalMessage, Throwable t) {
    super(t);
    Objects.requireNonNull(info, "'info' must not be null");
    mymessage = info.getErrorMessage() + ": " + additionalMessage;
    this.info = info;
  }

  public ChartDataError getInfo() {
    return info;
  }

  public PipelineStage getStage() {
    return stage;
  }

  public ChartDataException setStage(PipelineStage stage) {
    this.stage = stage;
    return this;
  }

  public Object getContext() {
    return context;
  }

  public ChartDataException setContext(Object context) {
    this.context = context;
    return this;
  }

  @Override
  public String getErrorCode() {
    return info.getErrorCode();
  }

  @Override
  public String getMessage() {
    return mymessage;
  }

  @Override
  public String getErrorMessage() {
    return getMessage();
  }

  public void appendMessage(final String additional) {
    mymessage += "; " + additional;
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder(super.toString());
    if (stage != null) {
      sb.append(" [stage=").append(stage.stringify()).append("]");
    }
    if (internalMessage != null) {
      sb.append(" (").append(internalMessage).append(" )");
    }
    return sb.toString();
  }
}
