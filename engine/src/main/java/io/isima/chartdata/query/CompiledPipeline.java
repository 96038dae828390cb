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
package io.isima.chartdata.query;

import io.isima.chartdata.diagnostics.Diagnostic;
import io.isima.chartdata.models.FilterTree;
import io.isima.chartdata.models.PipelineSpec;
import io.isima.chartdata.query.aggregate.CompiledDimension;
import io.isima.chartdata.query.filter.ClassifiedFilters;
import io.isima.chartdata.query.measure.CompiledMeasure;
import io.isima.chartdata.query.sort.SortLimitStage;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A validated pipeline specification ready for execution.
 *
 * <p>Instances are immutable and may be executed any number of times against different rows.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class CompiledPipeline {
  // snapshot of the source specification, attached to errors as context
  private final PipelineSpec spec;
  private final boolean passThrough;
  private final List<CompiledDimension> dimensions;
  private final List<String> dimensionNames;
  private final List<CompiledMeasure> measures;
  private final ClassifiedFilters filters;
  // the unclassified filter tree, used by a pass-through pipeline
  private final FilterTree allFilters;
  private final SortLimitStage sortLimit;
  // issues found while compiling, reported again by every execution
  private final List<Diagnostic> compileDiagnostics;

  /** Returns true if any dimension needs to be computed from source rows. */
  public boolean hasDerivedDimensions() {
    return dimensions.stream().anyMatch(CompiledDimension::isDerived);
  }
}
