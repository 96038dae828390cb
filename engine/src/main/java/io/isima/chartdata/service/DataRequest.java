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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.isima.chartdata.models.PipelineSpec;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * A request to compute a chart data pipeline.
 *
 * <p>The rows are given either materialized or through a {@link RowSource}. The source identity
 * is any JSON serializable value that identifies the data source; it is a part of the cache key.
 * It may be omitted for inline rows, which are then identified by their content, or for requests
 * without dimensions and measures.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "rows")
public class DataRequest {
  private Object sourceIdentity;
  private PipelineSpec spec;
  private List<Map<String, Object>> rows;
  @JsonIgnore private RowSource rowSource;
  // skips the cache read, the result still replaces the cache entry
  private boolean bypassCache;
}
