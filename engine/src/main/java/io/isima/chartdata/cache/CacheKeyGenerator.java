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
package io.isima.chartdata.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.hash.Hashing;
import io.isima.chartdata.errors.PipelineError;
import io.isima.chartdata.errors.PipelineStage;
import io.isima.chartdata.errors.exception.ChartDataException;
import io.isima.chartdata.models.PipelineSpec;
import io.isima.chartdata.utils.ChartDataObjectMapperProvider;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;

/**
 * Generates cache keys.
 *
 * <p>The key is the SHA-256 digest of the canonical JSON of the source identity and the pipeline
 * specification. Two requests with equal source identities and equal specifications produce the
 * same key, independently of property or map entry order.
 */
public class CacheKeyGenerator {

  public static String generate(Object sourceIdentity, PipelineSpec spec)
      throws ChartDataException {
    final var keyObject = new LinkedHashMap<String, Object>();
    keyObject.put("source", sourceIdentity);
    keyObject.put("pipeline", spec);
    final String canonical;
    try {
      canonical = ChartDataObjectMapperProvider.getCanonical().writeValueAsString(keyObject);
    } catch (JsonProcessingException e) {
      throw new ChartDataException(
              PipelineError.GENERIC_PIPELINE_ERROR, "failed to build cache key", e)
          .setStage(PipelineStage.CACHE)
          .setContext(spec);
    }
    return Hashing.sha256().hashString(canonical, StandardCharsets.UTF_8).toString();
  }
}
