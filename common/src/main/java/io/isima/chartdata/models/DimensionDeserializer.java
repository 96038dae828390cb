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
package io.isima.chartdata.models;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.Optional;

/** Reads a dimension written either as a bare field name or as an object. */
class DimensionDeserializer extends StdDeserializer<Dimension> {
  private static final long serialVersionUID = -6021487390918835613L;

  protected DimensionDeserializer() {
    this(null);
  }

  protected DimensionDeserializer(Class<?> vc) {
    super(vc);
  }

  @Override
  public Dimension deserialize(JsonParser jp, DeserializationContext deserializationContext)
      throws IOException {
    final JsonNode node = jp.getCodec().readTree(jp);
    if (node.isTextual()) {
      return Dimension.of(node.asText());
    }
    if (!node.isObject()) {
      throw new JsonParseException(jp, "Dimension must be a string or an object");
    }
    final var dimension = new Dimension();
    try {
      dimension.setName(
          Optional.ofNullable(node.get("name"))
              .orElseThrow(() -> new JsonParseException(jp, "Property 'name' must exist"))
              .asText());
      Optional.ofNullable(node.get("field")).ifPresent((v) -> dimension.setField(v.asText()));
      Optional.ofNullable(node.get("transform"))
          .ifPresent((v) -> dimension.setTransform(DimensionTransform.forValue(v.asText())));
      Optional.ofNullable(node.get("expression"))
          .ifPresent((v) -> dimension.setExpression(v.asText()));
      Optional.ofNullable(node.get("type"))
          .ifPresent((v) -> dimension.setType(DimensionType.forValue(v.asText())));
    } catch (IllegalArgumentException e) {
      throw new JsonParseException(jp, e.getMessage());
    }
    return dimension;
  }
}
