// This file is part of OpenGraphite.
// Copyright (C) 2024  The OpenGraphite Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.opengraphite.query.readcache;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import net.opengraphite.data.ConsolidationFunction;
import net.opengraphite.data.MetricData;
import net.opengraphite.utils.JSON;
import net.opengraphite.utils.JSONException;

/**
 * A JSON serializer that converts result series into cacheable bytes and 
 * vice-versa. Absent samples are written as nulls.
 * 
 * @since 1.0
 */
public class JsonReadCacheSerdes implements ReadCacheSerdes {

  @Override
  public byte[] serialize(final List<MetricData> series) {
    if (series == null) {
      throw new IllegalArgumentException("Series cannot be null.");
    }
    final ByteArrayOutputStream stream = new ByteArrayOutputStream();
    try {
      final JsonGenerator json = JSON.getFactory().createGenerator(stream);
      json.writeStartObject();
      json.writeArrayFieldStart("series");
      for (final MetricData data : series) {
        serialize(data, json);
      }
      json.writeEndArray();
      json.writeEndObject();
      json.close();
    } catch (IOException e) {
      throw new JSONException("Failed to serialize series", e);
    }
    return stream.toByteArray();
  }
  
  @Override
  public List<MetricData> deserialize(final byte[] data) {
    final JsonNode root = JSON.parseToNode(data);
    final JsonNode series = root.get("series");
    if (series == null || !series.isArray()) {
      throw new IllegalArgumentException("Missing the series array.");
    }
    final List<MetricData> results = 
        Lists.newArrayListWithCapacity(series.size());
    for (final JsonNode node : series) {
      results.add(deserialize(node));
    }
    return results;
  }
  
  private static void serialize(final MetricData data, 
                                final JsonGenerator json) throws IOException {
    json.writeStartObject();
    json.writeStringField("name", data.name());
    json.writeNumberField("start", data.start());
    json.writeNumberField("stop", data.stop());
    json.writeNumberField("step", data.step());
    json.writeNumberField("valuesPerPoint", data.valuesPerPoint());
    json.writeStringField("consolidation", data.consolidation().name());
    json.writeNumberField("xFilesFactor", data.xFilesFactor());
    if (data.pathExpression() != null) {
      json.writeStringField("pathExpression", data.pathExpression());
    }
    if (data.color() != null) {
      json.writeStringField("color", data.color());
    }
    if (data.lineStyle() != null) {
      json.writeStringField("lineStyle", data.lineStyle());
    }
    json.writeObjectFieldStart("tags");
    for (final Entry<String, String> tag : data.tags().entrySet()) {
      json.writeStringField(tag.getKey(), tag.getValue());
    }
    json.writeEndObject();
    json.writeArrayFieldStart("values");
    for (int i = 0; i < data.size(); i++) {
      if (data.isAbsent(i)) {
        json.writeNull();
      } else {
        json.writeNumber(data.value(i));
      }
    }
    json.writeEndArray();
    json.writeEndObject();
  }
  
  private static MetricData deserialize(final JsonNode node) {
    final JsonNode values_node = node.get("values");
    final double[] values = new double[values_node.size()];
    final boolean[] absent = new boolean[values.length];
    for (int i = 0; i < values.length; i++) {
      final JsonNode value = values_node.get(i);
      if (value.isNull()) {
        absent[i] = true;
        values[i] = Double.NaN;
      } else {
        values[i] = value.asDouble();
      }
    }
    
    final Map<String, String> tags = Maps.newHashMap();
    final Iterator<Entry<String, JsonNode>> it = node.get("tags").fields();
    while (it.hasNext()) {
      final Entry<String, JsonNode> tag = it.next();
      tags.put(tag.getKey(), tag.getValue().asText());
    }
    
    return MetricData.newBuilder()
        .setName(node.get("name").asText())
        .setStart(node.get("start").asLong())
        .setStop(node.get("stop").asLong())
        .setStep(node.get("step").asLong())
        .setValues(values)
        .setAbsent(absent)
        .setValuesPerPoint(node.get("valuesPerPoint").asInt())
        .setConsolidation(ConsolidationFunction.valueOf(
            node.get("consolidation").asText()))
        .setXFilesFactor((float) node.get("xFilesFactor").asDouble())
        .setPathExpression(text(node, "pathExpression"))
        .setColor(text(node, "color"))
        .setLineStyle(text(node, "lineStyle"))
        .setTags(tags)
        .build();
  }
  
  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
