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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.opengraphite.data.ConsolidationFunction;
import net.opengraphite.data.MetricData;

public class TestJsonReadCacheSerdes {
  private final JsonReadCacheSerdes serdes = new JsonReadCacheSerdes();
  
  @Test
  public void serializeAndBack() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("scale(a.b,2)")
        .setStart(60)
        .setStop(300L)
        .setStep(60)
        .setValues(new double[] { 1.5, Double.NaN, -3, 0 })
        .setValuesPerPoint(2)
        .setConsolidation(ConsolidationFunction.MAX)
        .setXFilesFactor(0.5f)
        .setPathExpression("a.b")
        .setColor("red")
        .addTag("host", "web01")
        .build();
    final MetricData plain = MetricData.newBuilder()
        .setName("c.d")
        .setStart(0)
        .setStep(10)
        .setValues(new double[0])
        .build();
    
    final List<MetricData> results = 
        serdes.deserialize(serdes.serialize(Lists.newArrayList(series, plain)));
    assertEquals(2, results.size());
    
    final MetricData result = results.get(0);
    assertEquals("scale(a.b,2)", result.name());
    assertEquals(60, result.start());
    assertEquals(300, result.stop());
    assertEquals(60, result.step());
    assertEquals(2, result.valuesPerPoint());
    assertEquals(ConsolidationFunction.MAX, result.consolidation());
    assertEquals(0.5f, result.xFilesFactor(), 0.0001);
    assertEquals("a.b", result.pathExpression());
    assertEquals("red", result.color());
    assertNull(result.lineStyle());
    assertEquals("web01", result.tags().get("host"));
    assertEquals("scale(a.b,2)", result.tags().get("name"));
    assertEquals(4, result.size());
    assertEquals(1.5, result.value(0), 0.0001);
    assertTrue(result.isAbsent(1));
    assertEquals(-3, result.value(2), 0.0001);
    assertFalse(result.isAbsent(3));
    assertEquals(0, result.value(3), 0.0001);
    
    assertEquals("c.d", results.get(1).name());
    assertEquals(0, results.get(1).size());
    assertEquals(ConsolidationFunction.AVERAGE, 
        results.get(1).consolidation());
  }
  
  @Test
  public void nonFiniteValues() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a.b")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { Double.POSITIVE_INFINITY, 
            Double.NEGATIVE_INFINITY })
        .build();
    final MetricData result = 
        serdes.deserialize(serdes.serialize(Lists.newArrayList(series))).get(0);
    assertEquals(Double.POSITIVE_INFINITY, result.value(0), 0);
    assertEquals(Double.NEGATIVE_INFINITY, result.value(1), 0);
  }
  
  @Test
  public void serializeEmpty() throws Exception {
    final byte[] data = serdes.serialize(Lists.<MetricData>newArrayList());
    assertEquals("{\"series\":[]}", new String(data, StandardCharsets.UTF_8));
    assertTrue(serdes.deserialize(data).isEmpty());
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void serializeNull() throws Exception {
    serdes.serialize(null);
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void deserializeMissingArray() throws Exception {
    serdes.deserialize("{\"data\":[]}".getBytes(StandardCharsets.UTF_8));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void deserializeGarbage() throws Exception {
    serdes.deserialize("not json".getBytes(StandardCharsets.UTF_8));
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void deserializeNull() throws Exception {
    serdes.deserialize(null);
  }
}
