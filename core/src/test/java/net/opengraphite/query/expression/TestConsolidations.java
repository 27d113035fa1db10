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
package net.opengraphite.query.expression;

import static net.opengraphite.query.expression.SeriesForTest.NaN;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;

public class TestConsolidations {
  private static final double[] VALUES = new double[] { 3, NaN, 1, 4, 2 };
  
  @Test
  public void summarize() throws Exception {
    assertEquals(10, Consolidations.summarize("sum", VALUES, 0), 0.0001);
    assertEquals(10, Consolidations.summarize("total", VALUES, 0), 0.0001);
    assertEquals(2.5, Consolidations.summarize("avg", VALUES, 0), 0.0001);
    assertEquals(2.5, Consolidations.summarize("average", VALUES, 0), 0.0001);
    assertEquals(2, Consolidations.summarize("avg_zero", VALUES, 0), 0.0001);
    assertEquals(2.5, Consolidations.summarize("median", VALUES, 0), 0.0001);
    assertEquals(4, Consolidations.summarize("max", VALUES, 0), 0.0001);
    assertEquals(1, Consolidations.summarize("min", VALUES, 0), 0.0001);
    assertEquals(2, Consolidations.summarize("last", VALUES, 0), 0.0001);
    assertEquals(2, Consolidations.summarize("current", VALUES, 0), 0.0001);
    assertEquals(3, Consolidations.summarize("first", VALUES, 0), 0.0001);
    assertEquals(3, Consolidations.summarize("range", VALUES, 0), 0.0001);
    assertEquals(3, Consolidations.summarize("rangeOf", VALUES, 0), 0.0001);
    assertEquals(24, Consolidations.summarize("multiply", VALUES, 0), 0.0001);
    assertEquals(-4, Consolidations.summarize("diff", VALUES, 0), 0.0001);
    assertEquals(4, Consolidations.summarize("count", VALUES, 0), 0.0001);
    assertEquals(Math.sqrt(1.25), 
        Consolidations.summarize("stddev", VALUES, 0), 0.0001);
    assertEquals(3.7, Consolidations.summarize("p90", VALUES, 0), 0.0001);
  }
  
  @Test
  public void summarizeEmpty() throws Exception {
    assertTrue(Double.isNaN(
        Consolidations.summarize("sum", new double[0], 0)));
    assertTrue(Double.isNaN(
        Consolidations.summarize("sum", new double[] { NaN, NaN }, 0)));
    assertTrue(Double.isNaN(
        Consolidations.summarize("count", new double[] { NaN }, 0)));
    assertEquals(0, Consolidations.summarize("avg_zero", 
        new double[] { NaN, NaN }, 0), 0.0001);
  }
  
  @Test
  public void summarizeXFilesFactor() throws Exception {
    assertEquals(10, Consolidations.summarize("sum", VALUES, 0.8), 0.0001);
    assertTrue(Double.isNaN(Consolidations.summarize("sum", VALUES, 0.81)));
  }
  
  @Test
  public void validate() throws Exception {
    for (final String name : Consolidations.REDUCERS) {
      Consolidations.validate(name);
    }
    Consolidations.validate("p50");
    Consolidations.validate("p99.9");
    for (final String name : new String[] { null, "", "nope", "p", "p101", 
        "px", "SUM" }) {
      try {
        Consolidations.validate(name);
        fail("Expected InvalidArgumentException for " + name);
      } catch (InvalidArgumentException e) {
        assertEquals(Reason.INVALID_VALUE, e.getReason());
      }
    }
  }
  
  @Test
  public void percentile() throws Exception {
    assertEquals(3, Consolidations.percentile(
        new double[] { 1, 2, 3, 4, 5 }, 50, false), 0.0001);
    assertEquals(2.5, Consolidations.percentile(
        new double[] { 1, 2, 3, 4 }, 50, true), 0.0001);
    assertEquals(3, Consolidations.percentile(
        new double[] { 4, 3, 1, 2 }, 50, false), 0.0001);
    assertEquals(9.1, Consolidations.percentile(
        new double[] { 10, 9, 8, 7, 6, 5, 4, 3, 2, 1 }, 90, true), 0.0001);
    assertEquals(1, Consolidations.percentile(
        new double[] { 1, 2, 3 }, 0, true), 0.0001);
    assertEquals(3, Consolidations.percentile(
        new double[] { 1, 2, 3 }, 100, true), 0.0001);
  }
  
  @Test
  public void percentileSingle() throws Exception {
    assertEquals(42, Consolidations.percentile(
        new double[] { NaN, 42 }, 99, true), 0.0001);
  }
  
  @Test
  public void percentileEdges() throws Exception {
    assertTrue(Double.isNaN(Consolidations.percentile(
        new double[0], 50, true)));
    assertTrue(Double.isNaN(Consolidations.percentile(
        new double[] { NaN }, 50, true)));
    assertTrue(Double.isNaN(Consolidations.percentile(
        new double[] { 1, 2 }, -1, true)));
    assertTrue(Double.isNaN(Consolidations.percentile(
        new double[] { 1, 2 }, 100.5, true)));
  }
  
  @Test
  public void percentileDoesNotModifyInput() throws Exception {
    final double[] values = new double[] { 5, 1, 4, 2, 3 };
    Consolidations.percentile(values, 50, true);
    assertEquals(5, values[0], 0.0001);
    assertEquals(3, values[4], 0.0001);
  }
  
  @Test
  public void select() throws Exception {
    final double[] data = new double[] { 9, 1, 8, 2, 7, 3, 6, 4, 5 };
    Consolidations.select(data, 4);
    assertEquals(5, data[4], 0.0001);
    for (int i = 0; i < 4; i++) {
      assertTrue(data[i] <= 5);
    }
    for (int i = 5; i < data.length; i++) {
      assertTrue(data[i] >= 5);
    }
  }
  
  @Test
  public void parsePercentile() throws Exception {
    assertEquals(50, Consolidations.parsePercentile("p50"), 0.0001);
    assertEquals(99.9, Consolidations.parsePercentile("p99.9"), 0.0001);
    assertTrue(Double.isNaN(Consolidations.parsePercentile("50")));
    assertTrue(Double.isNaN(Consolidations.parsePercentile("p-1")));
  }
  
  @Test
  public void stddev() throws Exception {
    assertEquals(2, Consolidations.stddev(
        new double[] { 2, 4, 4, 4, 5, 5, 7, 9 }), 0.0001);
    assertTrue(Double.isNaN(Consolidations.stddev(new double[] { NaN })));
  }
}
