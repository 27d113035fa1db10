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
package net.opengraphite.data;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import net.opengraphite.exceptions.IllegalDataException;
import net.opengraphite.exceptions.SeriesMismatchException;

public class TestMetricData {
  private static final double NaN = Double.NaN;
  
  @Test
  public void builder() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("sys.cpu.user")
        .setStart(60)
        .setStep(60)
        .setValues(new double[] { 1, NaN, 3 })
        .build();
    assertEquals("sys.cpu.user", series.name());
    assertEquals(60, series.start());
    assertEquals(240, series.stop());
    assertEquals(60, series.step());
    assertEquals(3, series.size());
    assertEquals(ConsolidationFunction.AVERAGE, series.consolidation());
    assertEquals(1, series.valuesPerPoint());
    assertEquals("sys.cpu.user", series.pathExpression());
    assertEquals("sys.cpu.user", series.tags().get("name"));
    assertFalse(series.isAbsent(0));
    assertTrue(series.isAbsent(1));
    assertFalse(series.isAbsent(2));
    assertEquals(3, series.value(2), 0.0001);
    assertTrue(Double.isNaN(series.value(1)));
  }
  
  @Test
  public void emptyName() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1 })
        .build();
    assertEquals("", series.name());
    assertEquals("", series.tags().get("name"));
    assertEquals("", MetricData.newLike(series).name());
  }
  
  @Test
  public void timestamps() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(100)
        .setStep(10)
        .setValues(new double[] { 1, 2, 3, 4 })
        .build();
    for (int i = 0; i < series.size(); i++) {
      assertEquals(100 + i * 10, series.timestamp(i));
    }
  }
  
  @Test
  public void explicitAbsent() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(1)
        .setValues(new double[] { 1, 2 })
        .setAbsent(new boolean[] { false, true })
        .build();
    assertFalse(series.isAbsent(0));
    assertTrue(series.isAbsent(1));
    assertTrue(Double.isNaN(series.toArray()[1]));
  }
  
  @Test
  public void buildErrors() throws Exception {
    try {
      MetricData.newBuilder()
          .setStart(0)
          .setStep(1)
          .setValues(new double[] { 1 })
          .build();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
    
    try {
      MetricData.newBuilder()
          .setName("a")
          .setStart(0)
          .setStep(0)
          .setValues(new double[] { 1 })
          .build();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
    
    try {
      MetricData.newBuilder()
          .setName("a")
          .setStart(0)
          .setStep(1)
          .build();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
    
    try {
      MetricData.newBuilder()
          .setName("a")
          .setStart(0)
          .setStep(1)
          .setValues(new double[] { 1, 2 })
          .setAbsent(new boolean[] { false })
          .build();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
    
    try {
      MetricData.newBuilder()
          .setName("a")
          .setStart(0)
          .setStop(5L)
          .setStep(10)
          .setValues(new double[] { 1, 2 })
          .build();
      fail("Expected IllegalDataException");
    } catch (IllegalDataException e) { }
  }
  
  @Test
  public void setValueAndAbsent() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(1)
        .setValues(new double[] { NaN, 2 })
        .build();
    series.setValue(0, 42);
    assertFalse(series.isAbsent(0));
    assertEquals(42, series.value(0), 0.0001);
    
    series.setAbsent(1);
    assertTrue(series.isAbsent(1));
    
    series.setValue(0, NaN);
    assertTrue(series.isAbsent(0));
    assertTrue(series.isEmpty());
  }
  
  @Test
  public void isEmpty() throws Exception {
    assertTrue(MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(1)
        .setValues(new double[0])
        .build()
        .isEmpty());
    assertFalse(MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(1)
        .setValues(new double[] { NaN, 0 })
        .build()
        .isEmpty());
  }
  
  @Test
  public void consolidated() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1, 3, NaN, NaN, 5 })
        .setValuesPerPoint(2)
        .setConsolidation(ConsolidationFunction.SUM)
        .build();
    final MetricData folded = series.consolidated();
    assertEquals(20, folded.step());
    assertEquals(3, folded.size());
    assertEquals(1, folded.valuesPerPoint());
    assertEquals(4, folded.value(0), 0.0001);
    assertTrue(folded.isAbsent(1));
    assertEquals(5, folded.value(2), 0.0001);
    assertEquals(60, folded.stop());
  }
  
  @Test
  public void consolidatedXFilesFactor() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1, NaN, NaN, 4, 2, 6 })
        .setValuesPerPoint(3)
        .setXFilesFactor(0.5f)
        .build();
    final MetricData folded = series.consolidated();
    assertEquals(2, folded.size());
    assertTrue(folded.isAbsent(0));
    assertEquals(4, folded.value(1), 0.0001);
  }
  
  @Test
  public void consolidatedNoop() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1 })
        .build();
    assertSame(series, series.consolidated());
  }
  
  @Test
  public void withName() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1, NaN })
        .addTag("host", "web01")
        .setColor("red")
        .build();
    final MetricData renamed = series.withName("b");
    assertEquals("b", renamed.name());
    assertEquals("b", renamed.tags().get("name"));
    assertEquals("web01", renamed.tags().get("host"));
    assertEquals("red", renamed.color());
    assertTrue(renamed.isAbsent(1));
    
    // copies the arrays
    renamed.setValue(0, 42);
    assertEquals(1, series.value(0), 0.0001);
    assertEquals("a", series.name());
  }
  
  @Test
  public void newLike() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(30)
        .setStep(10)
        .setValues(new double[] { 1, NaN, 3 })
        .setConsolidation(ConsolidationFunction.MAX)
        .build();
    final MetricData like = MetricData.newLike(series, "scale(a,2)");
    assertNotSame(series, like);
    assertEquals("scale(a,2)", like.name());
    assertEquals(30, like.start());
    assertEquals(series.stop(), like.stop());
    assertEquals(3, like.size());
    assertEquals(ConsolidationFunction.MAX, like.consolidation());
    assertArrayEquals(new double[] { 0, 0, 0 }, like.toArray(), 0.0001);
    assertEquals("a", MetricData.newLike(series).name());
  }
  
  @Test
  public void tagsUnmodifiable() throws Exception {
    final MetricData series = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1 })
        .build();
    try {
      series.tags().put("foo", "bar");
      fail("Expected UnsupportedOperationException");
    } catch (UnsupportedOperationException e) { }
  }
  
  @Test
  public void forEachAligned() throws Exception {
    final MetricData a = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1, NaN, 3 })
        .build();
    final MetricData b = MetricData.newBuilder()
        .setName("b")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 4, 5, NaN })
        .build();
    final double[] sums = new double[3];
    MetricData.forEachAligned(a, b, new MetricData.AlignedConsumer() {
      @Override
      public void accept(final int index, 
                         final double a_value, 
                         final boolean a_absent, 
                         final double b_value, 
                         final boolean b_absent) {
        sums[index] = a_absent || b_absent ? -1 : a_value + b_value;
      }
    });
    assertArrayEquals(new double[] { 5, -1, -1 }, sums, 0.0001);
  }
  
  @Test
  public void forEachAlignedMismatch() throws Exception {
    final MetricData a = MetricData.newBuilder()
        .setName("a")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1, 2 })
        .build();
    final MetricData b = MetricData.newBuilder()
        .setName("b")
        .setStart(0)
        .setStep(20)
        .setValues(new double[] { 1, 2 })
        .build();
    final MetricData c = MetricData.newBuilder()
        .setName("c")
        .setStart(0)
        .setStep(10)
        .setValues(new double[] { 1 })
        .build();
    final MetricData.AlignedConsumer noop = new MetricData.AlignedConsumer() {
      @Override
      public void accept(final int index, 
                         final double a_value, 
                         final boolean a_absent, 
                         final double b_value, 
                         final boolean b_absent) {
        fail("Should not be called");
      }
    };
    try {
      MetricData.forEachAligned(a, b, noop);
      fail("Expected SeriesMismatchException");
    } catch (SeriesMismatchException e) { }
    try {
      MetricData.forEachAligned(a, c, noop);
      fail("Expected SeriesMismatchException");
    } catch (SeriesMismatchException e) { }
  }
}
