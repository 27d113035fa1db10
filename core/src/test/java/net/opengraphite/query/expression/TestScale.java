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
import static net.opengraphite.query.expression.SeriesForTest.assertValues;
import static net.opengraphite.query.expression.SeriesForTest.eval;
import static net.opengraphite.query.expression.SeriesForTest.fetched;
import static net.opengraphite.query.expression.SeriesForTest.put;
import static net.opengraphite.query.expression.SeriesForTest.series;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;

public class TestScale {
  private static final long START_TIME = 1356998400L;
  private static final long INTERVAL = 60;
  private static final long END_TIME = START_TIME + 4 * INTERVAL;
  
  private Map<MetricRequest, List<MetricData>> fetched;
  
  @Before
  public void before() throws Exception {
    fetched = fetched();
    put(fetched, "sys.cpu.*", START_TIME, END_TIME, 
        series("sys.cpu.user", START_TIME, INTERVAL, 1, 2, NaN, 4),
        series("sys.cpu.nice", START_TIME, INTERVAL, -1.5, 0, 1.5, NaN));
  }
  
  @Test
  public void evaluateFactor1() throws Exception {
    final List<MetricData> results = 
        eval("scale(sys.cpu.*, 1)", START_TIME, END_TIME, fetched);
    assertEquals(2, results.size());
    assertEquals("scale(sys.cpu.user,1)", results.get(0).name());
    assertValues(results.get(0), 1, 2, NaN, 4);
    assertEquals("scale(sys.cpu.nice,1)", results.get(1).name());
    assertValues(results.get(1), -1.5, 0, 1.5, NaN);
  }
  
  @Test
  public void evaluateFactor1point5() throws Exception {
    final List<MetricData> results = 
        eval("scale(sys.cpu.*, 1.5)", START_TIME, END_TIME, fetched);
    assertEquals("scale(sys.cpu.user,1.5)", results.get(0).name());
    assertValues(results.get(0), 1.5, 3, NaN, 6);
    assertValues(results.get(1), -2.25, 0, 2.25, NaN);
  }
  
  @Test
  public void evaluateFactorNegative() throws Exception {
    final List<MetricData> results = 
        eval("scale(sys.cpu.*, -2)", START_TIME, END_TIME, fetched);
    assertValues(results.get(0), -2, -4, NaN, -8);
  }
  
  @Test
  public void evaluateFactorZero() throws Exception {
    final List<MetricData> results = 
        eval("scale(sys.cpu.*, 0)", START_TIME, END_TIME, fetched);
    assertValues(results.get(0), 0, 0, NaN, 0);
  }
  
  @Test
  public void evaluateKeepsGrid() throws Exception {
    final MetricData result = eval("scale(sys.cpu.user, 2)", 
        START_TIME, END_TIME, singleUser()).get(0);
    assertEquals(START_TIME, result.start());
    assertEquals(INTERVAL, result.step());
    assertEquals(4, result.size());
  }
  
  @Test
  public void evaluateNested() throws Exception {
    final List<MetricData> results = eval("scale(scale(sys.cpu.user, 2), 3)", 
        START_TIME, END_TIME, singleUser());
    assertEquals("scale(scale(sys.cpu.user,2),3)", results.get(0).name());
    assertValues(results.get(0), 6, 12, NaN, 24);
  }
  
  @Test
  public void evaluateNoSeries() throws Exception {
    assertTrue(eval("scale(nope.*, 2)", START_TIME, END_TIME, fetched)
        .isEmpty());
  }
  
  @Test
  public void evaluateMissingFactor() throws Exception {
    try {
      eval("scale(sys.cpu.*)", START_TIME, END_TIME, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.MISSING_ARGUMENT, e.getReason());
    }
  }
  
  @Test
  public void evaluateFactorNotANumber() throws Exception {
    try {
      eval("scale(sys.cpu.*, 'two')", START_TIME, END_TIME, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.BAD_TYPE, e.getReason());
    }
  }
  
  @Test
  public void evaluateDoesNotModifyInput() throws Exception {
    eval("scale(sys.cpu.*, 10)", START_TIME, END_TIME, fetched);
    assertValues(fetched.get(new MetricRequest("sys.cpu.*", START_TIME, 
        END_TIME)).get(0), 1, 2, NaN, 4);
  }
  
  @Test
  public void offsetPowInvertSquareRoot() throws Exception {
    final Map<MetricRequest, List<MetricData>> data = fetched();
    put(data, "a.b", START_TIME, END_TIME, 
        series("a.b", START_TIME, INTERVAL, 4, 0, NaN, 16));
    assertValues(eval("offset(a.b, -1)", START_TIME, END_TIME, data).get(0), 
        3, -1, NaN, 15);
    assertValues(eval("pow(a.b, 2)", START_TIME, END_TIME, data).get(0), 
        16, 0, NaN, 256);
    assertValues(eval("invert(a.b)", START_TIME, END_TIME, data).get(0), 
        0.25, NaN, NaN, 0.0625);
    assertValues(eval("squareRoot(a.b)", START_TIME, END_TIME, data).get(0), 
        2, 0, NaN, 4);
    assertValues(eval("squareRoot(offset(a.b, -1))", START_TIME, END_TIME, 
        data).get(0), Math.sqrt(3), NaN, NaN, Math.sqrt(15));
  }
  
  @Test
  public void logarithm() throws Exception {
    final Map<MetricRequest, List<MetricData>> data = fetched();
    put(data, "a.b", START_TIME, END_TIME, 
        series("a.b", START_TIME, INTERVAL, 100, 0, -5, 8));
    assertValues(eval("log(a.b)", START_TIME, END_TIME, data).get(0), 
        2, NaN, NaN, Math.log10(8));
    assertValues(eval("logarithm(a.b, 2)", START_TIME, END_TIME, data).get(0), 
        Math.log(100) / Math.log(2), NaN, NaN, 3);
    try {
      eval("log(a.b, 1)", START_TIME, END_TIME, data);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.INVALID_VALUE, e.getReason());
    }
  }
  
  private static Map<MetricRequest, List<MetricData>> singleUser() {
    final Map<MetricRequest, List<MetricData>> data = fetched();
    put(data, "sys.cpu.user", START_TIME, END_TIME, 
        series("sys.cpu.user", START_TIME, INTERVAL, 1, 2, NaN, 4));
    return data;
  }
}
