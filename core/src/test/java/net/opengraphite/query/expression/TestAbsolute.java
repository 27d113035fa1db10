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

import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import net.opengraphite.data.MetricData;
import net.opengraphite.query.MetricRequest;

public class TestAbsolute {
  private static final long START_TIME = 1356998400L;
  private static final long INTERVAL = 10;
  private static final long END_TIME = START_TIME + 5 * INTERVAL;
  
  private Map<MetricRequest, List<MetricData>> fetched;
  
  @Before
  public void before() throws Exception {
    fetched = fetched();
    put(fetched, "sys.delta.*", START_TIME, END_TIME, 
        series("sys.delta.in", START_TIME, INTERVAL, -1, 2, NaN, -4.5, 0),
        series("sys.delta.out", START_TIME, INTERVAL, NaN, NaN, NaN, NaN, 
            NaN));
  }
  
  @Test
  public void evaluate() throws Exception {
    final List<MetricData> results = 
        eval("absolute(sys.delta.*)", START_TIME, END_TIME, fetched);
    assertEquals(2, results.size());
    assertEquals("absolute(sys.delta.in)", results.get(0).name());
    assertValues(results.get(0), 1, 2, NaN, 4.5, 0);
    assertEquals("absolute(sys.delta.out)", results.get(1).name());
    assertValues(results.get(1), NaN, NaN, NaN, NaN, NaN);
  }
  
  @Test
  public void evaluatePiped() throws Exception {
    final List<MetricData> results = 
        eval("sys.delta.in|absolute()", START_TIME, END_TIME, fetched());
    assertEquals(0, results.size());
    
    final Map<MetricRequest, List<MetricData>> data = fetched();
    put(data, "sys.delta.in", START_TIME, END_TIME, 
        series("sys.delta.in", START_TIME, INTERVAL, -3, 3, -3, 3, -3));
    final MetricData result = 
        eval("sys.delta.in|absolute()", START_TIME, END_TIME, data).get(0);
    assertEquals("absolute(sys.delta.in)", result.name());
    assertValues(result, 3, 3, 3, 3, 3);
  }
}
