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

import net.opengraphite.data.ConsolidationFunction;
import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;

public class TestPercentileOfSeries {
  private Map<MetricRequest, List<MetricData>> fetched;
  
  @Before
  public void before() throws Exception {
    fetched = fetched();
    put(fetched, "lat.*", 0, 120, 
        series("lat.a", 0, 60, 1, NaN),
        series("lat.b", 0, 60, 2, NaN),
        series("lat.c", 0, 60, 3, NaN),
        series("lat.d", 0, 60, 4, 5));
    put(fetched, "lat.a", 0, 300, 
        series("lat.a", 0, 60, 4, 1, 3, NaN, 2));
  }
  
  @Test
  public void percentileOfSeries() throws Exception {
    final List<MetricData> results = 
        eval("percentileOfSeries(lat.*, 50)", 0, 120, fetched);
    assertEquals(1, results.size());
    assertEquals("percentileOfSeries(lat.*,50)", results.get(0).name());
    assertValues(results.get(0), 3, 5);
  }
  
  @Test
  public void percentileOfSeriesInterpolated() throws Exception {
    assertValues(eval("percentileOfSeries(lat.*, 50, true)", 0, 120, 
        fetched).get(0), 2.5, 5);
    assertValues(eval("percentileOfSeries(lat.*, 50, interpolate=true)", 
        0, 120, fetched).get(0), 2.5, 5);
  }
  
  @Test
  public void percentileOfSeriesOutOfRange() throws Exception {
    try {
      eval("percentileOfSeries(lat.*, 101)", 0, 120, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.INVALID_VALUE, e.getReason());
    }
  }
  
  @Test
  public void percentileOfSeriesNoSeries() throws Exception {
    assertTrue(eval("percentileOfSeries(nope.*, 50)", 0, 120, fetched)
        .isEmpty());
  }
  
  @Test
  public void nPercentile() throws Exception {
    final List<MetricData> results = 
        eval("nPercentile(lat.a, 50)", 0, 300, fetched);
    assertEquals("nPercentile(lat.a,50)", results.get(0).name());
    assertValues(results.get(0), 3, 3, 3, 3, 3);
  }
  
  @Test
  public void nPercentileOutOfRange() throws Exception {
    try {
      eval("nPercentile(lat.a, -1)", 0, 300, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.INVALID_VALUE, e.getReason());
    }
  }
  
  @Test
  public void consolidateBy() throws Exception {
    final MetricData result = 
        eval("consolidateBy(lat.a, 'max')", 0, 300, fetched).get(0);
    assertEquals("consolidateBy(lat.a,'max')", result.name());
    assertEquals(ConsolidationFunction.MAX, result.consolidation());
    assertValues(result, 4, 1, 3, NaN, 2);
  }
  
  @Test
  public void consolidateByUnknown() throws Exception {
    try {
      eval("consolidateBy(lat.a, 'median')", 0, 300, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.INVALID_VALUE, e.getReason());
    }
  }
}
