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

import com.google.common.collect.Sets;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;

public class TestGroupByNode {
  private Map<MetricRequest, List<MetricData>> fetched;
  
  @Before
  public void before() throws Exception {
    fetched = fetched();
    put(fetched, "dc.*.*.cpu", 0, 120, 
        series("dc.east.web01.cpu", 0, 60, 1, 2),
        series("dc.west.web01.cpu", 0, 60, 3, NaN),
        series("dc.east.web02.cpu", 0, 60, 5, 6));
  }
  
  @Test
  public void groupByNode() throws Exception {
    final List<MetricData> results = 
        eval("groupByNode(dc.*.*.cpu, 1, 'sum')", 0, 120, fetched);
    assertEquals(2, results.size());
    assertEquals("east", results.get(0).name());
    assertValues(results.get(0), 6, 8);
    assertEquals("west", results.get(1).name());
    assertValues(results.get(1), 3, NaN);
  }
  
  @Test
  public void groupByNodeDefaultAverage() throws Exception {
    final List<MetricData> results = 
        eval("groupByNode(dc.*.*.cpu, 2)", 0, 120, fetched);
    assertEquals("web01", results.get(0).name());
    assertValues(results.get(0), 2, 2);
    assertEquals("web02", results.get(1).name());
    assertValues(results.get(1), 5, 6);
  }
  
  @Test
  public void groupByNodes() throws Exception {
    final List<MetricData> results = 
        eval("groupByNodes(dc.*.*.cpu, 'max', 2, -1)", 0, 120, fetched);
    assertEquals(2, results.size());
    assertEquals("web01.cpu", results.get(0).name());
    assertValues(results.get(0), 3, 2);
    assertEquals("web02.cpu", results.get(1).name());
  }
  
  @Test
  public void groupByNodeBadCallback() throws Exception {
    try {
      eval("groupByNode(dc.*.*.cpu, 1, 'bogus')", 0, 120, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.INVALID_VALUE, e.getReason());
    }
  }
  
  @Test
  public void groupByNodeNoSeries() throws Exception {
    assertTrue(eval("groupByNode(nope.*, 1)", 0, 120, fetched).isEmpty());
  }
  
  @Test
  public void sumSeriesWithWildcards() throws Exception {
    final List<MetricData> results = 
        eval("sumSeriesWithWildcards(dc.*.*.cpu, 1)", 0, 120, fetched);
    assertEquals(2, results.size());
    assertEquals("dc.web01.cpu", results.get(0).name());
    assertValues(results.get(0), 4, 2);
    assertEquals("dc.web02.cpu", results.get(1).name());
    assertValues(results.get(1), 5, 6);
  }
  
  @Test
  public void groupingByAllNodes() throws Exception {
    put(fetched, "a.b.c", 0, 120, series("a.b.c", 0, 60, 1, 2));
    List<MetricData> results = 
        eval("groupByNode(a.b.c, 7, 'sum')", 0, 120, fetched);
    assertEquals(1, results.size());
    assertEquals("", results.get(0).name());
    assertValues(results.get(0), 1, 2);
    
    results = eval("sumSeriesWithWildcards(a.b.c, 0, 1, 2)", 0, 120, fetched);
    assertEquals(1, results.size());
    assertEquals("", results.get(0).name());
    assertValues(results.get(0), 1, 2);
  }
  
  @Test
  public void averageAndMultiplyWithWildcards() throws Exception {
    List<MetricData> results = 
        eval("averageSeriesWithWildcards(dc.*.*.cpu, 1, 2)", 0, 120, fetched);
    assertEquals(1, results.size());
    assertEquals("dc.cpu", results.get(0).name());
    assertValues(results.get(0), 3, 4);
    
    results = 
        eval("multiplySeriesWithWildcards(dc.*.*.cpu, 2)", 0, 120, fetched);
    assertEquals("dc.east.cpu", results.get(0).name());
    assertValues(results.get(0), 5, 12);
  }
  
  @Test
  public void aggregateWithWildcards() throws Exception {
    final List<MetricData> results = eval(
        "aggregateWithWildcards(dc.*.*.cpu, 'min', 1)", 0, 120, fetched);
    assertEquals("dc.web01.cpu", results.get(0).name());
    assertValues(results.get(0), 1, 2);
  }
  
  @Test
  public void groupKey() throws Exception {
    assertEquals("a.c", AggregateWithWildcards.groupKey("a.b.c", 
        Sets.newHashSet(1)));
    assertEquals("a.b.c", AggregateWithWildcards.groupKey("a.b.c", 
        Sets.<Integer>newHashSet()));
    assertEquals("a.b.c", AggregateWithWildcards.groupKey("a.b.c", 
        Sets.newHashSet(7)));
  }
}
