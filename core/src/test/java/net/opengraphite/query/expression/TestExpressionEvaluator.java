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
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.Lists;
import com.stumbleupon.async.Deferred;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.exceptions.QueryExecutionException;
import net.opengraphite.exceptions.UnknownFunctionException;
import net.opengraphite.query.MetricFetcher;
import net.opengraphite.query.MetricRequest;

public class TestExpressionEvaluator {

  @Test
  public void sumOfTwoSeries() throws Exception {
    final Map<MetricRequest, List<MetricData>> fetched = fetched();
    put(fetched, "host.{a,b}.requests", 0, 180, 
        series("host.a.requests", 0, 60, 1, 2, NaN),
        series("host.b.requests", 0, 60, 3, NaN, NaN));
    
    final List<MetricData> results = 
        eval("sum(host.{a,b}.requests)", 0, 180, fetched);
    assertEquals(1, results.size());
    assertEquals("sum(host.{a,b}.requests)", results.get(0).name());
    assertValues(results.get(0), 4, 2, NaN);
  }
  
  @Test
  public void scaleConstantLine() throws Exception {
    final List<MetricData> results = 
        eval("scale(constantLine(5),2)", 0, 10, fetched());
    assertEquals(1, results.size());
    final MetricData result = results.get(0);
    assertEquals(0, result.start());
    assertEquals(10, result.step());
    assertValues(result, 10, 10);
  }
  
  @Test
  public void name() throws Exception {
    final Map<MetricRequest, List<MetricData>> fetched = fetched();
    final MetricData a = series("a.b", 0, 60, 1, 2);
    put(fetched, "a.b", 0, 120, a);
    final List<MetricData> results = eval("a.b", 0, 120, fetched);
    assertEquals(1, results.size());
    assertSame(a, results.get(0));
    
    // a copy of the list so functions can't modify the map
    assertNotSame(fetched.get(new MetricRequest("a.b", 0, 120)), results);
  }
  
  @Test
  public void nameNotFetched() throws Exception {
    assertTrue(eval("a.b", 0, 120, fetched()).isEmpty());
  }
  
  @Test
  public void constant() throws Exception {
    final List<MetricData> results = eval("42", 100, 200, fetched());
    assertEquals(1, results.size());
    assertEquals("42", results.get(0).name());
    assertEquals(100, results.get(0).start());
    assertEquals(200, results.get(0).timestamp(1));
    assertValues(results.get(0), 42, 42);
  }
  
  @Test
  public void constantEmptyRange() throws Exception {
    final List<MetricData> results = eval("1.5", 100, 100, fetched());
    assertEquals(1, results.get(0).step());
    assertValues(results.get(0), 1.5, 1.5);
  }
  
  @Test
  public void literalForSeries() throws Exception {
    try {
      eval("scale('a.b', 2)", 0, 60, fetched());
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.MISSING_TIMESERIES, e.getReason());
      assertEquals(400, e.getStatusCode());
    }
    
    try {
      eval("sumSeries(a.b, 3)", 0, 60, fetched());
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.MISSING_TIMESERIES, e.getReason());
    }
  }
  
  @Test
  public void topLevelString() throws Exception {
    try {
      eval("'a.b'", 0, 60, fetched());
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.MISSING_TIMESERIES, e.getReason());
    }
  }
  
  @Test
  public void noArguments() throws Exception {
    try {
      eval("sumSeries()", 0, 60, fetched());
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.MISSING_ARGUMENT, e.getReason());
    }
  }
  
  @Test
  public void unknownFunction() throws Exception {
    try {
      eval("noSuchFunction(a.b)", 0, 60, fetched());
      fail("Expected UnknownFunctionException");
    } catch (UnknownFunctionException e) {
      assertEquals("noSuchFunction", e.getFunction());
    }
  }
  
  @Test
  public void singleSeriesArg() throws Exception {
    final Map<MetricRequest, List<MetricData>> fetched = fetched();
    put(fetched, "a.*", 0, 120, 
        series("a.b", 0, 60, 1, 2), series("a.c", 0, 60, 1, 2));
    final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    try {
      evaluator.singleSeriesArg(Expr.name("a.*"), 0, 120, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.TOO_MANY_SERIES, e.getReason());
    }
    try {
      evaluator.singleSeriesArg(Expr.name("nope"), 0, 120, fetched);
      fail("Expected InvalidArgumentException");
    } catch (InvalidArgumentException e) {
      assertEquals(Reason.SERIES_DOES_NOT_EXIST, e.getReason());
    }
    assertEquals("a.b", evaluator.singleSeriesArg(Expr.name("a.b"), 0, 120, 
        singleton()).name());
  }
  
  @Test
  public void fetcherFallback() throws Exception {
    final MetricFetcher fetcher = mock(MetricFetcher.class);
    final MetricData shifted = series("a.b", -86400, 60, 1, 2);
    when(fetcher.fetch(any(MetricRequest.class)))
      .thenReturn(Deferred.<List<MetricData>>fromResult(
          Lists.newArrayList(shifted)));
    
    final ExpressionEvaluator evaluator = new ExpressionEvaluator(fetcher, 0);
    final Map<MetricRequest, List<MetricData>> fetched = fetched();
    final List<MetricData> results = evaluator.lookup(
        new MetricRequest("a.b", -86400, -86280), fetched);
    assertEquals(1, results.size());
    assertSame(shifted, results.get(0));
    
    // remembered
    evaluator.lookup(new MetricRequest("a.b", -86400, -86280), fetched);
    verify(fetcher, times(1)).fetch(any(MetricRequest.class));
  }
  
  @Test
  public void fetcherFallbackNull() throws Exception {
    final MetricFetcher fetcher = mock(MetricFetcher.class);
    when(fetcher.fetch(any(MetricRequest.class)))
      .thenReturn(Deferred.<List<MetricData>>fromResult(null));
    final ExpressionEvaluator evaluator = new ExpressionEvaluator(fetcher, 0);
    assertTrue(evaluator.lookup(new MetricRequest("a.b", 0, 60), fetched())
        .isEmpty());
  }
  
  @Test
  public void fetcherFallbackError() throws Exception {
    final MetricFetcher fetcher = mock(MetricFetcher.class);
    when(fetcher.fetch(any(MetricRequest.class)))
      .thenReturn(Deferred.<List<MetricData>>fromError(
          new IllegalStateException("Boo!")));
    final ExpressionEvaluator evaluator = new ExpressionEvaluator(fetcher, 0);
    try {
      evaluator.lookup(new MetricRequest("a.b", 0, 60), fetched());
      fail("Expected QueryExecutionException");
    } catch (QueryExecutionException e) {
      assertEquals(502, e.getStatusCode());
    }
  }
  
  @Test
  public void fetcherNotCalledWhenFetched() throws Exception {
    final MetricFetcher fetcher = mock(MetricFetcher.class);
    final ExpressionEvaluator evaluator = new ExpressionEvaluator(fetcher, 0);
    assertEquals(1, evaluator.lookup(new MetricRequest("a.b", 0, 120), 
        singleton()).size());
    verify(fetcher, times(0)).fetch(any(MetricRequest.class));
  }
  
  private static Map<MetricRequest, List<MetricData>> singleton() {
    final Map<MetricRequest, List<MetricData>> fetched = fetched();
    put(fetched, "a.b", 0, 120, series("a.b", 0, 60, 1, 2));
    return fetched;
  }
}
