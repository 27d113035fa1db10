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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.exceptions.QueryExecutionException;
import net.opengraphite.query.MetricFetcher;
import net.opengraphite.query.MetricRequest;

/**
 * Walks an expression tree and produces series. Names are resolved against
 * the map of fetched series, constants become flat two point series and 
 * function calls are dispatched through the {@link ExpressionFactory}.
 * <p>
 * A name that matches nothing yields an empty list, not an error. When a 
 * fetcher is supplied, requests missing from the fetched map, e.g. a 
 * lookback range that wasn't collected up front, are fetched on demand and
 * remembered for the life of this evaluator. Without a fetcher the 
 * evaluator is pure and may be shared across threads.
 * 
 * @since 1.0
 */
public class ExpressionEvaluator {
  private static final Logger LOG = 
      LoggerFactory.getLogger(ExpressionEvaluator.class);
  
  /** An optional fetcher for requests missing from the map. */
  private final MetricFetcher fetcher;
  
  /** How long to wait on the fetcher in milliseconds. */
  private final long fetch_timeout;
  
  /** Results of on demand fetches. */
  private final Map<MetricRequest, List<MetricData>> extra_fetches;
  
  /** Ctor for an evaluator that only reads the fetched map. */
  public ExpressionEvaluator() {
    this(null, 0);
  }
  
  /**
   * Ctor with a fetcher for requests missing from the fetched map.
   * @param fetcher An optional fetcher, may be null.
   * @param fetch_timeout How long to wait on the fetcher in ms, zero or less
   * to wait forever.
   */
  public ExpressionEvaluator(final MetricFetcher fetcher, 
                             final long fetch_timeout) {
    this.fetcher = fetcher;
    this.fetch_timeout = fetch_timeout;
    extra_fetches = new ConcurrentHashMap<MetricRequest, List<MetricData>>();
  }
  
  /**
   * Evaluates the node over the range.
   * @param node A non-null node.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @param fetched The non-null map of fetched series.
   * @return A non-null, possibly empty, list of series.
   * @throws InvalidArgumentException if a function was called without 
   * arguments or with bad arguments.
   * @throws net.opengraphite.exceptions.UnknownFunctionException if the 
   * function isn't registered.
   */
  public List<MetricData> evaluate(final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    switch (node.type()) {
    case NAME:
      return lookup(new MetricRequest(node.target(), from, until), fetched);
    case CONST:
      return Lists.newArrayList(constantSeries(node, from, until));
    case FUNC:
      if (node.args().isEmpty() && node.namedArgs().isEmpty()) {
        throw new InvalidArgumentException(Reason.MISSING_ARGUMENT, 
            "Function " + node.target() + " was called without arguments");
      }
      final Expression function = ExpressionFactory.getByName(node.target());
      return function.evaluate(this, node, from, until, fetched);
    default:
      throw new InvalidArgumentException(Reason.MISSING_TIMESERIES, 
          "Expected a series or function but got: " + node);
    }
  }
  
  /**
   * Evaluates an argument that must produce series, i.e. a name or a 
   * function call.
   * @param arg A non-null argument node.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @param fetched The non-null map of fetched series.
   * @return A non-null, possibly empty, list of series.
   * @throws InvalidArgumentException if the argument was a literal.
   */
  public List<MetricData> seriesArg(final Expr arg, 
                                    final long from, 
                                    final long until, 
                                    final Map<MetricRequest, List<MetricData>> fetched) {
    if (!arg.isName() && !arg.isFunc()) {
      throw new InvalidArgumentException(Reason.MISSING_TIMESERIES, 
          "Expected a series but got: " + arg);
    }
    return evaluate(arg, from, until, fetched);
  }
  
  /**
   * Evaluates every positional argument starting at the index, left to 
   * right, and concatenates the series.
   * @param node A non-null function node.
   * @param start The index of the first series argument.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @param fetched The non-null map of fetched series.
   * @return A non-null, possibly empty, list of series.
   * @throws InvalidArgumentException if an argument was a literal.
   */
  public List<MetricData> seriesArgs(final Expr node, 
                                     final int start, 
                                     final long from, 
                                     final long until, 
                                     final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> series = Lists.newArrayList();
    for (int i = start; i < node.argsLen(); i++) {
      series.addAll(seriesArg(node.arg(i), from, until, fetched));
    }
    return series;
  }
  
  /**
   * Evaluates an argument that must resolve to exactly one series.
   * @param arg A non-null argument node.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @param fetched The non-null map of fetched series.
   * @return The series.
   * @throws InvalidArgumentException if the argument resolved to zero or
   * more than one series.
   */
  public MetricData singleSeriesArg(final Expr arg, 
                                    final long from, 
                                    final long until, 
                                    final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> series = seriesArg(arg, from, until, fetched);
    if (series.isEmpty()) {
      throw new InvalidArgumentException(Reason.SERIES_DOES_NOT_EXIST, 
          "No series found for: " + arg);
    }
    if (series.size() > 1) {
      throw new InvalidArgumentException(Reason.TOO_MANY_SERIES, 
          "Expected a single series for " + arg + " but found " 
              + series.size());
    }
    return series.get(0);
  }
  
  /**
   * Resolves a request from the fetched map, falling back to the fetcher.
   * @param request The non-null request.
   * @param fetched The non-null map of fetched series.
   * @return A non-null mutable copy of the series list.
   */
  List<MetricData> lookup(final MetricRequest request, 
                          final Map<MetricRequest, List<MetricData>> fetched) {
    List<MetricData> series = fetched.get(request);
    if (series == null) {
      series = extra_fetches.get(request);
    }
    if (series == null && fetcher != null) {
      series = fetch(request);
    }
    if (series == null) {
      return Lists.newArrayList();
    }
    return Lists.newArrayList(series);
  }
  
  private List<MetricData> fetch(final MetricRequest request) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetching request missing from the map: " + request);
    }
    List<MetricData> series;
    try {
      series = fetch_timeout > 0 ? 
          fetcher.fetch(request).join(fetch_timeout) : 
            fetcher.fetch(request).join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryExecutionException("Interrupted while fetching " 
          + request.pattern(), 500, e);
    } catch (QueryExecutionException e) {
      throw e;
    } catch (Exception e) {
      throw new QueryExecutionException("Failed to fetch " 
          + request.pattern(), 502, e);
    }
    if (series == null) {
      series = Collections.emptyList();
    }
    extra_fetches.put(request, series);
    return series;
  }
  
  /**
   * @return A flat series with the constant at the start and end of the 
   * range.
   */
  private static MetricData constantSeries(final Expr node, 
                                           final long from, 
                                           final long until) {
    final long step = until > from ? until - from : 1;
    return MetricData.newBuilder()
        .setName(node.valueString())
        .setStart(from)
        .setStep(step)
        .setStop(from + step)
        .setValues(new double[] { node.value(), node.value() })
        .build();
  }
}
