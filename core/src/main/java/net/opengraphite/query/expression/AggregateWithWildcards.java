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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Sets;

import net.opengraphite.data.MetricData;
import net.opengraphite.query.MetricRequest;

/**
 * Groups series by their path with the nodes at the given positions removed
 * and aggregates each group, e.g. {@code sumSeriesWithWildcards(dc.*.cpu,1)}
 * sums every host into {@code dc.cpu}. Groups keep the order in which their
 * first series was seen and are named by their key.
 * @since 1.0
 */
public class AggregateWithWildcards implements Expression {
  
  /** The reducer or null to read it from the second argument. */
  private final String reducer;
  
  /** Ctor for {@code aggregateWithWildcards(seriesList, func, *nodes)}. */
  public AggregateWithWildcards() {
    this(null);
  }
  
  /**
   * Ctor with a fixed reducer.
   * @param reducer A reducer name from {@link Consolidations}.
   */
  public AggregateWithWildcards(final String reducer) {
    this.reducer = reducer;
  }

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final String func;
    final List<Integer> positions;
    if (reducer == null) {
      func = node.getStringArg(1);
      positions = node.getIntArgs(2);
    } else {
      func = reducer;
      positions = node.getIntArgs(1);
    }
    Consolidations.validate(func);
    
    final Set<Integer> removed = Sets.newHashSet(positions);
    final Map<String, List<MetricData>> groups = 
        new LinkedHashMap<String, List<MetricData>>();
    for (final MetricData input : inputs) {
      final String key = groupKey(input.name(), removed);
      List<MetricData> group = groups.get(key);
      if (group == null) {
        group = new ArrayList<MetricData>();
        groups.put(key, group);
      }
      group.add(input);
    }
    
    final List<MetricData> results = new ArrayList<MetricData>(groups.size());
    for (final Map.Entry<String, List<MetricData>> entry : groups.entrySet()) {
      results.add(AggregateSeries.aggregate(entry.getValue(), func, 
          entry.getKey()));
    }
    return results;
  }
  
  /**
   * @param name A series name.
   * @param removed Node positions to drop.
   * @return The name with the nodes at the positions removed.
   */
  static String groupKey(final String name, final Set<Integer> removed) {
    final String[] parts = name.split("\\.");
    final StringBuilder buf = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (removed.contains(i)) {
        continue;
      }
      if (buf.length() > 0) {
        buf.append(".");
      }
      buf.append(parts[i]);
    }
    return buf.toString();
  }
}
