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

import com.google.common.collect.Lists;

import net.opengraphite.data.MetricData;
import net.opengraphite.query.MetricRequest;

/**
 * Groups series by the nodes of their path at the given positions and 
 * aggregates each group with the callback, average by default.
 * <ul>
 * <li>{@code groupByNode(seriesList, nodeNum, callback='average')}</li>
 * <li>{@code groupByNodes(seriesList, callback, *nodes)}</li>
 * </ul>
 * @since 1.0
 */
public class GroupByNode implements Expression {

  /** Whether or not this is the multi node variant. */
  private final boolean multiple_nodes;
  
  /**
   * Default ctor.
   * @param multiple_nodes True for groupByNodes, false for groupByNode.
   */
  public GroupByNode(final boolean multiple_nodes) {
    this.multiple_nodes = multiple_nodes;
  }
  
  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final String callback;
    final List<Integer> nodes;
    if (multiple_nodes) {
      callback = node.getStringArg(1);
      nodes = node.getIntArgs(2);
    } else {
      nodes = Lists.newArrayList(node.getIntArg(1));
      callback = node.getStringNamedOrPosArgDefault("callback", 2, "average");
    }
    Consolidations.validate(callback);
    
    final Map<String, List<MetricData>> groups = 
        new LinkedHashMap<String, List<MetricData>>();
    for (final MetricData input : inputs) {
      final String key = AliasByNode.extractNodes(input.name(), nodes);
      List<MetricData> group = groups.get(key);
      if (group == null) {
        group = new ArrayList<MetricData>();
        groups.put(key, group);
      }
      group.add(input);
    }
    
    final List<MetricData> results = new ArrayList<MetricData>(groups.size());
    for (final Map.Entry<String, List<MetricData>> entry : groups.entrySet()) {
      results.add(AggregateSeries.aggregate(entry.getValue(), callback, 
          entry.getKey()));
    }
    return results;
  }
}
