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
import java.util.List;
import java.util.Map;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;

/**
 * Renames each series to the dot separated nodes of its path at the given
 * positions. Negative positions count from the end.
 * @since 1.0
 */
public class AliasByNode implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final List<Integer> nodes = node.getIntArgs(1);
    if (nodes.isEmpty()) {
      throw new InvalidArgumentException(Reason.MISSING_ARGUMENT, 
          "At least one node is required for " + node.target());
    }
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      results.add(input.withName(extractNodes(input.name(), nodes)));
    }
    return results;
  }
  
  /**
   * Joins the nodes of the metric path at the given positions. Function 
   * wrappers are stripped first so "scale(a.b.c,2)" yields nodes of 
   * "a.b.c". Out of range positions are skipped.
   * @param name The non-null series name.
   * @param nodes The positions.
   * @return The joined nodes.
   */
  static String extractNodes(final String name, final List<Integer> nodes) {
    final String[] parts = metricPath(name).split("\\.");
    final StringBuilder buf = new StringBuilder();
    for (final int position : nodes) {
      final int idx = position < 0 ? parts.length + position : position;
      if (idx < 0 || idx >= parts.length) {
        continue;
      }
      if (buf.length() > 0) {
        buf.append(".");
      }
      buf.append(parts[idx]);
    }
    return buf.toString();
  }
  
  /**
   * @param name A series name, possibly wrapped in function calls.
   * @return The innermost metric path.
   */
  static String metricPath(final String name) {
    String path = name;
    final int open = path.lastIndexOf('(');
    if (open >= 0) {
      path = path.substring(open + 1);
    }
    int end = path.length();
    for (int i = 0; i < path.length(); i++) {
      final char c = path.charAt(i);
      if (c == ',' || c == ')') {
        end = i;
        break;
      }
    }
    return path.substring(0, end);
  }
}
