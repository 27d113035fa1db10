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
import net.opengraphite.query.MetricRequest;

/**
 * Drops series without any present values, or whose ratio of present 
 * values is under the optional xFilesFactor: 
 * {@code removeEmptySeries(seriesList, xFilesFactor=0)}.
 * @since 1.0
 */
public class RemoveEmptySeries implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final double x_files_factor = 
        node.getFloatNamedOrPosArgDefault("xFilesFactor", 1, 0);
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      int present = 0;
      for (int i = 0; i < input.size(); i++) {
        if (!input.isAbsent(i)) {
          present++;
        }
      }
      if (present > 0 && 
          (double) present / input.size() >= x_files_factor) {
        results.add(input);
      }
    }
    return results;
  }
}
