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
 * Replaces each series with a flat line at the n-th percentile of its own
 * values: {@code nPercentile(seriesList, n)}.
 * @since 1.0
 */
public class NPercentile implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final double percent = node.getFloatArg(1);
    if (percent < 0 || percent > 100) {
      throw new InvalidArgumentException(Reason.INVALID_VALUE, 
          "Percentile must be between 0 and 100: " + percent);
    }
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final double value = 
          Consolidations.percentile(input.toArray(), percent, false);
      final MetricData output = MetricData.newLike(input, 
          node.nameWith(input.name()));
      for (int i = 0; i < input.size(); i++) {
        output.setValue(i, value);
      }
      results.add(output);
    }
    return results;
  }
}
