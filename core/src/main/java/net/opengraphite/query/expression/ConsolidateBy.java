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

import net.opengraphite.data.ConsolidationFunction;
import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;

/**
 * Sets the function used to fold points when a series is consolidated for
 * display: {@code consolidateBy(seriesList, 'max')}. Values are untouched.
 * @since 1.0
 */
public class ConsolidateBy implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final String name = node.getStringArg(1);
    final ConsolidationFunction function;
    try {
      function = ConsolidationFunction.fromString(name);
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException(Reason.INVALID_VALUE, 
          e.getMessage(), e);
    }
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final MetricData renamed = input.withName(node.nameWith(input.name()));
      results.add(renamed.toBuilder()
          .setConsolidation(function)
          .build());
    }
    return results;
  }
}
