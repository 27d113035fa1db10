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
import java.util.function.DoubleUnaryOperator;

import net.opengraphite.data.MetricData;
import net.opengraphite.query.MetricRequest;

/**
 * Base for functions that map each present value of each series in the 
 * first argument independently. Absent samples stay absent and a NaN result
 * marks the output sample absent.
 * 
 * @since 1.0
 */
public abstract class PerSeriesExpression implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final DoubleUnaryOperator operator = operator(node);
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final MetricData output = MetricData.newLike(input, 
          node.nameWith(input.name()));
      for (int i = 0; i < input.size(); i++) {
        if (input.isAbsent(i)) {
          output.setAbsent(i);
        } else {
          output.setValue(i, operator.applyAsDouble(input.value(i)));
        }
      }
      results.add(output);
    }
    return results;
  }
  
  /**
   * Parses the literal arguments and returns the operation to apply.
   * @param node The non-null function call node.
   * @return The non-null operation.
   */
  protected abstract DoubleUnaryOperator operator(final Expr node);
}
