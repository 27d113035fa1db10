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

import java.util.List;
import java.util.Map;

import com.google.common.collect.Lists;

import net.opengraphite.data.ConsolidationFunction;
import net.opengraphite.data.MetricData;
import net.opengraphite.query.MetricRequest;

/**
 * A flat line at the given value across the requested range, with one 
 * sample at the start and one at the end.
 * @since 1.0
 */
public class ConstantLine implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final double value = node.getFloatArg(0);
    final long step = until > from ? until - from : 1;
    return Lists.newArrayList(MetricData.newBuilder()
        .setName(node.arg(0).valueString())
        .setStart(from)
        .setStop(from + step)
        .setStep(step)
        .setValues(new double[] { value, value })
        .setConsolidation(ConsolidationFunction.MAX)
        .build());
  }
}
