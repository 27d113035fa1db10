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
 * Standard deviation over a trailing window of points that includes the 
 * current one: {@code stdev(seriesList, points, windowTolerance=0.1)}. The
 * tolerance is the ratio of absent points allowed in a window. Outputs are
 * absent until the window has filled, where the current sample is absent 
 * or where the window has too few present values.
 * @since 1.0
 */
public class Stdev implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final int points = node.getIntArg(1);
    if (points < 1) {
      throw new InvalidArgumentException(Reason.INVALID_VALUE, 
          "Points must be greater than zero: " + points);
    }
    final double tolerance = 
        node.getFloatNamedOrPosArgDefault("windowTolerance", 2, 0.1);
    final int min_valid = (int) ((1 - tolerance) * points);
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final MetricData output = MetricData.newLike(input, 
          node.nameWith(input.name()));
      final Windowed windowed = new Windowed(points);
      for (int i = 0; i < input.size(); i++) {
        windowed.push(input.value(i));
        if (input.isAbsent(i) || 
            windowed.filled() < points || 
            windowed.validCount() < min_valid) {
          output.setAbsent(i);
        } else {
          output.setValue(i, windowed.stdev());
        }
      }
      results.add(output);
    }
    return results;
  }
}
