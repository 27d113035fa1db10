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
 * Fills gaps of absent samples with the last present value. Gaps longer 
 * than the limit, if given, are left absent as are leading gaps.
 * @since 1.0
 */
public class KeepLastValue implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final int limit = node.getIntNamedOrPosArgDefault("limit", 1, -1);
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final MetricData output = MetricData.newLike(input, 
          node.nameWith(input.name()));
      int gap_start = -1;
      double last = Double.NaN;
      for (int i = 0; i < input.size(); i++) {
        if (input.isAbsent(i)) {
          output.setAbsent(i);
          if (gap_start < 0) {
            gap_start = i;
          }
          continue;
        }
        if (gap_start >= 0 && !Double.isNaN(last) && 
            (limit < 0 || i - gap_start <= limit)) {
          for (int j = gap_start; j < i; j++) {
            output.setValue(j, last);
          }
        }
        gap_start = -1;
        last = input.value(i);
        output.setValue(i, last);
      }
      // a trailing gap has no end so only the limit applies
      if (gap_start >= 0 && !Double.isNaN(last) && 
          (limit < 0 || input.size() - gap_start <= limit)) {
        for (int j = gap_start; j < input.size(); j++) {
          output.setValue(j, last);
        }
      }
      results.add(output);
    }
    return results;
  }
}
