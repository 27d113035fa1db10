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
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.query.MetricRequest;

/**
 * Draws series from another time range onto the requested one: 
 * {@code timeShift(seriesList, '1d', resetEnd=true)} shows yesterday's data.
 * Intervals without a sign shift into the past. With resetEnd, samples 
 * shifted past the end of the requested range are dropped.
 * @since 1.0
 */
public class TimeShift implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final long shift = node.getIntervalArg(1, -1);
    final boolean reset_end = 
        node.getBoolNamedOrPosArgDefault("resetEnd", 2, true);
    final List<MetricData> inputs = evaluator.seriesArg(node.arg(0), 
        from + shift, until + shift, fetched);
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final String name = "timeShift(" + input.name() + "," 
          + node.arg(1).toString() + ")";
      final long start = input.start() - shift;
      int size = input.size();
      Long stop = input.stop() - shift;
      if (reset_end) {
        while (size > 0 && start + (size - 1) * input.step() > until) {
          size--;
        }
        stop = null;
      }
      final MetricData output = MetricData.newBuilder()
          .setName(name)
          .setStart(start)
          .setStop(stop)
          .setStep(input.step())
          .setValues(Arrays.copyOf(input.toArray(), size))
          .setValuesPerPoint(input.valuesPerPoint())
          .setConsolidation(input.consolidation())
          .setXFilesFactor(input.xFilesFactor())
          .setTags(input.tags())
          .addTag("name", name)
          .addTag("timeshift", Long.toString(shift))
          .build();
      results.add(output);
    }
    return results;
  }
  
  @Override
  public List<MetricRequest> metrics(final Expr node, 
                                     final long from, 
                                     final long until) {
    try {
      final long shift = node.getIntervalArg(1, -1);
      return node.arg(0).metrics(from + shift, until + shift);
    } catch (InvalidArgumentException e) {
      // reported when evaluated
      return Expression.collectMetrics(node, from, until);
    }
  }
}
