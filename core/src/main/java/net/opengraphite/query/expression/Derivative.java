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
 * Computes the delta between consecutive samples. The first sample and any
 * sample following an absent one have no defined delta and are absent.
 * <p>
 * The non-negative and per-second variants treat a drop as a counter wrap:
 * with a max value the wrapped delta is computed, otherwise the sample is 
 * absent. The per-second variant also divides by the step.
 * @since 1.0
 */
public class Derivative implements Expression {

  /** Flavors of derivative. */
  public static enum Mode {
    DERIVATIVE,
    NON_NEGATIVE,
    PER_SECOND
  }
  
  /** The mode. */
  private final Mode mode;
  
  /**
   * Default ctor.
   * @param mode The non-null mode.
   */
  public Derivative(final Mode mode) {
    this.mode = mode;
  }
  
  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final double max_value = mode == Mode.DERIVATIVE ? Double.NaN : 
      node.getFloatNamedOrPosArgDefault("maxValue", 1, Double.NaN);
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final MetricData output = MetricData.newLike(input, 
          node.nameWith(input.name()));
      if (input.size() > 0) {
        output.setAbsent(0);
      }
      for (int i = 1; i < input.size(); i++) {
        if (input.isAbsent(i) || input.isAbsent(i - 1)) {
          output.setAbsent(i);
          continue;
        }
        final double previous = input.value(i - 1);
        final double current = input.value(i);
        double delta = current - previous;
        if (mode != Mode.DERIVATIVE && delta < 0) {
          if (!Double.isNaN(max_value) && max_value >= current) {
            delta = (max_value - previous) + current + 1;
          } else {
            output.setAbsent(i);
            continue;
          }
        }
        if (mode == Mode.PER_SECOND) {
          delta /= input.step();
        }
        output.setValue(i, delta);
      }
      results.add(output);
    }
    return results;
  }
}
