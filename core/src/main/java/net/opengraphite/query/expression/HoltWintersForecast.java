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
 * Holt-Winters forecasting. The series are evaluated from the bootstrap 
 * interval, seven days by default, before the requested range to train the
 * model and the bootstrap samples are trimmed from the output.
 * <ul>
 * <li>{@code holtWintersForecast(seriesList, bootstrapInterval='7d')}</li>
 * <li>{@code holtWintersConfidenceBands(seriesList, delta=3, 
 * bootstrapInterval='7d')} returning an upper and lower band per series.</li>
 * </ul>
 * @since 1.0
 */
public class HoltWintersForecast implements Expression {

  /** Default bootstrap interval in seconds. */
  static final long DEFAULT_BOOTSTRAP = 7 * 86400;
  
  /** Whether or not this instance computes confidence bands. */
  private final boolean bands;
  
  /**
   * Default ctor.
   * @param bands True for confidence bands, false for the forecast.
   */
  public HoltWintersForecast(final boolean bands) {
    this.bands = bands;
  }
  
  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final long bootstrap = bootstrap(node);
    final double delta = bands ? 
        node.getFloatNamedOrPosArgDefault("delta", 1, 3) : 0;
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from - bootstrap, until, fetched);
    
    final List<MetricData> results = new ArrayList<MetricData>();
    for (final MetricData input : inputs) {
      final HoltWinters.Analysis analysis = 
          HoltWinters.analyze(input.toArray(), input.step());
      final int trim = (int) Math.min(input.size(), bootstrap / input.step());
      final double[] predictions = Arrays.copyOfRange(
          analysis.predictions(), trim, input.size());
      if (!bands) {
        results.add(series(input, trim, 
            "holtWintersForecast(" + input.name() + ")", predictions));
        continue;
      }
      
      final double[] deviations = Arrays.copyOfRange(
          analysis.deviations(), trim, input.size());
      final double[] upper = new double[predictions.length];
      final double[] lower = new double[predictions.length];
      for (int i = 0; i < predictions.length; i++) {
        upper[i] = predictions[i] + delta * deviations[i];
        lower[i] = predictions[i] - delta * deviations[i];
      }
      results.add(series(input, trim, 
          "holtWintersConfidenceUpper(" + input.name() + ")", upper));
      results.add(series(input, trim, 
          "holtWintersConfidenceLower(" + input.name() + ")", lower));
    }
    return results;
  }
  
  @Override
  public List<MetricRequest> metrics(final Expr node, 
                                     final long from, 
                                     final long until) {
    long bootstrap;
    try {
      bootstrap = bootstrap(node);
    } catch (InvalidArgumentException e) {
      // reported when evaluated
      bootstrap = 0;
    }
    return node.arg(0).metrics(from - bootstrap, until);
  }
  
  private long bootstrap(final Expr node) {
    return node.getIntervalNamedOrPosArgDefault("bootstrapInterval", 
        bands ? 2 : 1, 1, DEFAULT_BOOTSTRAP);
  }
  
  private static MetricData series(final MetricData input, 
                                   final int trim, 
                                   final String name, 
                                   final double[] values) {
    return MetricData.newBuilder()
        .setName(name)
        .setStart(input.start() + trim * input.step())
        .setStep(input.step())
        .setValues(values)
        .setConsolidation(input.consolidation())
        .setXFilesFactor(input.xFilesFactor())
        .setTags(input.tags())
        .addTag("name", name)
        .build();
  }
}
