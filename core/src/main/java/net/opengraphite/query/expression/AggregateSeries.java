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
import java.util.function.ToDoubleFunction;

import com.google.common.collect.Lists;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.exceptions.SeriesMismatchException;
import net.opengraphite.query.MetricRequest;

/**
 * Combines every series in the arguments into one by reducing the values at
 * each timestamp, e.g. {@code sumSeries(host.*.cpu)}. Only present values 
 * take part and a timestamp with no present values is absent in the output.
 * Zero input series is an error.
 * <p>
 * When constructed without a reducer, as for {@code aggregate}, the reducer
 * name is read from the second argument.
 * @since 1.0
 */
public class AggregateSeries implements Expression {

  /** The reducer or null to read it from the arguments. */
  private final String reducer;
  
  /** Ctor for {@code aggregate(seriesList, func)}. */
  public AggregateSeries() {
    this(null);
  }
  
  /**
   * Ctor with a fixed reducer.
   * @param reducer A reducer name from {@link Consolidations}.
   */
  public AggregateSeries(final String reducer) {
    if (reducer != null) {
      Consolidations.validate(reducer);
    }
    this.reducer = reducer;
  }
  
  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs;
    final String func;
    final String name;
    if (reducer == null) {
      inputs = evaluator.seriesArg(node.arg(0), from, until, fetched);
      func = node.getStringArg(1);
      Consolidations.validate(func);
      name = func + "Series(" + node.arg(0).toString() + ")";
    } else {
      inputs = evaluator.seriesArgs(node, 0, from, until, fetched);
      func = reducer;
      name = node.target() + "(" + node.rawArgs() + ")";
    }
    if (inputs.isEmpty()) {
      throw new InvalidArgumentException(Reason.SERIES_DOES_NOT_EXIST, 
          "No series to aggregate for " + node);
    }
    return Lists.newArrayList(aggregate(inputs, func, name));
  }
  
  /**
   * Reduces the series index by index onto a common grid. Series must share
   * a step and their starts must fall on the same grid. Shorter series are
   * treated as absent where they have no samples.
   * @param inputs A non-null and non-empty list of series.
   * @param func The reducer name.
   * @param name The output name.
   * @return The aggregated series.
   * @throws SeriesMismatchException if the steps or grids differ.
   */
  public static MetricData aggregate(final List<MetricData> inputs, 
                                     final String func, 
                                     final String name) {
    return aggregate(inputs, 
        column -> Consolidations.summarize(func, column, 0), name);
  }
  
  /**
   * Reduces the series index by index onto a common grid with a custom 
   * reducer.
   * @param inputs A non-null and non-empty list of series.
   * @param reducer Reduces the values at one timestamp, NaN for absent.
   * @param name The output name.
   * @return The aggregated series.
   * @throws SeriesMismatchException if the steps or grids differ.
   */
  public static MetricData aggregate(final List<MetricData> inputs, 
                                     final ToDoubleFunction<double[]> reducer, 
                                     final String name) {
    final MetricData first = inputs.get(0);
    final long step = first.step();
    long start = first.start();
    long end = first.start() + first.size() * step;
    long stop = first.stop();
    for (final MetricData input : inputs) {
      if (input.step() != step) {
        throw new SeriesMismatchException("Cannot aggregate series with "
            + "different steps: " + first.name() + " has " + step + " and " 
            + input.name() + " has " + input.step());
      }
      if ((input.start() - first.start()) % step != 0) {
        throw new SeriesMismatchException("Cannot aggregate series on "
            + "different grids: " + first.name() + " starts at " 
            + first.start() + " and " + input.name() + " at " 
            + input.start());
      }
      start = Math.min(start, input.start());
      end = Math.max(end, input.start() + input.size() * step);
      stop = Math.max(stop, input.stop());
    }
    
    final int size = (int) ((end - start) / step);
    final double[] values = new double[size];
    final double[] column = new double[inputs.size()];
    for (int i = 0; i < size; i++) {
      final long timestamp = start + i * step;
      for (int s = 0; s < inputs.size(); s++) {
        final MetricData input = inputs.get(s);
        final int idx = (int) ((timestamp - input.start()) / step);
        column[s] = timestamp < input.start() || idx >= input.size() ? 
            Double.NaN : input.value(idx);
      }
      values[i] = reducer.applyAsDouble(column);
    }
    return MetricData.newBuilder()
        .setName(name)
        .setStart(start)
        .setStop(Math.max(stop, start + size * step))
        .setStep(step)
        .setValues(values)
        .setValuesPerPoint(first.valuesPerPoint())
        .setConsolidation(first.consolidation())
        .setXFilesFactor(first.xFilesFactor())
        .build();
  }
}
