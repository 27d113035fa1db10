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
 * Computes a statistic over the trailing window of samples preceding each
 * timestamp: {@code movingAverage(seriesList, windowSize, xFilesFactor)} and
 * friends. 
 * <p>
 * The window is either a number of points, in which case the first 
 * {@code windowSize} outputs are absent, or an interval string such as 
 * '5min', in which case the data is fetched from that much earlier so the
 * whole requested range is covered. A window whose ratio of present values
 * is under the x-files factor is absent. A ratio equal to the factor is 
 * valid.
 * @since 1.0
 */
public class MovingWindow implements Expression {
  
  /** The statistics. */
  public static enum Statistic {
    AVERAGE,
    SUM,
    MIN,
    MAX,
    MEDIAN
  }
  
  /** The statistic computed by this instance. */
  private final Statistic statistic;
  
  /** The x-files factor when the call doesn't give one and the series has
   * none. */
  private final double default_x_files_factor;
  
  /**
   * Default ctor.
   * @param statistic The non-null statistic.
   * @param default_x_files_factor The fallback x-files factor from 0 to 1.
   */
  public MovingWindow(final Statistic statistic, 
                      final double default_x_files_factor) {
    this.statistic = statistic;
    this.default_x_files_factor = default_x_files_factor;
  }
  
  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    if (node.argsLen() < 2) {
      throw new InvalidArgumentException(Reason.MISSING_ARGUMENT, 
          node.target() + " requires a series and a window size");
    }
    final Expr window = node.arg(1);
    final long window_seconds;
    final int window_points;
    final String window_text;
    if (window.isConst()) {
      window_points = node.getIntArg(1);
      window_seconds = 0;
      window_text = Integer.toString(window_points);
      if (window_points < 1) {
        throw new InvalidArgumentException(Reason.INVALID_VALUE, 
            "Window size must be at least one point: " + window);
      }
    } else if (window.isString()) {
      window_seconds = node.getIntervalArg(1, 1);
      window_points = 0;
      window_text = quote(window.valueString());
      if (window_seconds <= 0) {
        throw new InvalidArgumentException(Reason.INVALID_VALUE, 
            "Window interval must be positive: " + window);
      }
    } else {
      throw new InvalidArgumentException(Reason.BAD_TYPE, 
          "Window must be a number of points or an interval: " + window);
    }
    
    final List<MetricData> inputs = evaluator.seriesArg(node.arg(0), 
        from - window_seconds, until, fetched);
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final double x_files_factor = node.getFloatNamedOrPosArgDefault(
          "xFilesFactor", 2, input.xFilesFactor() > 0 ? 
              input.xFilesFactor() : default_x_files_factor);
      final int size = window_seconds > 0 ? 
          (int) (window_seconds / input.step()) : window_points;
      final int offset = window_seconds > 0 ? 
          Math.min(size, input.size()) : 0;
      results.add(compute(node, input, size, offset, x_files_factor, 
          node.target() + "(" + input.name() + "," + window_text + ")"));
    }
    return results;
  }
  
  @Override
  public List<MetricRequest> metrics(final Expr node, 
                                     final long from, 
                                     final long until) {
    if (node.argsLen() > 1 && node.arg(1).isString()) {
      try {
        return node.arg(0).metrics(from - node.getIntervalArg(1, 1), until);
      } catch (InvalidArgumentException e) {
        // reported when evaluated
      }
    }
    return Expression.collectMetrics(node, from, until);
  }
  
  /**
   * Runs the window over one series.
   * @param size The window size in points.
   * @param offset How many leading lookback points to drop from the output.
   * @param name The output name.
   */
  private MetricData compute(final Expr node, 
                             final MetricData input, 
                             final int size, 
                             final int offset,
                             final double x_files_factor, 
                             final String name) {
    final int output_size = input.size() - offset;
    final MetricData output = MetricData.newBuilder()
        .setName(name)
        .setStart(input.start() + offset * input.step())
        .setStep(input.step())
        .setValues(new double[output_size])
        .setValuesPerPoint(input.valuesPerPoint())
        .setConsolidation(input.consolidation())
        .setXFilesFactor(input.xFilesFactor())
        .setTags(input.tags())
        .addTag("name", name)
        .addTag(node.target(), Integer.toString(size))
        .build();
    if (size < 1) {
      // window is smaller than the step
      for (int i = 0; i < output_size; i++) {
        output.setAbsent(i);
      }
      return output;
    }
    
    final Windowed windowed = new Windowed(size);
    for (int i = 0; i < input.size(); i++) {
      if (i >= offset) {
        final int idx = i - offset;
        if (i >= size && windowed.validFraction() >= x_files_factor) {
          output.setValue(idx, statistic(windowed));
        } else {
          output.setAbsent(idx);
        }
      }
      windowed.push(input.value(i));
    }
    return output;
  }
  
  private double statistic(final Windowed windowed) {
    switch (statistic) {
    case AVERAGE:
      return windowed.mean();
    case SUM:
      return windowed.sum();
    case MIN:
      return windowed.min();
    case MAX:
      return windowed.max();
    case MEDIAN:
      return windowed.median();
    default:
      throw new IllegalStateException("Unhandled statistic: " + statistic);
    }
  }
  
  /**
   * @param text The raw window string.
   * @return The string in double quotes with quotes and backslashes escaped,
   * as Graphite renders interval windows in names.
   */
  static String quote(final String text) {
    final StringBuilder buf = new StringBuilder(text.length() + 2)
        .append('"');
    for (int i = 0; i < text.length(); i++) {
      final char c = text.charAt(i);
      if (c == '"' || c == '\\') {
        buf.append('\\');
      }
      buf.append(c);
    }
    return buf.append('"').toString();
  }
}
