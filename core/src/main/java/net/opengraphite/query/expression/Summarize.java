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
import net.opengraphite.utils.DateTime;

/**
 * Consolidates each series into buckets of a fixed width:
 * {@code summarize(seriesList, intervalString, func='sum', alignToFrom=false)}.
 * <p>
 * Buckets are aligned to multiples of the width unless alignToFrom is set,
 * in which case they start at the series start. Every sample lands in 
 * exactly one bucket and a trailing partial bucket is still emitted, 
 * reduced over the samples it has. This changes the step of the series.
 * @since 1.0
 */
public class Summarize implements Expression {

  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final long bucket = node.getIntervalArg(1, 1);
    if (bucket <= 0) {
      throw new InvalidArgumentException(Reason.INVALID_VALUE, 
          "Bucket interval must be positive: " + node.arg(1));
    }
    final String func = node.getStringNamedOrPosArgDefault("func", 2, "sum");
    Consolidations.validate(func);
    final boolean func_given = 
        node.namedArg("func") != null || node.argsLen() > 2;
    final boolean align_to_from = 
        node.getBoolNamedOrPosArgDefault("alignToFrom", 3, false);
    final boolean align_given = 
        node.namedArg("alignToFrom") != null || node.argsLen() > 3;
    
    final List<MetricData> results = new ArrayList<MetricData>(inputs.size());
    for (final MetricData input : inputs) {
      final StringBuilder name = new StringBuilder()
          .append("summarize(")
          .append(input.name())
          .append(",'")
          .append(node.getStringArg(1))
          .append("'");
      // include the function whenever alignment is given so the booleans
      // don't read as the function
      if (func_given || align_given) {
        name.append(",'").append(func).append("'");
      }
      if (align_given) {
        name.append(",").append(align_to_from);
      }
      name.append(")");
      results.add(summarize(input, bucket, func, align_to_from, 
          name.toString()));
    }
    return results;
  }
  
  /**
   * Buckets one series.
   * @param input The non-null series.
   * @param bucket The bucket width in seconds.
   * @param func The reducer.
   * @param align_to_from Whether to start buckets at the series start.
   * @param name The output name.
   * @return The bucketed series.
   */
  static MetricData summarize(final MetricData input, 
                              final long bucket, 
                              final String func, 
                              final boolean align_to_from, 
                              final String name) {
    final long origin = align_to_from ? input.start() : 
      DateTime.alignDown(input.start(), bucket);
    final long end = input.start() + input.size() * input.step();
    final int buckets = input.size() == 0 ? 0 : 
      (int) ((end - origin + bucket - 1) / bucket);
    
    final int[] counts = new int[buckets];
    for (int i = 0; i < input.size(); i++) {
      counts[bucketIndex(input, i, origin, bucket)]++;
    }
    final double[][] grouped = new double[buckets][];
    for (int b = 0; b < buckets; b++) {
      grouped[b] = new double[counts[b]];
      counts[b] = 0;
    }
    for (int i = 0; i < input.size(); i++) {
      final int b = bucketIndex(input, i, origin, bucket);
      grouped[b][counts[b]++] = input.value(i);
    }
    
    final double[] values = new double[buckets];
    for (int b = 0; b < buckets; b++) {
      values[b] = Consolidations.summarize(func, grouped[b], 
          input.xFilesFactor());
    }
    return MetricData.newBuilder()
        .setName(name)
        .setStart(origin)
        .setStep(bucket)
        .setValues(values)
        .setConsolidation(input.consolidation())
        .setXFilesFactor(input.xFilesFactor())
        .setTags(input.tags())
        .addTag("name", name)
        .addTag("summarize", Long.toString(bucket))
        .addTag("summarizeFunction", func)
        .build();
  }
  
  private static int bucketIndex(final MetricData input, 
                                 final int index, 
                                 final long origin, 
                                 final long bucket) {
    return (int) ((input.timestamp(index) - origin) / bucket);
  }
}
