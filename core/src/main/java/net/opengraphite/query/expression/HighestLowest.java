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
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;

/**
 * Picks the top or bottom "n" series, one by default, ranked by a 
 * statistic over their present values. e.g. {@code highestMax(sys.*, 2)}.
 * Ties keep their input order and series without any present values rank 
 * last either way.
 * @since 1.0
 */
public class HighestLowest implements Expression {

  /** The statistic to rank by. */
  public static enum Statistic {
    MAX,
    CURRENT,
    AVERAGE
  }
  
  /** The statistic to rank by. */
  private final Statistic statistic;
  
  /** Whether to keep the highest values. */
  private final boolean highest;
  
  /**
   * Default ctor.
   * @param statistic The statistic to rank by.
   * @param highest True to keep the highest, false for the lowest.
   */
  public HighestLowest(final Statistic statistic, final boolean highest) {
    this.statistic = statistic;
    this.highest = highest;
  }
  
  @Override
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched) {
    final List<MetricData> inputs = 
        evaluator.seriesArg(node.arg(0), from, until, fetched);
    final int n = node.getIntArgDefault(1, 1);
    if (n < 0) {
      throw new InvalidArgumentException(Reason.INVALID_VALUE, 
          "Count must be zero or greater: " + n);
    }
    
    final List<Ranked> ranked = new ArrayList<Ranked>(inputs.size());
    for (final MetricData input : inputs) {
      ranked.add(new Ranked(input, rank(input)));
    }
    // stable
    Collections.sort(ranked, new RankComparator(highest));
    
    final List<MetricData> results = new ArrayList<MetricData>();
    for (int i = 0; i < ranked.size() && i < n; i++) {
      results.add(ranked.get(i).series);
    }
    return results;
  }
  
  /**
   * Computes the ranking statistic.
   * @param series The non-null series.
   * @return The statistic or NaN if the series has no present values.
   */
  double rank(final MetricData series) {
    double result = Double.NaN;
    int count = 0;
    double sum = 0;
    for (int i = 0; i < series.size(); i++) {
      if (series.isAbsent(i)) {
        continue;
      }
      final double value = series.value(i);
      switch (statistic) {
      case MAX:
        result = Double.isNaN(result) ? value : Math.max(result, value);
        break;
      case CURRENT:
        result = value;
        break;
      case AVERAGE:
        sum += value;
        count++;
        result = sum / count;
        break;
      }
    }
    return result;
  }
  
  /** A series with its statistic. */
  private static class Ranked {
    private final MetricData series;
    private final double rank;
    
    private Ranked(final MetricData series, final double rank) {
      this.series = series;
      this.rank = rank;
    }
  }
  
  /** Sorts by the statistic with NaNs at the end. */
  private static class RankComparator implements Comparator<Ranked> {
    private final boolean descending;
    
    private RankComparator(final boolean descending) {
      this.descending = descending;
    }
    
    @Override
    public int compare(final Ranked a, final Ranked b) {
      final boolean a_nan = Double.isNaN(a.rank);
      final boolean b_nan = Double.isNaN(b.rank);
      if (a_nan || b_nan) {
        return a_nan == b_nan ? 0 : a_nan ? 1 : -1;
      }
      return descending ? Double.compare(b.rank, a.rank) : 
        Double.compare(a.rank, b.rank);
    }
  }
}
