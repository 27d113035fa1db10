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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;

import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;

/**
 * Reducers shared by the aggregate, bucket and window functions. NaNs in 
 * the input arrays mark absent samples and are skipped.
 * 
 * @since 1.0
 */
public final class Consolidations {
  
  /** The reducer names accepted besides percentiles like "p99". */
  public static final ImmutableSet<String> REDUCERS = ImmutableSet.of(
      "sum", "total", "avg", "average", "avg_zero", "median", "max", "min", 
      "last", "current", "first", "range", "rangeOf", "multiply", "diff", 
      "count", "stddev");
  
  /** Don't instantiate me! */
  private Consolidations() { }
  
  /**
   * Validates a reducer name.
   * @param name The name to check.
   * @throws InvalidArgumentException if the name isn't a known reducer or a
   * percentile in the form "pNN".
   */
  public static void validate(final String name) {
    if (name != null && 
        (REDUCERS.contains(name) || !Double.isNaN(parsePercentile(name)))) {
      return;
    }
    throw new InvalidArgumentException(Reason.INVALID_VALUE, 
        "Unknown consolidation function: " + name);
  }
  
  /**
   * Reduces the values with the named reducer. The input array is not 
   * modified.
   * @param name A reducer name, see {@link #validate(String)}.
   * @param values The values, NaN for absent samples.
   * @param x_files_factor The minimum ratio of present values required, 
   * zero to accept any.
   * @return The reduced value or NaN if the values were empty, entirely 
   * absent or under the ratio.
   */
  public static double summarize(final String name, 
                                 final double[] values, 
                                 final double x_files_factor) {
    if (values.length == 0) {
      return Double.NaN;
    }
    final int present = countPresent(values);
    if (present == 0 && !name.equals("avg_zero")) {
      return Double.NaN;
    }
    if ((double) present / values.length < x_files_factor) {
      return Double.NaN;
    }
    
    switch (name) {
    case "sum":
    case "total":
      return sum(values);
    case "avg":
    case "average":
      return sum(values) / present;
    case "avg_zero":
      return sum(values) / values.length;
    case "median":
      return percentile(values, 50, true);
    case "max": {
      double max = Double.NEGATIVE_INFINITY;
      for (final double v : values) {
        if (!Double.isNaN(v) && v > max) {
          max = v;
        }
      }
      return max;
    }
    case "min": {
      double min = Double.POSITIVE_INFINITY;
      for (final double v : values) {
        if (!Double.isNaN(v) && v < min) {
          min = v;
        }
      }
      return min;
    }
    case "last":
    case "current":
      for (int i = values.length - 1; i >= 0; i--) {
        if (!Double.isNaN(values[i])) {
          return values[i];
        }
      }
      return Double.NaN;
    case "first":
      for (int i = 0; i < values.length; i++) {
        if (!Double.isNaN(values[i])) {
          return values[i];
        }
      }
      return Double.NaN;
    case "range":
    case "rangeOf":
      return summarize("max", values, 0) - summarize("min", values, 0);
    case "multiply": {
      double product = 1;
      for (final double v : values) {
        if (!Double.isNaN(v)) {
          product *= v;
        }
      }
      return product;
    }
    case "diff": {
      double diff = Double.NaN;
      for (final double v : values) {
        if (Double.isNaN(v)) {
          continue;
        }
        diff = Double.isNaN(diff) ? v : diff - v;
      }
      return diff;
    }
    case "count":
      return present;
    case "stddev":
      return stddev(values);
    default:
      final double p = parsePercentile(name);
      if (Double.isNaN(p)) {
        throw new InvalidArgumentException(Reason.INVALID_VALUE, 
            "Unknown consolidation function: " + name);
      }
      return percentile(values, p, true);
    }
  }
  
  /**
   * Computes the p-th percentile of the present values using the rank 
   * {@code k = (n - 1) * p / 100}. The value at rank {@code ceil(k)} is 
   * found with a partial selection. When interpolating and k has a 
   * fractional part, the result blends that value with the next lower 
   * ranked value by the fraction.
   * @param values The values, NaN for absent samples. Not modified.
   * @param percent The percentile from 0 to 100.
   * @param interpolate Whether or not to interpolate between ranks.
   * @return The percentile, the single value when only one is present or 
   * NaN if nothing was present or the percent was out of range.
   */
  public static double percentile(final double[] values, 
                                  final double percent, 
                                  final boolean interpolate) {
    if (percent < 0 || percent > 100 || Double.isNaN(percent)) {
      return Double.NaN;
    }
    final double[] data = new double[countPresent(values)];
    int idx = 0;
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        data[idx++] = v;
      }
    }
    if (data.length == 0) {
      return Double.NaN;
    }
    if (data.length == 1) {
      return data[0];
    }
    
    final double k = (data.length - 1) * percent / 100;
    final int rank = (int) Math.ceil(k);
    select(data, rank);
    final double top = data[rank];
    final double remainder = k - Math.floor(k);
    if (remainder == 0 || !interpolate) {
      return top;
    }
    double second_top = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < rank; i++) {
      if (data[i] > second_top) {
        second_top = data[i];
      }
    }
    return top * remainder + second_top * (1 - remainder);
  }
  
  /**
   * @param values The values, NaN for absent samples.
   * @return The population standard deviation of the present values or NaN
   * if none were present.
   */
  public static double stddev(final double[] values) {
    int count = 0;
    double sum = 0;
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        sum += v;
        count++;
      }
    }
    if (count == 0) {
      return Double.NaN;
    }
    final double mean = sum / count;
    double squares = 0;
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        squares += (v - mean) * (v - mean);
      }
    }
    return Math.sqrt(squares / count);
  }
  
  /**
   * Parses a percentile reducer like "p50" or "p99.9".
   * @return The percent or NaN if the name isn't a percentile.
   */
  @VisibleForTesting
  static double parsePercentile(final String name) {
    if (name.length() < 2 || name.charAt(0) != 'p') {
      return Double.NaN;
    }
    try {
      final double p = Double.parseDouble(name.substring(1));
      return p < 0 || p > 100 ? Double.NaN : p;
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }
  
  /**
   * Partially sorts the array so the element at index k is the one a full 
   * sort would put there and every element before it is smaller or equal.
   */
  @VisibleForTesting
  static void select(final double[] data, final int k) {
    int left = 0;
    int right = data.length - 1;
    while (right > left) {
      final double pivot = data[(left + right) >>> 1];
      int i = left;
      int j = right;
      while (i <= j) {
        while (data[i] < pivot) {
          i++;
        }
        while (data[j] > pivot) {
          j--;
        }
        if (i <= j) {
          final double tmp = data[i];
          data[i] = data[j];
          data[j] = tmp;
          i++;
          j--;
        }
      }
      if (k <= j) {
        right = j;
      } else if (k >= i) {
        left = i;
      } else {
        return;
      }
    }
  }
  
  private static double sum(final double[] values) {
    double sum = 0;
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        sum += v;
      }
    }
    return sum;
  }
  
  private static int countPresent(final double[] values) {
    int count = 0;
    for (final double v : values) {
      if (!Double.isNaN(v)) {
        count++;
      }
    }
    return count;
  }
}
