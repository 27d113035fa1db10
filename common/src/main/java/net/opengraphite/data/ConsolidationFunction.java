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
package net.opengraphite.data;

import com.google.common.base.Strings;

/**
 * How raw samples are folded into a coarser point when a series is 
 * consolidated, e.g. for rendering or when step sizes disagree.
 * 
 * @since 1.0
 */
public enum ConsolidationFunction {
  SUM,
  AVERAGE,
  MIN,
  MAX,
  FIRST,
  LAST;
  
  /**
   * Reduces the present values in the given range. NaNs are treated as absent.
   * @param values The values to read from.
   * @param start The first index, inclusive.
   * @param end The last index, exclusive.
   * @return The reduced value or NaN if every value in the range was absent.
   */
  public double reduce(final double[] values, final int start, final int end) {
    double result = Double.NaN;
    int count = 0;
    for (int i = start; i < end; i++) {
      final double v = values[i];
      if (Double.isNaN(v)) {
        continue;
      }
      switch (this) {
      case SUM:
      case AVERAGE:
        result = count == 0 ? v : result + v;
        break;
      case MIN:
        result = count == 0 ? v : Math.min(result, v);
        break;
      case MAX:
        result = count == 0 ? v : Math.max(result, v);
        break;
      case FIRST:
        if (count == 0) {
          result = v;
        }
        break;
      case LAST:
        result = v;
        break;
      }
      count++;
    }
    if (this == AVERAGE && count > 0) {
      result /= count;
    }
    return result;
  }
  
  /**
   * Parses the Graphite name of a consolidation function.
   * @param name A non-null and non-empty name such as "average" or "max".
   * @return The function.
   * @throws IllegalArgumentException if the name was null, empty or unknown.
   */
  public static ConsolidationFunction fromString(final String name) {
    if (Strings.isNullOrEmpty(name)) {
      throw new IllegalArgumentException("Consolidation function name "
          + "cannot be null or empty.");
    }
    switch (name.trim().toLowerCase()) {
    case "sum":
    case "total":
      return SUM;
    case "avg":
    case "average":
      return AVERAGE;
    case "min":
      return MIN;
    case "max":
      return MAX;
    case "first":
      return FIRST;
    case "last":
    case "current":
      return LAST;
    default:
      throw new IllegalArgumentException("Unknown consolidation function: " 
          + name);
    }
  }
}
