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

/**
 * A fixed size circular buffer over the trailing window of a series with 
 * running sums. Absent samples are pushed as NaN and occupy a slot so the
 * window always spans the same time range.
 * <p>
 * Not thread safe.
 * 
 * @since 1.0
 */
public class Windowed {
  
  /** The slots. */
  private final double[] data;
  
  /** The next slot to write. */
  private int head;
  
  /** How many slots have been written, capped at the window size. */
  private int length;
  
  /** Sum of the present values in the window. */
  private double sum;
  
  /** Sum of squares of the present values in the window. */
  private double sum_squares;
  
  /** How many NaNs are in the window. */
  private int nans;
  
  /**
   * Default ctor.
   * @param size The window size, greater than zero.
   */
  public Windowed(final int size) {
    if (size < 1) {
      throw new IllegalArgumentException("Window size must be greater "
          + "than zero: " + size);
    }
    data = new double[size];
  }
  
  /**
   * Adds a value, evicting the oldest once the window is full.
   * @param value The value or NaN for an absent sample.
   */
  public void push(final double value) {
    if (length == data.length) {
      final double old = data[head];
      if (Double.isNaN(old)) {
        nans--;
      } else {
        sum -= old;
        sum_squares -= old * old;
      }
    } else {
      length++;
    }
    data[head] = value;
    head = (head + 1) % data.length;
    if (Double.isNaN(value)) {
      nans++;
    } else {
      sum += value;
      sum_squares += value * value;
    }
  }
  
  /** @return The window size. */
  public int size() {
    return data.length;
  }
  
  /** @return How many values have been pushed, capped at the size. */
  public int filled() {
    return length;
  }
  
  /** @return How many present values are in the window. */
  public int validCount() {
    return length - nans;
  }
  
  /** @return The ratio of present values to the window size. */
  public double validFraction() {
    return (double) validCount() / data.length;
  }
  
  /** @return The sum of present values or NaN if none. */
  public double sum() {
    return validCount() == 0 ? Double.NaN : sum;
  }
  
  /** @return The mean of present values or NaN if none. */
  public double mean() {
    return validCount() == 0 ? Double.NaN : sum / validCount();
  }
  
  /** @return The population standard deviation or NaN if none present. */
  public double stdev() {
    final int n = validCount();
    if (n == 0) {
      return Double.NaN;
    }
    final double variance = n * sum_squares - sum * sum;
    // rounding on the running sums can dip below zero
    return variance <= 0 ? 0 : Math.sqrt(variance) / n;
  }
  
  /** @return The minimum present value or NaN if none. */
  public double min() {
    double min = Double.NaN;
    for (int i = 0; i < length; i++) {
      if (!Double.isNaN(data[i]) && (Double.isNaN(min) || data[i] < min)) {
        min = data[i];
      }
    }
    return min;
  }
  
  /** @return The maximum present value or NaN if none. */
  public double max() {
    double max = Double.NaN;
    for (int i = 0; i < length; i++) {
      if (!Double.isNaN(data[i]) && (Double.isNaN(max) || data[i] > max)) {
        max = data[i];
      }
    }
    return max;
  }
  
  /** @return The interpolated median of present values or NaN if none. */
  public double median() {
    if (length < data.length) {
      final double[] filled = new double[length];
      System.arraycopy(data, 0, filled, 0, length);
      return Consolidations.percentile(filled, 50, true);
    }
    return Consolidations.percentile(data, 50, true);
  }
}
