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
 * Triple exponential smoothing with a one day season, as Graphite computes
 * it. Absent samples break the smoothing: their intercept is reset, the
 * prediction carries over and the following prediction is NaN.
 * 
 * @since 1.0
 */
public final class HoltWinters {
  
  static final double ALPHA = 0.1;
  static final double BETA = 0.0035;
  static final double GAMMA = 0.1;
  
  /** Seconds in a season. */
  static final long SEASON = 86400;
  
  /** The output of an analysis. */
  public static final class Analysis {
    private final double[] predictions;
    private final double[] deviations;
    
    Analysis(final double[] predictions, final double[] deviations) {
      this.predictions = predictions;
      this.deviations = deviations;
    }
    
    /** @return The prediction for each sample, NaN where undefined. */
    public double[] predictions() {
      return predictions;
    }
    
    /** @return The seasonal deviation for each sample. */
    public double[] deviations() {
      return deviations;
    }
  }
  
  /** Don't instantiate me! */
  private HoltWinters() { }
  
  /**
   * Runs the analysis over the values.
   * @param values The values, NaN for absent samples.
   * @param step The step of the series in seconds.
   * @return The predictions and deviations, same length as the values.
   */
  public static Analysis analyze(final double[] values, final long step) {
    final int season_length = (int) Math.max(1, SEASON / step);
    final int n = values.length;
    final double[] intercepts = new double[n];
    final double[] slopes = new double[n];
    final double[] seasonals = new double[n];
    final double[] predictions = new double[n];
    final double[] deviations = new double[n];
    
    double next_prediction = Double.NaN;
    for (int i = 0; i < n; i++) {
      final double actual = values[i];
      if (Double.isNaN(actual)) {
        intercepts[i] = Double.NaN;
        slopes[i] = 0;
        seasonals[i] = 0;
        predictions[i] = next_prediction;
        deviations[i] = 0;
        next_prediction = Double.NaN;
        continue;
      }
      
      final double last_intercept;
      final double last_slope;
      final double prediction;
      if (i == 0) {
        last_intercept = actual;
        last_slope = 0;
        prediction = actual;
      } else {
        last_intercept = Double.isNaN(intercepts[i - 1]) ? 
            actual : intercepts[i - 1];
        last_slope = slopes[i - 1];
        prediction = next_prediction;
      }
      
      final double last_seasonal = lastSeason(seasonals, i, season_length);
      final double next_last_seasonal = 
          lastSeason(seasonals, i + 1, season_length);
      final double last_deviation = lastSeason(deviations, i, season_length);
      
      final double intercept = ALPHA * (actual - last_seasonal) 
          + (1 - ALPHA) * (last_intercept + last_slope);
      final double slope = BETA * (intercept - last_intercept) 
          + (1 - BETA) * last_slope;
      final double seasonal = GAMMA * (actual - intercept) 
          + (1 - GAMMA) * last_seasonal;
      next_prediction = intercept + slope + next_last_seasonal;
      
      final double deviation = Double.isNaN(prediction) ? 
          (1 - GAMMA) * last_deviation :
          GAMMA * Math.abs(actual - prediction) 
            + (1 - GAMMA) * last_deviation;
      
      intercepts[i] = intercept;
      slopes[i] = slope;
      seasonals[i] = seasonal;
      predictions[i] = prediction;
      deviations[i] = deviation;
    }
    return new Analysis(predictions, deviations);
  }
  
  private static double lastSeason(final double[] values, 
                                   final int index, 
                                   final int season_length) {
    final int j = index - season_length;
    return j >= 0 && j < values.length ? values[j] : 0;
  }
}
