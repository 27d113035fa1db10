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
package net.opengraphite.query;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.QueryExecutionException;

/**
 * The outcome of a render request: the series of every target that 
 * evaluated, in target order, and the error of each target that didn't.
 * 
 * @since 1.0
 */
public class RenderResult {
  /** The output series. */
  private final List<MetricData> series;
  
  /** Errors keyed by target. */
  private final Map<String, QueryExecutionException> errors;
  
  /**
   * Default ctor.
   * @param series The non-null series.
   * @param errors The non-null, possibly empty, map of errors by target.
   */
  public RenderResult(final List<MetricData> series, 
                      final Map<String, QueryExecutionException> errors) {
    this.series = Collections.unmodifiableList(series);
    this.errors = Collections.unmodifiableMap(errors);
  }
  
  /** @return The series in target order. */
  public List<MetricData> series() {
    return series;
  }
  
  /** @return The errors keyed by target. */
  public Map<String, QueryExecutionException> errors() {
    return errors;
  }
  
  /** @return Whether or not any target failed. */
  public boolean hasErrors() {
    return !errors.isEmpty();
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("series=")
        .append(series.size())
        .append(", errors=")
        .append(errors)
        .toString();
  }
}
