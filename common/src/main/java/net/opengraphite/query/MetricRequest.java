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

import com.google.common.base.Objects;
import com.google.common.base.Strings;

/**
 * The join key between what an expression needs and what has been fetched:
 * a metric pattern, possibly with globs, and a time range in seconds. Two
 * identical requests anywhere in an expression tree share a single fetch.
 * 
 * @since 1.0
 */
public final class MetricRequest {
  
  /** The metric pattern. */
  private final String pattern;
  
  /** Start of the range in Unix epoch seconds. */
  private final long from;
  
  /** End of the range in Unix epoch seconds. */
  private final long until;
  
  /**
   * Default ctor.
   * @param pattern A non-null and non-empty metric pattern.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @throws IllegalArgumentException if the pattern was null or empty.
   */
  public MetricRequest(final String pattern, 
                       final long from, 
                       final long until) {
    if (Strings.isNullOrEmpty(pattern)) {
      throw new IllegalArgumentException("Pattern cannot be null or empty.");
    }
    this.pattern = pattern;
    this.from = from;
    this.until = until;
  }
  
  /** @return The metric pattern. */
  public String pattern() {
    return pattern;
  }
  
  /** @return The start of the range in seconds. */
  public long from() {
    return from;
  }
  
  /** @return The end of the range in seconds. */
  public long until() {
    return until;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricRequest)) {
      return false;
    }
    final MetricRequest other = (MetricRequest) o;
    return from == other.from && 
           until == other.until && 
           pattern.equals(other.pattern);
  }
  
  @Override
  public int hashCode() {
    return Objects.hashCode(pattern, from, until);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("pattern=")
        .append(pattern)
        .append(", from=")
        .append(from)
        .append(", until=")
        .append(until)
        .toString();
  }
}
