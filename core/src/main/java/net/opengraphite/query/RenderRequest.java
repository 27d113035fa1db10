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
import java.util.TreeMap;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

/**
 * A render request: the targets to evaluate over a range in unix epoch 
 * seconds plus the raw request parameters used to build the cache key.
 * 
 * @since 1.0
 */
public class RenderRequest {
  /** The expressions to evaluate, in order. */
  private final List<String> targets;
  
  /** The start of the range in seconds. */
  private final long from;
  
  /** The end of the range in seconds. */
  private final long until;
  
  /** Extra request parameters. */
  private final Map<String, List<String>> params;
  
  /**
   * Protected ctor from the builder.
   * @param builder A non-null builder.
   */
  protected RenderRequest(final Builder builder) {
    if (builder.targets.isEmpty()) {
      throw new IllegalArgumentException("At least one target is required.");
    }
    if (builder.until < builder.from) {
      throw new IllegalArgumentException("Until " + builder.until 
          + " cannot be before from " + builder.from);
    }
    targets = Collections.unmodifiableList(
        Lists.newArrayList(builder.targets));
    from = builder.from;
    until = builder.until;
    final Map<String, List<String>> copy = 
        Maps.newHashMapWithExpectedSize(builder.params.size());
    for (final Map.Entry<String, List<String>> entry : 
        builder.params.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableList(
          Lists.newArrayList(entry.getValue())));
    }
    params = Collections.unmodifiableMap(copy);
  }
  
  /** @return The targets in request order. */
  public List<String> targets() {
    return targets;
  }
  
  /** @return The start of the range in seconds. */
  public long from() {
    return from;
  }
  
  /** @return The end of the range in seconds. */
  public long until() {
    return until;
  }
  
  /** @return The extra parameters as given. */
  public Map<String, List<String>> params() {
    return params;
  }
  
  /**
   * @return The parameters that identify the result: the extra parameters 
   * overlaid with the targets and the resolved range.
   */
  public Map<String, List<String>> cacheParams() {
    final Map<String, List<String>> cache_params = 
        new TreeMap<String, List<String>>(params);
    cache_params.put("target", targets);
    cache_params.put("from", Lists.newArrayList(Long.toString(from)));
    cache_params.put("until", Lists.newArrayList(Long.toString(until)));
    return cache_params;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("targets=")
        .append(targets)
        .append(", from=")
        .append(from)
        .append(", until=")
        .append(until)
        .append(", params=")
        .append(params)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  public static class Builder {
    private final List<String> targets = Lists.newArrayList();
    private long from;
    private long until;
    private final Map<String, List<String>> params = Maps.newHashMap();
    
    public Builder addTarget(final String target) {
      targets.add(target);
      return this;
    }
    
    public Builder setTargets(final List<String> targets) {
      this.targets.clear();
      this.targets.addAll(targets);
      return this;
    }
    
    public Builder setFrom(final long from) {
      this.from = from;
      return this;
    }
    
    public Builder setUntil(final long until) {
      this.until = until;
      return this;
    }
    
    /**
     * Appends a value to a parameter.
     * @param key The non-null parameter name.
     * @param value The value.
     * @return The builder.
     */
    public Builder addParam(final String key, final String value) {
      List<String> values = params.get(key);
      if (values == null) {
        values = Lists.newArrayList();
        params.put(key, values);
      }
      values.add(value);
      return this;
    }
    
    public RenderRequest build() {
      return new RenderRequest(this);
    }
  }
}
