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

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.Maps;

import net.opengraphite.exceptions.IllegalDataException;
import net.opengraphite.exceptions.SeriesMismatchException;

/**
 * A single named series on a fixed time grid. The timestamp of sample 
 * {@code i} is {@code start + i * step} in seconds and the value and absent
 * arrays always share the same length. An absent sample keeps its slot so
 * indices keep lining up with timestamps.
 * <p>
 * Instances handed to or returned from a function are treated as immutable.
 * The mutators are only meant for the code that allocated the series via
 * {@link #newLike(MetricData)} or the builder, while it fills the arrays.
 * 
 * @since 1.0
 */
public class MetricData {
  
  /** Called for each index of two aligned series. */
  public static interface AlignedConsumer {
    public void accept(final int index, 
                       final double a, 
                       final boolean a_absent, 
                       final double b, 
                       final boolean b_absent);
  }
  
  /** The display name. */
  private final String name;
  
  /** The first timestamp in seconds. */
  private final long start;
  
  /** The end of the series in seconds. */
  private final long stop;
  
  /** The width of each sample in seconds. */
  private final long step;
  
  /** The values. */
  private final double[] values;
  
  /** Absent flags parallel to the values. */
  private final boolean[] absent;
  
  /** How many raw points fold into one rendered point. */
  private final int values_per_point;
  
  /** How to fold points. */
  private final ConsolidationFunction consolidation;
  
  /** Minimum ratio of present values for a consolidated point. */
  private final float x_files_factor;
  
  /** The expression that fetched or produced the series. */
  private final String path_expression;
  
  /** Tags, always including "name". */
  private final Map<String, String> tags;
  
  /** Optional display color. */
  private final String color;
  
  /** Optional display line style, e.g. "dashed". */
  private final String line_style;
  
  /**
   * Protected ctor from the builder.
   * @param builder A non-null builder.
   */
  protected MetricData(final Builder builder) {
    // empty names are valid, e.g. aliasByNode with out of range nodes
    if (builder.name == null) {
      throw new IllegalDataException("Name cannot be null.");
    }
    if (builder.step <= 0) {
      throw new IllegalDataException("Step must be greater than zero for " 
          + builder.name + ": " + builder.step);
    }
    if (builder.values == null) {
      throw new IllegalDataException("Values cannot be null for " 
          + builder.name);
    }
    if (builder.absent != null && 
        builder.absent.length != builder.values.length) {
      throw new IllegalDataException("Values and absent arrays differ in "
          + "length for " + builder.name + ": " + builder.values.length 
          + " vs " + builder.absent.length);
    }
    name = builder.name;
    start = builder.start;
    step = builder.step;
    values = builder.values;
    if (builder.absent == null) {
      absent = new boolean[values.length];
      for (int i = 0; i < values.length; i++) {
        absent[i] = Double.isNaN(values[i]);
      }
    } else {
      absent = builder.absent;
    }
    final long min_stop = values.length == 0 ? start : 
      start + (values.length - 1) * step;
    if (builder.stop == null) {
      stop = start + values.length * step;
    } else if (builder.stop < min_stop) {
      throw new IllegalDataException("Stop " + builder.stop 
          + " is before the last sample " + min_stop + " for " + name);
    } else {
      stop = builder.stop;
    }
    values_per_point = builder.values_per_point < 1 ? 1 : 
      builder.values_per_point;
    consolidation = builder.consolidation == null ? 
        ConsolidationFunction.AVERAGE : builder.consolidation;
    x_files_factor = builder.x_files_factor;
    path_expression = Strings.isNullOrEmpty(builder.path_expression) ? 
        name : builder.path_expression;
    tags = Maps.newHashMap();
    if (builder.tags != null) {
      tags.putAll(builder.tags);
    }
    if (!tags.containsKey("name")) {
      tags.put("name", name);
    }
    color = builder.color;
    line_style = builder.line_style;
  }
  
  /** @return The display name. */
  public String name() {
    return name;
  }
  
  /** @return The first timestamp in seconds. */
  public long start() {
    return start;
  }
  
  /** @return The end of the series in seconds. */
  public long stop() {
    return stop;
  }
  
  /** @return The step in seconds. */
  public long step() {
    return step;
  }
  
  /** @return The number of samples. */
  public int size() {
    return values.length;
  }
  
  /**
   * @param index A sample index.
   * @return The timestamp in seconds of the sample.
   */
  public long timestamp(final int index) {
    return start + index * step;
  }
  
  /**
   * @param index A sample index.
   * @return The value at the index or NaN if the sample was absent.
   */
  public double value(final int index) {
    return absent[index] ? Double.NaN : values[index];
  }
  
  /**
   * @param index A sample index.
   * @return Whether or not the sample at the index is absent.
   */
  public boolean isAbsent(final int index) {
    return absent[index];
  }
  
  /** @return A fresh copy of the values with absent samples set to NaN. */
  public double[] toArray() {
    final double[] copy = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      copy[i] = absent[i] ? Double.NaN : values[i];
    }
    return copy;
  }
  
  /** @return Whether or not every sample is absent. Empty series count. */
  public boolean isEmpty() {
    for (int i = 0; i < absent.length; i++) {
      if (!absent[i]) {
        return false;
      }
    }
    return true;
  }
  
  /**
   * Sets a present value. Only for the code that allocated the series.
   * @param index The sample index.
   * @param value The value. A NaN marks the sample absent.
   */
  public void setValue(final int index, final double value) {
    if (Double.isNaN(value)) {
      setAbsent(index);
      return;
    }
    values[index] = value;
    absent[index] = false;
  }
  
  /**
   * Marks a sample absent. Only for the code that allocated the series.
   * @param index The sample index.
   */
  public void setAbsent(final int index) {
    values[index] = Double.NaN;
    absent[index] = true;
  }
  
  /** @return The number of raw points per rendered point. */
  public int valuesPerPoint() {
    return values_per_point;
  }
  
  /** @return The consolidation function. */
  public ConsolidationFunction consolidation() {
    return consolidation;
  }
  
  /** @return The minimum ratio of present values for a consolidated point. */
  public float xFilesFactor() {
    return x_files_factor;
  }
  
  /** @return The expression that fetched or produced this series. */
  public String pathExpression() {
    return path_expression;
  }
  
  /** @return An unmodifiable view of the tags. */
  public Map<String, String> tags() {
    return Collections.unmodifiableMap(tags);
  }
  
  /** @return The display color, may be null. */
  public String color() {
    return color;
  }
  
  /** @return The display line style, may be null. */
  public String lineStyle() {
    return line_style;
  }
  
  /**
   * Folds {@link #valuesPerPoint()} samples into one using the consolidation
   * function. A trailing partial group is folded over what it has.
   * @return A new series or this one if the factor is 1.
   */
  public MetricData consolidated() {
    if (values_per_point <= 1) {
      return this;
    }
    final double[] raw = toArray();
    final int size = (raw.length + values_per_point - 1) / values_per_point;
    final double[] folded = new double[size];
    for (int i = 0; i < size; i++) {
      final int from = i * values_per_point;
      final int to = Math.min(raw.length, from + values_per_point);
      final int present = countPresent(raw, from, to);
      if (present == 0 || 
          (float) present / (to - from) < x_files_factor) {
        folded[i] = Double.NaN;
      } else {
        folded[i] = consolidation.reduce(raw, from, to);
      }
    }
    return toBuilder()
        .setStep(step * values_per_point)
        .setStop(null)
        .setValues(folded)
        .setAbsent(null)
        .setValuesPerPoint(1)
        .build();
  }
  
  /**
   * Returns a copy of this series with a new display name. Tags other than
   * "name" and display options are carried over.
   * @param new_name The non-null new name.
   * @return A new series.
   */
  public MetricData withName(final String new_name) {
    final Map<String, String> new_tags = Maps.newHashMap(tags);
    new_tags.put("name", new_name);
    return toBuilder()
        .setName(new_name)
        .setPathExpression(new_name)
        .setValues(Arrays.copyOf(values, values.length))
        .setAbsent(Arrays.copyOf(absent, absent.length))
        .setTags(new_tags)
        .build();
  }
  
  /** @return A builder populated with this series' fields, sharing arrays. */
  public Builder toBuilder() {
    return newBuilder()
        .setName(name)
        .setStart(start)
        .setStop(stop)
        .setStep(step)
        .setValues(values)
        .setAbsent(absent)
        .setValuesPerPoint(values_per_point)
        .setConsolidation(consolidation)
        .setXFilesFactor(x_files_factor)
        .setPathExpression(path_expression)
        .setTags(tags)
        .setColor(color)
        .setLineStyle(line_style);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("name=")
        .append(name)
        .append(", start=")
        .append(start)
        .append(", stop=")
        .append(stop)
        .append(", step=")
        .append(step)
        .append(", values=")
        .append(Arrays.toString(toArray()))
        .toString();
  }
  
  /**
   * Allocates an output series with the same grid, name and metadata as the 
   * source but zeroed values and no absent samples.
   * @param source A non-null source series.
   * @return A new series to fill.
   */
  public static MetricData newLike(final MetricData source) {
    return newLike(source, source.name);
  }
  
  /**
   * Allocates an output series with the same grid and metadata as the 
   * source but a new name, zeroed values and no absent samples.
   * @param source A non-null source series.
   * @param name The non-null name for the new series.
   * @return A new series to fill.
   */
  public static MetricData newLike(final MetricData source, final String name) {
    final Map<String, String> new_tags = Maps.newHashMap(source.tags);
    new_tags.put("name", name);
    return source.toBuilder()
        .setName(name)
        .setPathExpression(name)
        .setValues(new double[source.values.length])
        .setAbsent(new boolean[source.values.length])
        .setTags(new_tags)
        .build();
  }
  
  /**
   * Walks two series index by index. 
   * @param a The first non-null series.
   * @param b The second non-null series.
   * @param consumer The non-null consumer called for each index.
   * @throws SeriesMismatchException if the series differ in step or length.
   */
  public static void forEachAligned(final MetricData a, 
                                    final MetricData b, 
                                    final AlignedConsumer consumer) {
    if (a.step != b.step) {
      throw new SeriesMismatchException("Series " + a.name + " and " 
          + b.name + " have different steps: " + a.step + " vs " + b.step);
    }
    if (a.values.length != b.values.length) {
      throw new SeriesMismatchException("Series " + a.name + " and " 
          + b.name + " have different lengths: " + a.values.length 
          + " vs " + b.values.length);
    }
    for (int i = 0; i < a.values.length; i++) {
      consumer.accept(i, a.values[i], a.absent[i], b.values[i], b.absent[i]);
    }
  }
  
  private static int countPresent(final double[] values, 
                                  final int from, 
                                  final int to) {
    int present = 0;
    for (int i = from; i < to; i++) {
      if (!Double.isNaN(values[i])) {
        present++;
      }
    }
    return present;
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /** Builder for series. The value array is used as is, not copied. */
  public static class Builder {
    private String name;
    private long start;
    private Long stop;
    private long step;
    private double[] values;
    private boolean[] absent;
    private int values_per_point = 1;
    private ConsolidationFunction consolidation;
    private float x_files_factor;
    private String path_expression;
    private Map<String, String> tags;
    private String color;
    private String line_style;
    
    public Builder setName(final String name) {
      this.name = name;
      return this;
    }
    
    public Builder setStart(final long start) {
      this.start = start;
      return this;
    }
    
    /**
     * @param stop An optional stop time. When null it's computed as 
     * {@code start + size * step}.
     * @return The builder.
     */
    public Builder setStop(final Long stop) {
      this.stop = stop;
      return this;
    }
    
    public Builder setStep(final long step) {
      this.step = step;
      return this;
    }
    
    /**
     * @param values The values. When no absent array is given, NaNs mark 
     * absent samples.
     * @return The builder.
     */
    public Builder setValues(final double[] values) {
      this.values = values;
      return this;
    }
    
    public Builder setAbsent(final boolean[] absent) {
      this.absent = absent;
      return this;
    }
    
    public Builder setValuesPerPoint(final int values_per_point) {
      this.values_per_point = values_per_point;
      return this;
    }
    
    public Builder setConsolidation(final ConsolidationFunction consolidation) {
      this.consolidation = consolidation;
      return this;
    }
    
    public Builder setXFilesFactor(final float x_files_factor) {
      this.x_files_factor = x_files_factor;
      return this;
    }
    
    public Builder setPathExpression(final String path_expression) {
      this.path_expression = path_expression;
      return this;
    }
    
    public Builder setTags(final Map<String, String> tags) {
      this.tags = tags;
      return this;
    }
    
    public Builder addTag(final String key, final String value) {
      if (tags == null) {
        tags = Maps.newHashMap();
      } else {
        tags = Maps.newHashMap(tags);
      }
      tags.put(key, value);
      return this;
    }
    
    public Builder setColor(final String color) {
      this.color = color;
      return this;
    }
    
    public Builder setLineStyle(final String line_style) {
      this.line_style = line_style;
      return this;
    }
    
    public MetricData build() {
      return new MetricData(this);
    }
  }
}
