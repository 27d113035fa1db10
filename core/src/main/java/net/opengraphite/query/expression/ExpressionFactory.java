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

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;

import net.opengraphite.exceptions.UnknownFunctionException;
import net.opengraphite.utils.Config;

/**
 * A static class that stores the available functions by name. The map is
 * populated with the built-ins when the class loads and may be extended at
 * runtime via {@link #addFunction(String, Expression)}, in which case the 
 * last registration for a name wins.
 * @since 1.0
 */
public final class ExpressionFactory {
  private static final Logger LOG = 
      LoggerFactory.getLogger(ExpressionFactory.class);
  
  private static final Map<String, Expression> available_functions = 
      new ConcurrentHashMap<String, Expression>();
  
  /** Set once {@link #initialize(Config)} has applied a config. */
  private static volatile boolean configured;
  
  static {
    // per series
    available_functions.put("absolute", new Absolute());
    available_functions.put("scale", new Scale());
    available_functions.put("offset", new Offset());
    available_functions.put("pow", new Pow());
    available_functions.put("squareRoot", new SquareRoot());
    available_functions.put("invert", new Invert());
    available_functions.put("log", new Logarithm());
    available_functions.put("logarithm", new Logarithm());
    available_functions.put("derivative", 
        new Derivative(Derivative.Mode.DERIVATIVE));
    available_functions.put("nonNegativeDerivative", 
        new Derivative(Derivative.Mode.NON_NEGATIVE));
    available_functions.put("perSecond", 
        new Derivative(Derivative.Mode.PER_SECOND));
    available_functions.put("integral", new Integral());
    available_functions.put("keepLastValue", new KeepLastValue());
    available_functions.put("transformNull", new TransformNull());
    available_functions.put("alias", new Alias());
    available_functions.put("aliasByNode", new AliasByNode());
    
    // cross series
    available_functions.put("sumSeries", new AggregateSeries("sum"));
    available_functions.put("sum", new AggregateSeries("sum"));
    available_functions.put("averageSeries", new AggregateSeries("average"));
    available_functions.put("avg", new AggregateSeries("average"));
    available_functions.put("minSeries", new AggregateSeries("min"));
    available_functions.put("maxSeries", new AggregateSeries("max"));
    available_functions.put("multiplySeries", new AggregateSeries("multiply"));
    available_functions.put("diffSeries", new AggregateSeries("diff"));
    available_functions.put("rangeOfSeries", new AggregateSeries("range"));
    available_functions.put("countSeries", new AggregateSeries("count"));
    available_functions.put("stddevSeries", new AggregateSeries("stddev"));
    available_functions.put("aggregate", new AggregateSeries());
    available_functions.put("sumSeriesWithWildcards", 
        new AggregateWithWildcards("sum"));
    available_functions.put("averageSeriesWithWildcards", 
        new AggregateWithWildcards("average"));
    available_functions.put("multiplySeriesWithWildcards", 
        new AggregateWithWildcards("multiply"));
    available_functions.put("aggregateWithWildcards", 
        new AggregateWithWildcards());
    available_functions.put("groupByNode", new GroupByNode(false));
    available_functions.put("groupByNodes", new GroupByNode(true));
    available_functions.put("group", new Group());
    available_functions.put("divideSeries", new DivideSeries());
    
    // windows and buckets
    registerMovingWindows(0);
    available_functions.put("stdev", new Stdev());
    available_functions.put("percentileOfSeries", new PercentileOfSeries());
    available_functions.put("nPercentile", new NPercentile());
    available_functions.put("summarize", new Summarize());
    available_functions.put("consolidateBy", new ConsolidateBy());
    available_functions.put("holtWintersForecast", 
        new HoltWintersForecast(false));
    available_functions.put("holtWintersConfidenceBands", 
        new HoltWintersForecast(true));
    available_functions.put("timeShift", new TimeShift());
    available_functions.put("constantLine", new ConstantLine());
    
    // filters
    available_functions.put("highestMax", 
        new HighestLowest(HighestLowest.Statistic.MAX, true));
    available_functions.put("highestCurrent", 
        new HighestLowest(HighestLowest.Statistic.CURRENT, true));
    available_functions.put("highestAverage", 
        new HighestLowest(HighestLowest.Statistic.AVERAGE, true));
    available_functions.put("lowestCurrent", 
        new HighestLowest(HighestLowest.Statistic.CURRENT, false));
    available_functions.put("lowestAverage", 
        new HighestLowest(HighestLowest.Statistic.AVERAGE, false));
    available_functions.put("limit", new Limit());
    available_functions.put("removeEmptySeries", new RemoveEmptySeries());
  }
  
  /** Don't instantiate me! */
  private ExpressionFactory() { }
  
  /**
   * Applies the config to the registry the first time it's called. Later 
   * calls leave the registry alone so it stays read-only while serving.
   * @param config A non-null config.
   * @return True if the config was applied, false if the registry had 
   * already been configured.
   * @throws IllegalArgumentException if the config values were invalid.
   */
  public static synchronized boolean initialize(final Config config) {
    if (configured) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Function registry already configured, ignoring config "
            + config.configLocation());
      }
      return false;
    }
    addConfiguredFunctions(config);
    configured = true;
    LOG.info("Configured the function registry with " 
        + available_functions.size() + " functions");
    return true;
  }
  
  @VisibleForTesting
  static synchronized void resetConfigured() {
    configured = false;
  }
  
  /**
   * Re-registers the functions that take defaults from the config. Use 
   * {@link #initialize(Config)} at startup.
   * @param config A non-null config.
   */
  public static void addConfiguredFunctions(final Config config) {
    final double x_files_factor = 
        config.getDouble(Config.X_FILES_FACTOR_KEY);
    if (x_files_factor < 0 || x_files_factor > 1) {
      throw new IllegalArgumentException("The x-files factor must be "
          + "between 0 and 1: " + x_files_factor);
    }
    registerMovingWindows(x_files_factor);
  }
  
  /**
   * Add an expression to the map, replacing any function already stored 
   * under the name.
   * @param name The name of the expression
   * @param expr The expression object to store.
   * @throws IllegalArgumentException if the name is null or empty or the
   * function is null.
   */
  public static void addFunction(final String name, final Expression expr) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Missing function name");
    }
    if (expr == null) {
      throw new IllegalArgumentException("Function cannot be null");
    }
    final Expression extant = available_functions.put(name, expr);
    if (extant != null) {
      LOG.warn("Replaced function '" + name + "' " + extant.getClass() 
          + " with " + expr.getClass());
    }
  }
  
  /**
   * Returns the expression function given the name
   * @param function The name of the expression to use  
   * @return The expression when located
   * @throws UnknownFunctionException if the requested function hasn't
   * been stored in the map.
   */
  public static Expression getByName(final String function) {
    final Expression expression = getByNameOrNull(function);
    if (expression == null) {
      throw new UnknownFunctionException(function);
    }
    return expression;
  }
  
  /**
   * @param function The name of the function.
   * @return The function or null if no such function was registered.
   */
  public static Expression getByNameOrNull(final String function) {
    if (function == null) {
      return null;
    }
    return available_functions.get(function);
  }
  
  /** @return A sorted copy of the registered function names. */
  public static Set<String> names() {
    return new TreeSet<String>(available_functions.keySet());
  }
  
  private static void registerMovingWindows(final double x_files_factor) {
    available_functions.put("movingAverage", 
        new MovingWindow(MovingWindow.Statistic.AVERAGE, x_files_factor));
    available_functions.put("movingSum", 
        new MovingWindow(MovingWindow.Statistic.SUM, x_files_factor));
    available_functions.put("movingMin", 
        new MovingWindow(MovingWindow.Statistic.MIN, x_files_factor));
    available_functions.put("movingMax", 
        new MovingWindow(MovingWindow.Statistic.MAX, x_files_factor));
    available_functions.put("movingMedian", 
        new MovingWindow(MovingWindow.Statistic.MEDIAN, x_files_factor));
  }
}
