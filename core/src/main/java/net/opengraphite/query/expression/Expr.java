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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.Lists;

import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;
import net.opengraphite.query.MetricRequest;
import net.opengraphite.utils.DateTime;

/**
 * A node of a parsed expression. Names carry a metric path in 
 * {@link #target()}, function calls carry the function name there along with
 * positional and named arguments and the raw argument text used when 
 * naming output series. Nodes are immutable once parsed.
 * <p>
 * The argument accessors throw {@link InvalidArgumentException} when an 
 * argument is missing or has the wrong type.
 * 
 * @since 1.0
 */
public class Expr {
  
  /** The type of node. */
  private final ExprType type;
  
  /** The metric path or function name. */
  private final String target;
  
  /** The numeric value for constants. */
  private final double value;
  
  /** The raw text of constants, the contents of strings or true/false. */
  private final String value_string;
  
  /** Positional arguments for functions. */
  private final List<Expr> args;
  
  /** Named arguments for functions. */
  private final Map<String, Expr> named_args;
  
  /** The argument text for functions. */
  private final String raw_args;
  
  /**
   * Package private ctor used by the parser.
   */
  Expr(final ExprType type, 
       final String target, 
       final double value, 
       final String value_string, 
       final List<Expr> args, 
       final Map<String, Expr> named_args, 
       final String raw_args) {
    this.type = type;
    this.target = target;
    this.value = value;
    this.value_string = value_string;
    this.args = args == null ? Collections.<Expr>emptyList() : 
      Collections.unmodifiableList(args);
    this.named_args = named_args == null ? 
        Collections.<String, Expr>emptyMap() : 
          Collections.unmodifiableMap(named_args);
    this.raw_args = raw_args == null ? "" : raw_args;
  }
  
  /**
   * @param name A non-null metric path.
   * @return A name node.
   */
  public static Expr name(final String name) {
    return new Expr(ExprType.NAME, name, 0, null, null, null, null);
  }
  
  /**
   * @param value The value.
   * @param raw The text the value was parsed from.
   * @return A constant node.
   */
  public static Expr constant(final double value, final String raw) {
    return new Expr(ExprType.CONST, null, value, raw, null, null, null);
  }
  
  /**
   * @param value The non-null unquoted value.
   * @return A string node.
   */
  public static Expr string(final String value) {
    return new Expr(ExprType.STRING, null, 0, value, null, null, null);
  }
  
  /**
   * @param value The value.
   * @return A boolean node.
   */
  public static Expr bool(final boolean value) {
    final String str = Boolean.toString(value);
    return new Expr(ExprType.BOOL, str, value ? 1 : 0, str, null, null, null);
  }
  
  /**
   * @param name The non-null function name.
   * @param args The positional arguments, may be null.
   * @param named_args The named arguments, may be null.
   * @param raw_args The argument text, may be null.
   * @return A function node.
   */
  public static Expr func(final String name, 
                          final List<Expr> args, 
                          final Map<String, Expr> named_args, 
                          final String raw_args) {
    return new Expr(ExprType.FUNC, name, 0, null, args, named_args, raw_args);
  }
  
  /** @return The node type. */
  public ExprType type() {
    return type;
  }
  
  public boolean isName() {
    return type == ExprType.NAME;
  }
  
  public boolean isFunc() {
    return type == ExprType.FUNC;
  }
  
  public boolean isConst() {
    return type == ExprType.CONST;
  }
  
  public boolean isString() {
    return type == ExprType.STRING;
  }
  
  public boolean isBool() {
    return type == ExprType.BOOL;
  }
  
  /** @return The metric path for names or the function name for calls. */
  public String target() {
    return target;
  }
  
  /** @return The numeric value of a constant. */
  public double value() {
    return value;
  }
  
  /** @return The raw constant text, string contents or "true"/"false". */
  public String valueString() {
    return value_string;
  }
  
  /** @return The unmodifiable positional arguments. */
  public List<Expr> args() {
    return args;
  }
  
  /** @return The unmodifiable named arguments. */
  public Map<String, Expr> namedArgs() {
    return named_args;
  }
  
  /** @return The argument text of a function call. */
  public String rawArgs() {
    return raw_args;
  }
  
  /** @return The number of positional arguments. */
  public int argsLen() {
    return args.size();
  }
  
  /**
   * @param index The index of a positional argument.
   * @return The argument.
   * @throws InvalidArgumentException if the argument is missing.
   */
  public Expr arg(final int index) {
    if (index < 0 || index >= args.size()) {
      throw new InvalidArgumentException(Reason.MISSING_ARGUMENT, 
          "Missing argument " + index + " for " + target);
    }
    return args.get(index);
  }
  
  /**
   * @param name The argument name.
   * @return The named argument or null if not present.
   */
  public Expr namedArg(final String name) {
    return named_args.get(name);
  }
  
  /**
   * @param index The index of the argument.
   * @return The unquoted string argument.
   * @throws InvalidArgumentException if the argument is missing or not a 
   * string.
   */
  public String getStringArg(final int index) {
    return asString(arg(index));
  }
  
  /**
   * @param index The index of the argument.
   * @param default_value A default when the argument is missing.
   * @return The argument or the default.
   */
  public String getStringArgDefault(final int index, 
                                    final String default_value) {
    if (index >= args.size()) {
      return default_value;
    }
    return getStringArg(index);
  }
  
  /**
   * Looks up a string argument by name, then by position.
   * @param name The argument name.
   * @param index The fallback position.
   * @param default_value A default when neither is present.
   * @return The argument or the default.
   */
  public String getStringNamedOrPosArgDefault(final String name, 
                                              final int index, 
                                              final String default_value) {
    final Expr named = named_args.get(name);
    if (named != null) {
      return asString(named);
    }
    return getStringArgDefault(index, default_value);
  }
  
  /**
   * @param index The index of the argument.
   * @return The numeric argument.
   * @throws InvalidArgumentException if the argument is missing or not a 
   * constant.
   */
  public double getFloatArg(final int index) {
    return asFloat(arg(index));
  }
  
  /**
   * @param index The index of the argument.
   * @param default_value A default when the argument is missing.
   * @return The argument or the default.
   */
  public double getFloatArgDefault(final int index, 
                                   final double default_value) {
    if (index >= args.size()) {
      return default_value;
    }
    return getFloatArg(index);
  }
  
  /**
   * Looks up a numeric argument by name, then by position.
   * @param name The argument name.
   * @param index The fallback position.
   * @param default_value A default when neither is present.
   * @return The argument or the default.
   */
  public double getFloatNamedOrPosArgDefault(final String name, 
                                             final int index, 
                                             final double default_value) {
    final Expr named = named_args.get(name);
    if (named != null) {
      return asFloat(named);
    }
    return getFloatArgDefault(index, default_value);
  }
  
  /**
   * @param index The index of the argument.
   * @return The numeric argument truncated to an integer.
   * @throws InvalidArgumentException if the argument is missing or not a 
   * constant.
   */
  public int getIntArg(final int index) {
    return (int) getFloatArg(index);
  }
  
  /**
   * @param index The index of the argument.
   * @param default_value A default when the argument is missing.
   * @return The argument or the default.
   */
  public int getIntArgDefault(final int index, final int default_value) {
    if (index >= args.size()) {
      return default_value;
    }
    return getIntArg(index);
  }
  
  /**
   * Looks up an integer argument by name, then by position.
   * @param name The argument name.
   * @param index The fallback position.
   * @param default_value A default when neither is present.
   * @return The argument or the default.
   */
  public int getIntNamedOrPosArgDefault(final String name, 
                                        final int index, 
                                        final int default_value) {
    final Expr named = named_args.get(name);
    if (named != null) {
      return (int) asFloat(named);
    }
    return getIntArgDefault(index, default_value);
  }
  
  /**
   * @param from The index of the first argument to read.
   * @return Every positional argument from the index on as integers. May be
   * empty.
   * @throws InvalidArgumentException if any argument is not a constant.
   */
  public List<Integer> getIntArgs(final int from) {
    final List<Integer> ints = Lists.newArrayList();
    for (int i = from; i < args.size(); i++) {
      ints.add(getIntArg(i));
    }
    return ints;
  }
  
  /**
   * Looks up a boolean argument by name, then by position. Accepts boolean
   * literals and the strings "true" and "false".
   * @param name The argument name.
   * @param index The fallback position.
   * @param default_value A default when neither is present.
   * @return The argument or the default.
   */
  public boolean getBoolNamedOrPosArgDefault(final String name, 
                                             final int index, 
                                             final boolean default_value) {
    final Expr named = named_args.get(name);
    if (named != null) {
      return asBool(named);
    }
    if (index >= args.size()) {
      return default_value;
    }
    return asBool(args.get(index));
  }
  
  /**
   * Parses an interval string argument such as '1h' into seconds.
   * @param index The index of the argument.
   * @param default_sign The sign to use when the interval has none.
   * @return The interval in seconds.
   * @throws InvalidArgumentException if the argument is missing, not a 
   * string or not a valid interval.
   */
  public long getIntervalArg(final int index, final int default_sign) {
    return DateTime.parseInterval(getStringArg(index), default_sign);
  }
  
  /**
   * Looks up an interval argument by name, then by position.
   * @param name The argument name.
   * @param index The fallback position.
   * @param default_sign The sign to use when the interval has none.
   * @param default_value A default in seconds when neither is present.
   * @return The interval in seconds.
   */
  public long getIntervalNamedOrPosArgDefault(final String name, 
                                              final int index, 
                                              final int default_sign, 
                                              final long default_value) {
    final Expr named = named_args.get(name);
    if (named != null) {
      return DateTime.parseInterval(asString(named), default_sign);
    }
    if (index >= args.size()) {
      return default_value;
    }
    return getIntervalArg(index, default_sign);
  }
  
  /**
   * Collects the de-duplicated metric requests this expression needs to be
   * evaluated over the range, in the order they appear. Functions may widen
   * the range for their arguments, e.g. to bootstrap a forecast.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @return A non-null, possibly empty, list of requests.
   */
  public List<MetricRequest> metrics(final long from, final long until) {
    switch (type) {
    case NAME:
      return Lists.newArrayList(new MetricRequest(target, from, until));
    case FUNC:
      final Expression function = ExpressionFactory.getByNameOrNull(target);
      final List<MetricRequest> requests = function == null ? 
          Expression.collectMetrics(this, from, until) : 
            function.metrics(this, from, until);
      final Set<MetricRequest> unique = 
          new LinkedHashSet<MetricRequest>(requests);
      return new ArrayList<MetricRequest>(unique);
    default:
      return Lists.newArrayList();
    }
  }
  
  /**
   * Builds an output name by wrapping the series name in this function call
   * along with the remaining positional and named arguments, e.g. 
   * {@code scale(a.b.c,2)}.
   * @param series_name The name of the series in the first argument.
   * @return The formatted name.
   */
  public String nameWith(final String series_name) {
    final StringBuilder buf = new StringBuilder()
        .append(target)
        .append("(")
        .append(series_name);
    for (int i = 1; i < args.size(); i++) {
      buf.append(",")
         .append(args.get(i).toString());
    }
    for (final Map.Entry<String, Expr> entry : named_args.entrySet()) {
      buf.append(",")
         .append(entry.getKey())
         .append("=")
         .append(entry.getValue().toString());
    }
    return buf.append(")").toString();
  }
  
  /**
   * Returns a copy of this function call with the given expression inserted
   * as the first argument, used for pipes.
   * @param first The non-null expression to insert.
   * @return A new function node.
   */
  Expr withFirstArg(final Expr first) {
    final List<Expr> new_args = new ArrayList<Expr>(args.size() + 1);
    new_args.add(first);
    new_args.addAll(args);
    final String new_raw = raw_args.isEmpty() ? first.toString() : 
      first.toString() + "," + raw_args;
    return func(target, new_args, named_args.isEmpty() ? null : 
      new LinkedHashMap<String, Expr>(named_args), new_raw);
  }
  
  @Override
  public String toString() {
    switch (type) {
    case FUNC:
      return target + "(" + raw_args + ")";
    case CONST:
    case BOOL:
      return value_string;
    case STRING:
      return "'" + value_string.replace("\\", "\\\\").replace("'", "\\'") 
          + "'";
    default:
      return target;
    }
  }
  
  private String asString(final Expr arg) {
    if (arg.type != ExprType.STRING) {
      throw new InvalidArgumentException(Reason.BAD_TYPE, 
          "Expected a string for " + target + " but got: " + arg);
    }
    return arg.value_string;
  }
  
  private double asFloat(final Expr arg) {
    if (arg.type != ExprType.CONST) {
      throw new InvalidArgumentException(Reason.BAD_TYPE, 
          "Expected a number for " + target + " but got: " + arg);
    }
    return arg.value;
  }
  
  private boolean asBool(final Expr arg) {
    if (arg.type == ExprType.BOOL) {
      return arg.value != 0;
    }
    if (arg.type == ExprType.STRING) {
      if (arg.value_string.equalsIgnoreCase("true")) {
        return true;
      }
      if (arg.value_string.equalsIgnoreCase("false")) {
        return false;
      }
    }
    throw new InvalidArgumentException(Reason.BAD_TYPE, 
        "Expected a boolean for " + target + " but got: " + arg);
  }
}
