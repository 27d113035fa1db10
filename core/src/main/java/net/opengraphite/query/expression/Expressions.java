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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;

import net.opengraphite.exceptions.ExpressionSyntaxException;
import net.opengraphite.exceptions.ExpressionSyntaxException.Reason;
import net.opengraphite.exceptions.InvalidArgumentException;

/**
 * Static class with helpers to parse Graphite style expressions such as 
 * {@code scale(sumSeries(host.*.load),0.5)} into {@link Expr} trees.
 * <p>
 * Grammar:
 * <pre>
 * expr    := (const | string | bool | call | name) ('|' call)*
 * call    := name '(' [arg (',' arg)*] ')'
 * arg     := expr | name '=' (const | string | bool | name)
 * </pre>
 * Parsing is pure and thread safe.
 * 
 * @since 1.0
 */
public final class Expressions {
  
  /** Tag queries are kept as opaque names. */
  private static final String SERIES_BY_TAG = "seriesByTag";
  
  /** Don't instantiate me! */
  private Expressions() { }

  /**
   * Parses a single expression. The entire input must be consumed.
   * @param expression A non-null and non-empty expression.
   * @return The root of the parsed tree.
   * @throws ExpressionSyntaxException if the expression was empty or 
   * malformed.
   * @throws InvalidArgumentException if a named argument had a function as
   * its value.
   */
  public static Expr parse(final String expression) {
    if (Strings.isNullOrEmpty(expression)) {
      throw new ExpressionSyntaxException(Reason.MISSING_EXPRESSION, "");
    }
    final ExpressionReader reader = 
        new ExpressionReader(expression.toCharArray());
    final Expr root = parseExpr(reader);
    reader.skipWhitespaces();
    if (!reader.isEOF()) {
      throw new ExpressionSyntaxException(Reason.UNEXPECTED_CHARACTER, 
          reader.remainder());
    }
    return root;
  }
  
  /**
   * Parses a list of expressions. Fails on the first bad expression.
   * @param expressions A non-null list of expressions.
   * @return The parsed trees in the same order.
   * @throws ExpressionSyntaxException if an expression was malformed.
   */
  public static List<Expr> parseExpressions(final List<String> expressions) {
    final List<Expr> trees = new ArrayList<Expr>(expressions.size());
    for (final String expression : expressions) {
      trees.add(parse(expression));
    }
    return trees;
  }
  
  /**
   * Parses an expression followed by any number of pipes.
   * @param reader The non-null reader.
   * @return The expression.
   */
  static Expr parseExpr(final ExpressionReader reader) {
    Expr expr = parseExprWithoutPipe(reader);
    while (true) {
      reader.skipWhitespaces();
      if (!reader.isNextChar('|')) {
        return expr;
      }
      reader.next();
      final Expr wrapper = parseExprWithoutPipe(reader);
      if (!wrapper.isFunc()) {
        throw new ExpressionSyntaxException(Reason.UNEXPECTED_CHARACTER, 
            reader.remainder());
      }
      expr = wrapper.withFirstArg(expr);
    }
  }
  
  private static Expr parseExprWithoutPipe(final ExpressionReader reader) {
    reader.skipWhitespaces();
    if (reader.isEOF()) {
      throw new ExpressionSyntaxException(Reason.MISSING_EXPRESSION, "");
    }
    
    final char c = reader.peek();
    if (Character.isDigit(c) || c == '-' || c == '+') {
      final Expr constant = parseConstant(reader);
      if (constant != null) {
        return constant;
      }
    }
    
    if (c == '\'' || c == '"') {
      final String remainder = reader.remainder();
      final String value = reader.readQuoted();
      if (value == null) {
        throw new ExpressionSyntaxException(Reason.MISSING_QUOTE, remainder);
      }
      return Expr.string(value);
    }
    
    final String name = reader.readName();
    if (name.isEmpty()) {
      throw new ExpressionSyntaxException(Reason.UNEXPECTED_CHARACTER, 
          reader.remainder());
    }
    
    if (name.equalsIgnoreCase("true") || name.equalsIgnoreCase("false")) {
      return Expr.bool(Boolean.parseBoolean(name));
    }
    
    if (reader.isNextChar('(')) {
      return parseCall(reader, name);
    }
    return Expr.name(name);
  }
  
  /**
   * Attempts to read a constant. A token that continues with a letter, like
   * {@code 1min.load} or {@code -foo}, is a name and we rewind.
   * @return The constant or null if the token was not a number.
   */
  private static Expr parseConstant(final ExpressionReader reader) {
    final int start = reader.getMark();
    final String token = reader.readConstant();
    if (!reader.isEOF() && Character.isLetter(reader.peek())) {
      reader.setMark(start);
      return null;
    }
    try {
      return Expr.constant(Double.parseDouble(token), token);
    } catch (NumberFormatException e) {
      // e.g. an IP address like 10.0.0.1 used as a path
      reader.setMark(start);
      return null;
    }
  }
  
  private static Expr parseCall(final ExpressionReader reader, 
                                final String name) {
    reader.next(); // (
    final List<Expr> args = new ArrayList<Expr>();
    Map<String, Expr> named_args = null;
    final StringBuilder raw = new StringBuilder();
    
    reader.skipWhitespaces();
    if (reader.isEOF()) {
      throw new ExpressionSyntaxException(Reason.MISSING_PAREN, "");
    }
    if (reader.isNextChar(')')) {
      reader.next();
      return finishCall(name, args, named_args, raw.toString());
    }
    
    while (true) {
      reader.skipWhitespaces();
      final int arg_start = reader.getMark();
      final Expr arg = parseExpr(reader);
      if (reader.isEOF()) {
        throw new ExpressionSyntaxException(Reason.MISSING_COMMA, "");
      }
      
      if (raw.length() > 0) {
        raw.append(",");
      }
      if (arg.isName() && reader.isNextChar('=')) {
        reader.next();
        final Expr value = parseExpr(reader);
        if (reader.isEOF()) {
          throw new ExpressionSyntaxException(Reason.MISSING_COMMA, "");
        }
        if (value.isFunc()) {
          throw new InvalidArgumentException(
              InvalidArgumentException.Reason.BAD_TYPE, 
              "Named argument '" + arg.target() + "' of " + name 
              + " must be a constant, string, boolean or name: " + value);
        }
        if (named_args == null) {
          named_args = new LinkedHashMap<String, Expr>();
        }
        named_args.put(arg.target(), value);
        raw.append(reader.substring(arg_start).trim());
      } else {
        args.add(arg);
        raw.append(arg.isFunc() ? arg.toString() : 
          reader.substring(arg_start).trim());
      }
      
      final char c = reader.next();
      if (c == ')') {
        return finishCall(name, args, named_args, raw.toString());
      }
      if (c != ',') {
        reader.setMark(reader.getMark() - 1);
        throw new ExpressionSyntaxException(Reason.UNEXPECTED_CHARACTER, 
            reader.remainder());
      }
    }
  }
  
  private static Expr finishCall(final String name, 
                                 final List<Expr> args, 
                                 final Map<String, Expr> named_args, 
                                 final String raw) {
    if (name.equals(SERIES_BY_TAG)) {
      return Expr.name(name + "(" + raw + ")");
    }
    return Expr.func(name, args, named_args, raw);
  }
}
