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

import java.util.NoSuchElementException;

/**
 * A cursor over the characters of a Graphite style expression. Call 
 * {@link #isEOF()} before reading, otherwise the methods will throw a 
 * NoSuchElementException.
 * 
 * @since 1.0
 */
public class ExpressionReader {
  /** The character array to parse */
  protected final char[] chars;

  /** The current index in the character array */
  private int mark = 0;

  /**
   * Default ctor 
   * @param chars The characters to parse
   */
  public ExpressionReader(final char[] chars) {
    if (chars == null) {
      throw new IllegalArgumentException("Character set cannot be null");
    }
    this.chars = chars;
  }

  /** @return the current index */
  public int getMark() {
    return mark;
  }
  
  /** @param mark The index to rewind or advance to. */
  public void setMark(final int mark) {
    if (mark < 0 || mark > chars.length) {
      throw new IllegalArgumentException("Mark " + mark 
          + " is out of bounds " + chars.length);
    }
    this.mark = mark;
  }

  /** @return the current character without advancing the index */
  public char peek() {
    if (isEOF()) {
      throw new NoSuchElementException("Index " + mark + " is out of bounds " 
          + chars.length);
    }
    return chars[mark];
  }
  
  /** @return the character after the current one or 0 if at the end. */
  public char peekNext() {
    return mark + 1 < chars.length ? chars[mark + 1] : 0;
  }

  /** @return the current character and advances the index */
  public char next() {
    if (isEOF()) {
      throw new NoSuchElementException("Index " + mark + " is out of bounds " 
          + chars.length);
    }
    return chars[mark++];
  }

  /**
   * Checks to see if the next character matches the parameter
   * @param c The character to check for
   * @return True if they match, false if at the end or they don't match.
   */
  public boolean isNextChar(final char c) {
    return !isEOF() && peek() == c;
  }

  /** @return Whether or not the index is at the end of the character array */
  public boolean isEOF() {
    return mark >= chars.length;
  }

  /** Increments the mark over white spaces */
  public void skipWhitespaces() {
    while (mark < chars.length && Character.isWhitespace(chars[mark])) {
      mark++;
    }
  }
  
  /**
   * Reads the characters that may make up a numeric constant: digits, 
   * signs, decimal points and exponents. Validation is up to the caller.
   * @return The possibly empty token.
   */
  public String readConstant() {
    final int start = mark;
    while (mark < chars.length) {
      final char c = chars[mark];
      if (Character.isDigit(c) || c == '.' || c == '+' || c == '-' || 
          c == 'e' || c == 'E') {
        mark++;
      } else {
        break;
      }
    }
    return new String(chars, start, mark - start);
  }
  
  /**
   * Reads a string quoted with the current character, either a single or 
   * double quote. The quotes are not returned.
   * @return The contents of the string or null if the closing quote was 
   * missing, in which case the mark is left at the opening quote.
   */
  public String readQuoted() {
    final int start = mark;
    final char quote = next();
    final int content = mark;
    while (mark < chars.length && chars[mark] != quote) {
      mark++;
    }
    if (mark >= chars.length) {
      mark = start;
      return null;
    }
    final String value = new String(chars, content, mark - content);
    mark++;
    return value;
  }
  
  /**
   * Reads a metric name. Commas inside brace groups, e.g. 
   * {@code host.{a,b}.cpu}, are kept. A backslash includes the following 
   * character verbatim. The name ends at a comma or closing brace at depth 
   * zero, a paren, a quote, white space or an equals sign that starts a 
   * named argument value.
   * @return The possibly empty name.
   */
  public String readName() {
    final StringBuilder buf = new StringBuilder();
    int braces = 0;
    while (mark < chars.length) {
      final char c = chars[mark];
      if (isNameChar(c)) {
        buf.append(c);
        mark++;
        continue;
      }
      
      if (c == '\\') {
        if (mark + 1 >= chars.length) {
          mark++;
          break;
        }
        buf.append(chars[mark + 1]);
        mark += 2;
        continue;
      }
      
      if (c == '{') {
        braces++;
      } else if (c == '}') {
        if (braces == 0) {
          break;
        }
        braces--;
      } else if (c == ',') {
        if (braces == 0) {
          break;
        }
      } else if (c == '=') {
        // trailing equals signs belong to the name, e.g. base64 paths
        final char after = peekNext();
        if (!(after == 0 || after == '=' || after == ',' || after == ')')) {
          break;
        }
      } else if (c < 128 || !Character.isLetterOrDigit(c)) {
        break;
      }
      buf.append(c);
      mark++;
    }
    return buf.toString();
  }
  
  /** @return The unread remainder of the input. */
  public String remainder() {
    return isEOF() ? "" : new String(chars, mark, chars.length - mark);
  }
  
  /**
   * @param start A start index.
   * @return The input from the start index to the current mark.
   */
  public String substring(final int start) {
    return new String(chars, start, mark - start);
  }

  @Override
  public String toString() {
    // make a copy
    return new String(chars);
  }
  
  /**
   * @param c The character to check.
   * @return Whether or not the character is allowed in a metric name outside
   * of brace groups.
   */
  public static boolean isNameChar(final char c) {
    return (c >= 'a' && c <= 'z') || 
           (c >= 'A' && c <= 'Z') || 
           (c >= '0' && c <= '9') || 
           c == '.' || c == '_' || c == '-' || c == '*' || c == '?' || 
           c == ':' || c == '[' || c == ']' || c == '^' || c == '$' || 
           c == '<' || c == '>' || c == '&' || c == '#' || c == '/' || 
           c == '%' || c == '@';
  }

}
