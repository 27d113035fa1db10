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
package net.opengraphite.exceptions;

/**
 * Thrown when an expression string can't be parsed. The unparsed remainder of
 * the input is kept so users can see where the parser gave up.
 * 
 * @since 1.0
 */
public class ExpressionSyntaxException extends QueryExecutionException {
  private static final long serialVersionUID = -4012266781034558217L;

  /** What went wrong. */
  public static enum Reason {
    MISSING_EXPRESSION("missing expression"),
    MISSING_COMMA("missing comma"),
    MISSING_PAREN("missing closing parenthesis"),
    MISSING_QUOTE("missing quote"),
    UNEXPECTED_CHARACTER("unexpected character");
    
    private final String description;
    
    Reason(final String description) {
      this.description = description;
    }
    
    public String description() {
      return description;
    }
  }
  
  /** The reason. */
  private final Reason reason;
  
  /** The remaining, unparsed input. */
  private final String remainder;
  
  /**
   * Default ctor.
   * @param reason A non-null reason.
   * @param remainder The unparsed input, may be empty.
   */
  public ExpressionSyntaxException(final Reason reason, final String remainder) {
    super(reason.description() + (remainder == null || remainder.isEmpty() ? 
        "" : " at '" + remainder + "'"), 400);
    this.reason = reason;
    this.remainder = remainder == null ? "" : remainder;
  }
  
  /** @return The reason for the failure. */
  public Reason getReason() {
    return reason;
  }
  
  /** @return The unparsed remainder of the input. */
  public String getRemainder() {
    return remainder;
  }
}
