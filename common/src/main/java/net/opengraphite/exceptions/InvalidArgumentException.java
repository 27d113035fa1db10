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
 * Thrown when a function was handed arguments it can't work with: wrong type,
 * wrong arity, a wildcard where one series is required, etc.
 * 
 * @since 1.0
 */
public class InvalidArgumentException extends QueryExecutionException {
  private static final long serialVersionUID = 7358922086414420932L;

  /** Classification of the failure. */
  public static enum Reason {
    MISSING_ARGUMENT,
    BAD_TYPE,
    MISSING_TIMESERIES,
    SERIES_DOES_NOT_EXIST,
    TOO_MANY_SERIES,
    UNKNOWN_TIME_UNITS,
    INVALID_VALUE
  }
  
  /** The reason. */
  private final Reason reason;
  
  /**
   * Default ctor.
   * @param reason A non-null reason.
   * @param msg A descriptive message.
   */
  public InvalidArgumentException(final Reason reason, final String msg) {
    super(msg, 400);
    this.reason = reason;
  }
  
  /**
   * Ctor with a cause.
   * @param reason A non-null reason.
   * @param msg A descriptive message.
   * @param e The cause.
   */
  public InvalidArgumentException(final Reason reason, 
                                  final String msg, 
                                  final Throwable e) {
    super(msg, 400, e);
    this.reason = reason;
  }
  
  /** @return The reason for the failure. */
  public Reason getReason() {
    return reason;
  }
}
