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
 * High level exception that should be thrown by any portion of the query 
 * pipeline to bubble up to the end user. Carries an HTTP style status code.
 * 
 * @since 1.0
 */
public class QueryExecutionException extends RuntimeException {
  private static final long serialVersionUID = 2417380459147261051L;

  /** A status code associated with the exception, e.g. 400 for a bad 
   * expression. */
  protected final int status_code;
  
  /**
   * Default ctor that sets a message describing this exception.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   */
  public QueryExecutionException(final String msg, final int status_code) {
    super(msg);
    this.status_code = status_code;
  }
  
  /**
   * Ctor setting a message, status code and cause.
   * @param msg A non-null message to be given.
   * @param status_code A status code reflecting the error state.
   * @param e The original exception that caused this to be thrown.
   */
  public QueryExecutionException(final String msg, 
                                 final int status_code,
                                 final Throwable e) {
    super(msg, e);
    this.status_code = status_code;
  }
  
  /** @return The status code, e.g. HTTP code. */
  public int getStatusCode() {
    return status_code;
  }
}
