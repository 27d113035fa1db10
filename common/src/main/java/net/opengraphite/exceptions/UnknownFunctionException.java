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
 * Thrown when an expression calls a function that hasn't been registered.
 * 
 * @since 1.0
 */
public class UnknownFunctionException extends QueryExecutionException {
  private static final long serialVersionUID = -1920337245608342193L;

  /** The name of the missing function. */
  private final String function;
  
  /**
   * Default ctor.
   * @param function The name of the function that wasn't found.
   */
  public UnknownFunctionException(final String function) {
    super("Unknown function: '" + function + "'", 400);
    this.function = function;
  }
  
  /** @return The name of the function that wasn't found. */
  public String getFunction() {
    return function;
  }
}
