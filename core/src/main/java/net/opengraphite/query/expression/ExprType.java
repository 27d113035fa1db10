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

/**
 * The kinds of nodes in a parsed expression.
 * 
 * @since 1.0
 */
public enum ExprType {
  /** A metric path, possibly with globs. */
  NAME,
  
  /** A function call. */
  FUNC,
  
  /** A numeric constant. */
  CONST,
  
  /** A quoted string. */
  STRING,
  
  /** A true or false literal. */
  BOOL
}
