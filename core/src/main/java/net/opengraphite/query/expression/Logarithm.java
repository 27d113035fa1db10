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

import java.util.function.DoubleUnaryOperator;

import net.opengraphite.exceptions.InvalidArgumentException;
import net.opengraphite.exceptions.InvalidArgumentException.Reason;

/**
 * Logarithm of each data point in the given base, 10 by default. Zero and
 * negative values become absent.
 * @since 1.0
 */
public class Logarithm extends PerSeriesExpression {
  
  @Override
  protected DoubleUnaryOperator operator(final Expr node) {
    final double base = node.getFloatNamedOrPosArgDefault("base", 1, 10);
    if (base <= 0 || base == 1) {
      throw new InvalidArgumentException(Reason.INVALID_VALUE, 
          "Invalid logarithm base: " + base);
    }
    final double divisor = Math.log(base);
    return v -> v <= 0 ? Double.NaN : Math.log(v) / divisor;
  }
}
