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

/**
 * Returns the absolute value of each data point in the series.
 * @since 1.0
 */
public class Absolute extends PerSeriesExpression {

  @Override
  protected DoubleUnaryOperator operator(final Expr node) {
    return Math::abs;
  }
}
