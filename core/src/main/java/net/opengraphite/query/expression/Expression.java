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
import java.util.List;
import java.util.Map;

import net.opengraphite.data.MetricData;
import net.opengraphite.query.MetricRequest;

/**
 * The interface for functions callable from an expression. Implementations
 * are stateless and shared across threads, registered by name in the 
 * {@link ExpressionFactory}.
 * 
 * @since 1.0
 */
public interface Expression {

  /**
   * Evaluates the function call. Series arguments are evaluated through the
   * evaluator, in argument order, so a function may evaluate its arguments 
   * over a shifted range.
   * @param evaluator The non-null evaluator to resolve arguments with.
   * @param node The non-null function call node including literal 
   * arguments.
   * @param from The start of the requested range in seconds.
   * @param until The end of the requested range in seconds.
   * @param fetched The non-null series fetched for the query, read only.
   * @return A non-null, possibly empty, list of new series. Inputs are never
   * modified.
   */
  public List<MetricData> evaluate(final ExpressionEvaluator evaluator, 
                                   final Expr node, 
                                   final long from, 
                                   final long until, 
                                   final Map<MetricRequest, List<MetricData>> fetched);
  
  /**
   * Returns the metric requests needed to evaluate the call. Functions that
   * read data outside of the range override this to shift the range handed 
   * to their arguments.
   * @param node The non-null function call node.
   * @param from The start of the requested range in seconds.
   * @param until The end of the requested range in seconds.
   * @return A non-null, possibly empty, list of requests.
   */
  public default List<MetricRequest> metrics(final Expr node, 
                                             final long from, 
                                             final long until) {
    return collectMetrics(node, from, until);
  }
  
  /**
   * Gathers the requests of every positional argument over the range.
   * @param node The non-null function call node.
   * @param from The start of the range in seconds.
   * @param until The end of the range in seconds.
   * @return A non-null, possibly empty, list of requests.
   */
  public static List<MetricRequest> collectMetrics(final Expr node, 
                                                   final long from, 
                                                   final long until) {
    final List<MetricRequest> requests = new ArrayList<MetricRequest>();
    for (final Expr arg : node.args()) {
      requests.addAll(arg.metrics(from, until));
    }
    return requests;
  }
}
