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
package net.opengraphite.query;

import java.util.List;

import com.stumbleupon.async.Deferred;

import net.opengraphite.data.MetricData;

/**
 * The contract of the storage or fan-out collaborator that resolves a metric 
 * pattern into concrete series.
 * 
 * @since 1.0
 */
public interface MetricFetcher {

  /**
   * Fetches every series matching the request's pattern over its range.
   * @param request A non-null request.
   * @return A deferred resolving to a non-null, possibly empty, list of 
   * series or an exception if the fetch failed.
   */
  public Deferred<List<MetricData>> fetch(final MetricRequest request);
  
}
