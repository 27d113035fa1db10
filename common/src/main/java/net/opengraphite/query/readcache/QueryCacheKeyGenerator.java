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
package net.opengraphite.query.readcache;

import java.util.List;
import java.util.Map;

/**
 * Generates stable cache keys from request parameters. Logically identical 
 * requests must produce identical keys regardless of parameter ordering.
 * 
 * @since 1.0
 */
public interface QueryCacheKeyGenerator {

  /**
   * Generates the key.
   * @param params A non-null map of parameter names to their values in the
   * order given by the caller.
   * @return A non-null and non-empty key.
   */
  public String generate(final Map<String, List<String>> params);
  
}
