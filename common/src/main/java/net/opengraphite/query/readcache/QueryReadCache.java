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

/**
 * A single-flight, TTL bounded cache of serialized query results. Callers 
 * get an item for a key and use it to either read the result or become the
 * one caller that computes it.
 * <p>
 * Implementations should expire items in the background, not on access.
 * 
 * @since 1.0
 */
public interface QueryReadCache {

  /**
   * Returns the item for the key, creating an empty one atomically if none 
   * exists.
   * @param key A non-null and non-empty key.
   * @return A non-null item.
   * @throws IllegalArgumentException if the key was null or empty.
   */
  public QueryCacheItem getItem(final String key);
  
  /** @return The number of items currently in the cache. */
  public long size();
  
  /** @return The number of published bytes currently in the cache. */
  public long bytesStored();
  
  /** Stops any background tasks and clears the cache. */
  public void shutdown();
  
}
