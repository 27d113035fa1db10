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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSet;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;

import net.opengraphite.utils.JSON;

/**
 * Simple implementation of the key generator that prepends keys with
 * "OGQ". Parameters that only bust browser or proxy caches, like "_" and 
 * "jsonp", are dropped. The rest are sorted by name, keeping the order of
 * repeated values since target order matters, serialized as JSON and hashed
 * so that identical logical requests share a key however they were written.
 * 
 * @since 1.0
 */
public class DefaultQueryCacheKeyGenerator implements QueryCacheKeyGenerator {

  /** The prefix to prepend */
  public static final String CACHE_PREFIX = "OGQ";
  
  /** Parameters that don't change the result. */
  public static final ImmutableSet<String> IGNORED_PARAMS = ImmutableSet.of(
      "_", "_salt", "_ts", "jsonp", "callback", "noCache", "cacheTimeout");
  
  @Override
  public String generate(final Map<String, List<String>> params) {
    if (params == null) {
      throw new IllegalArgumentException("Params cannot be null.");
    }
    final TreeMap<String, List<String>> canonical = 
        new TreeMap<String, List<String>>();
    for (final Entry<String, List<String>> entry : params.entrySet()) {
      if (entry.getKey() == null || IGNORED_PARAMS.contains(entry.getKey())) {
        continue;
      }
      canonical.put(entry.getKey(), entry.getValue() == null ? 
          new ArrayList<String>() : entry.getValue());
    }
    final HashCode hash = Hashing.murmur3_128().hashBytes(
        JSON.serializeToBytes(canonical));
    return CACHE_PREFIX + hash.toString();
  }
}
