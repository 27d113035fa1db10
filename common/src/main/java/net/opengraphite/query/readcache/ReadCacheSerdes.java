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

import net.opengraphite.data.MetricData;

/**
 * Serializes evaluated series for storage in a {@link QueryReadCache}.
 * 
 * @since 1.0
 */
public interface ReadCacheSerdes {

  /**
   * Converts the series into a byte array.
   * @param series A non-null, possibly empty, list of series.
   * @return A non-null byte array.
   */
  public byte[] serialize(final List<MetricData> series);

  /**
   * Restores series from the given bytes.
   * @param data A non-null byte array produced by {@link #serialize(List)}.
   * @return A non-null, possibly empty, list of series in their original 
   * order.
   */
  public List<MetricData> deserialize(final byte[] data);

}
