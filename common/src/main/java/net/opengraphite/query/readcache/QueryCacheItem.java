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
 * A single key in a {@link QueryReadCache} that coordinates concurrent 
 * callers so that at most one computes the result while the others wait.
 * <p>
 * States move from empty to pending when a caller wins the right to compute,
 * then to ready when the computer publishes. On failure the computer aborts,
 * resetting the item to empty and waking the waiters so they retry.
 * 
 * @since 1.0
 */
public interface QueryCacheItem {

  /**
   * Returns the published result or attempts to become the computer. If 
   * another caller is computing, blocks until it publishes or aborts or the
   * timeout elapses.
   * @param timeout_ms How long to wait in milliseconds. Zero or less waits 
   * forever.
   * @return A non-null lookup. On {@link CacheLookup.Status#LOCKED} the caller
   * must call {@link #publish(byte[])} or {@link #abort()}. On 
   * {@link CacheLookup.Status#RETRY} it must call this method again.
   */
  public CacheLookup fetchOrLock(final long timeout_ms);
  
  /**
   * Stores the result and releases every waiter. Only the computer may call
   * this.
   * @param data The non-null serialized result.
   * @throws IllegalStateException if the item was not pending.
   */
  public void publish(final byte[] data);
  
  /**
   * Resets the item so the next caller computes and releases every current 
   * waiter so they retry. A no-op if the item was already published.
   */
  public void abort();
  
  /** @return Whether or not a result has been published. */
  public boolean isReady();
  
  /** @return Whether or not the item expired at the given time. */
  public boolean expired(final long now_nanos);
}
