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
 * The outcome of {@link QueryCacheItem#fetchOrLock(long)}.
 * 
 * @since 1.0
 */
public final class CacheLookup {
  
  /** What happened. */
  public static enum Status {
    /** A result was published and is in {@link CacheLookup#data()}. */
    HIT,
    
    /** The caller won the race and must publish or abort. */
    LOCKED,
    
    /** The computer aborted. The caller must look up the key again. */
    RETRY,
    
    /** The caller gave up waiting due to a deadline or interrupt. */
    CANCELLED
  }
  
  private static final CacheLookup LOCKED = new CacheLookup(Status.LOCKED, null);
  private static final CacheLookup RETRY = new CacheLookup(Status.RETRY, null);
  private static final CacheLookup CANCELLED = 
      new CacheLookup(Status.CANCELLED, null);
  
  /** The status. */
  private final Status status;
  
  /** The data when the status is HIT. */
  private final byte[] data;
  
  private CacheLookup(final Status status, final byte[] data) {
    this.status = status;
    this.data = data;
  }
  
  /** @return The status. */
  public Status status() {
    return status;
  }
  
  /** @return The published data if the status is HIT, null otherwise. */
  public byte[] data() {
    return data;
  }
  
  /**
   * @param data The non-null published data.
   * @return A hit.
   */
  public static CacheLookup hit(final byte[] data) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    return new CacheLookup(Status.HIT, data);
  }
  
  /** @return The singleton result telling the caller to compute. */
  public static CacheLookup locked() {
    return LOCKED;
  }
  
  /** @return The singleton result telling the caller to try again. */
  public static CacheLookup retry() {
    return RETRY;
  }
  
  /** @return The singleton result for a waiter that gave up. */
  public static CacheLookup cancelled() {
    return CANCELLED;
  }
}
