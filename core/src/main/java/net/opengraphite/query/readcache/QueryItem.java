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

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.stumbleupon.async.Deferred;
import com.stumbleupon.async.TimeoutException;

import net.opengraphite.utils.DateTime;

/**
 * The default {@link QueryCacheItem}. The state, result and completion 
 * signal live in one immutable generation that is swapped with a compare 
 * and set, so a waiter always blocks on the signal that belongs to the 
 * pending state it observed. An abort swaps in a fresh signal before firing
 * the old one so late arrivals wait on the next computer.
 * <p>
 * The item expires a fixed time after it was created or, once published, 
 * after it was published. A TTL of zero or less never expires.
 * 
 * @since 1.0
 */
public class QueryItem implements QueryCacheItem {
  private static final Logger LOG = LoggerFactory.getLogger(QueryItem.class);
  
  /** The states of an item. */
  static enum State {
    EMPTY,
    PENDING,
    READY
  }
  
  /** The key of this item, for logging. */
  protected final String key;
  
  /** The TTL in nanoseconds. */
  private final long ttl_nanos;
  
  /** The current generation. */
  private final AtomicReference<Generation> generation;
  
  /** When this item expires in nanos. */
  private volatile long expires;
  
  /**
   * Default ctor.
   * @param key The non-null key.
   * @param ttl_nanos The time to live in nanoseconds, zero or less to keep
   * forever.
   */
  public QueryItem(final String key, final long ttl_nanos) {
    this.key = key;
    this.ttl_nanos = ttl_nanos;
    generation = new AtomicReference<Generation>(
        new Generation(State.EMPTY, new Deferred<Object>(), null, 0));
    expires = DateTime.nanoTime() + ttl_nanos;
  }
  
  @Override
  public CacheLookup fetchOrLock(final long timeout_ms) {
    while (true) {
      final Generation current = generation.get();
      switch (current.state) {
      case READY:
        return CacheLookup.hit(current.data);
      case EMPTY:
        if (generation.compareAndSet(current, new Generation(State.PENDING, 
            current.signal, null, current.number))) {
          return CacheLookup.locked();
        }
        // lost the race, look again
        continue;
      default:
        return await(current, timeout_ms);
      }
    }
  }
  
  @Override
  public void publish(final byte[] data) {
    if (data == null) {
      throw new IllegalArgumentException("Data cannot be null.");
    }
    final Generation current = generation.get();
    if (current.state != State.PENDING) {
      throw new IllegalStateException("Item [" + key 
          + "] was not pending, it was " + current.state);
    }
    if (!generation.compareAndSet(current, new Generation(State.READY, 
        current.signal, data, current.number))) {
      throw new IllegalStateException("Item [" + key 
          + "] changed while publishing.");
    }
    expires = DateTime.nanoTime() + ttl_nanos;
    onPublish(data);
    current.signal.callback(null);
  }
  
  @Override
  public void abort() {
    while (true) {
      final Generation current = generation.get();
      if (current.state != State.PENDING) {
        return;
      }
      if (generation.compareAndSet(current, new Generation(State.EMPTY, 
          new Deferred<Object>(), null, current.number + 1))) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Aborted generation " + current.number + " of item [" 
              + key + "]");
        }
        current.signal.callback(null);
        return;
      }
    }
  }
  
  @Override
  public boolean isReady() {
    return generation.get().state == State.READY;
  }
  
  @Override
  public boolean expired(final long now_nanos) {
    return ttl_nanos > 0 && now_nanos - expires > 0;
  }
  
  /** @return The key of this item. */
  public String key() {
    return key;
  }
  
  /** @return The published data or null if not ready. */
  public byte[] data() {
    return generation.get().data;
  }
  
  /**
   * Called once the item is ready and before waiters are released. 
   * Overridden by caches to account for the stored bytes.
   * @param data The published data.
   */
  protected void onPublish(final byte[] data) {
    // no-op
  }
  
  @VisibleForTesting
  State state() {
    return generation.get().state;
  }
  
  @VisibleForTesting
  long generation() {
    return generation.get().number;
  }
  
  /**
   * Blocks on the signal of the pending generation.
   * @param pending The generation observed as pending.
   * @param timeout_ms The timeout, zero or less for none.
   * @return A hit, a retry or a cancellation.
   */
  private CacheLookup await(final Generation pending, final long timeout_ms) {
    try {
      if (timeout_ms > 0) {
        pending.signal.join(timeout_ms);
      } else {
        pending.signal.join();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return CacheLookup.cancelled();
    } catch (TimeoutException e) {
      if (LOG.isDebugEnabled()) {
        LOG.debug("Timed out after " + timeout_ms + "ms waiting on item [" 
            + key + "]");
      }
      return CacheLookup.cancelled();
    } catch (Exception e) {
      throw new IllegalStateException("Unexpected error waiting on item [" 
          + key + "]", e);
    }
    
    final Generation after = generation.get();
    if (after.state == State.READY) {
      return CacheLookup.hit(after.data);
    }
    return CacheLookup.retry();
  }
  
  @Override
  public String toString() {
    final Generation current = generation.get();
    return new StringBuilder()
        .append("key=")
        .append(key)
        .append(", state=")
        .append(current.state)
        .append(", generation=")
        .append(current.number)
        .append(", bytes=")
        .append(current.data == null ? 0 : current.data.length)
        .toString();
  }
  
  /** An immutable snapshot of the item. */
  private static final class Generation {
    private final State state;
    private final Deferred<Object> signal;
    private final byte[] data;
    private final long number;
    
    private Generation(final State state, 
                       final Deferred<Object> signal, 
                       final byte[] data, 
                       final long number) {
      this.state = state;
      this.signal = signal;
      this.data = data;
      this.number = number;
    }
  }
}
