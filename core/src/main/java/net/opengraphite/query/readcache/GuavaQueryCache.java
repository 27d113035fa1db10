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

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.cache.RemovalListener;
import com.google.common.cache.RemovalNotification;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;
import net.opengraphite.utils.Config;
import net.opengraphite.utils.DateTime;

/**
 * An on-heap, in-memory single-flight cache using the Guava {@link Cache} 
 * class for a bounded number of items and thread safety.
 * <p>
 * Items are created atomically on first lookup and expired by a periodic 
 * sweep on a timer, never on access, so a caller holding an item can 
 * always finish with it. The cache also tracks the number of published 
 * bytes (not counting Guava overhead or keys). When a publish pushes the 
 * total over the limit, the item still releases its waiters but is dropped 
 * from the cache right away.
 * <p>
 * Keys may not be null or empty.
 * 
 * @since 1.0
 */
public class GuavaQueryCache implements QueryReadCache, TimerTask {
  private static final Logger LOG = 
      LoggerFactory.getLogger(GuavaQueryCache.class);
  
  /** A counter used to track how many bytes are in the cache. */
  private final AtomicLong size;
  
  /** A counter to track how many items have been expired out of the cache. */
  private final AtomicLong expired;
  
  /** The Guava cache implementation. */
  private final Cache<String, CacheItem> cache;
  
  /** The timer the sweep runs on. */
  private final Timer timer;
  
  /** Whether or not we created the timer and must stop it. */
  private final boolean owns_timer;
  
  /** The TTL for items in nanoseconds. */
  private final long ttl_nanos;
  
  /** The configured size limit in bytes. */
  private final long size_limit;
  
  /** The configured maximum number of objects. */
  private final int max_objects;
  
  /** How often to sweep in milliseconds. */
  private final long sweep_interval;
  
  /** Set on shutdown so the sweep stops rescheduling. */
  private volatile boolean shutdown;
  
  /**
   * Ctor that starts its own timer.
   * @param config A non-null config.
   */
  public GuavaQueryCache(final Config config) {
    this(config, new HashedWheelTimer(), true);
  }
  
  /**
   * Ctor that schedules the sweep on a shared timer. The timer is not 
   * stopped on {@link #shutdown()}.
   * @param config A non-null config.
   * @param timer A non-null, running timer.
   */
  public GuavaQueryCache(final Config config, final Timer timer) {
    this(config, timer, false);
  }
  
  private GuavaQueryCache(final Config config, 
                          final Timer timer, 
                          final boolean owns_timer) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (timer == null) {
      throw new IllegalArgumentException("Timer cannot be null.");
    }
    size = new AtomicLong();
    expired = new AtomicLong();
    ttl_nanos = TimeUnit.SECONDS.toNanos(
        config.getLong(Config.CACHE_EXPIRATION_KEY));
    max_objects = config.getInt(Config.CACHE_OBJECTS_LIMIT_KEY);
    size_limit = config.getLong(Config.CACHE_SIZE_LIMIT_KEY);
    sweep_interval = config.getLong(Config.CACHE_SWEEP_INTERVAL_KEY);
    if (max_objects < 1) {
      throw new IllegalArgumentException("Object limit must be at least 1: " 
          + max_objects);
    }
    if (sweep_interval < 1) {
      throw new IllegalArgumentException("Sweep interval must be at least "
          + "1ms: " + sweep_interval);
    }
    cache = CacheBuilder.newBuilder()
        .maximumSize(max_objects)
        .removalListener(new Decrementer())
        .recordStats()
        .build();
    this.timer = timer;
    this.owns_timer = owns_timer;
    timer.newTimeout(this, sweep_interval, TimeUnit.MILLISECONDS);
    LOG.info("Started query cache with a limit of " + max_objects 
        + " items and " + size_limit + " bytes, expiring after " 
        + TimeUnit.NANOSECONDS.toSeconds(ttl_nanos) + "s");
  }
  
  @Override
  public QueryCacheItem getItem(final String key) {
    if (Strings.isNullOrEmpty(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty.");
    }
    try {
      return cache.get(key, new Callable<CacheItem>() {
        @Override
        public CacheItem call() {
          return new CacheItem(key);
        }
      });
    } catch (ExecutionException e) {
      throw new IllegalStateException("Failed to create an item for key [" 
          + key + "]", e);
    }
  }
  
  @Override
  public long size() {
    return cache.size();
  }
  
  @Override
  public long bytesStored() {
    return size.get();
  }
  
  /** @return The Guava stats for lookups. */
  public CacheStats stats() {
    return cache.stats();
  }
  
  /** @return How many items were expired by sweeps. */
  public long expired() {
    return expired.get();
  }
  
  @Override
  public void shutdown() {
    shutdown = true;
    if (owns_timer) {
      timer.stop();
    }
    cache.invalidateAll();
  }
  
  @Override
  public void run(final Timeout ignored) throws Exception {
    try {
      sweep(DateTime.nanoTime());
    } catch (Exception e) {
      LOG.error("Unexpected exception sweeping the query cache", e);
    }
    if (!shutdown) {
      timer.newTimeout(this, sweep_interval, TimeUnit.MILLISECONDS);
    }
  }
  
  /**
   * Removes every item that expired by the given time.
   * @param now_nanos The current time in nanos.
   * @return The number of items removed.
   */
  @VisibleForTesting
  int sweep(final long now_nanos) {
    final Map<String, CacheItem> map = cache.asMap();
    int removed = 0;
    for (final Map.Entry<String, CacheItem> entry : map.entrySet()) {
      if (entry.getValue().expired(now_nanos) && 
          map.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    expired.addAndGet(removed);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Swept " + removed + " expired items from the query cache, " 
          + cache.size() + " remain with " + size.get() + " bytes");
    }
    return removed;
  }
  
  @VisibleForTesting
  Cache<String, CacheItem> cache() {
    return cache;
  }
  
  @VisibleForTesting
  long sizeLimit() {
    return size_limit;
  }
  
  @VisibleForTesting
  int maxObjects() {
    return max_objects;
  }
  
  /** An item that accounts for its bytes while it's in the cache. */
  class CacheItem extends QueryItem {
    /** Set while the bytes are counted in the total. */
    private final AtomicBoolean counted;
    
    CacheItem(final String key) {
      super(key, ttl_nanos);
      counted = new AtomicBoolean();
    }
    
    @Override
    protected void onPublish(final byte[] data) {
      counted.set(true);
      final long total = size.addAndGet(data.length);
      if (cache.asMap().get(key) != this) {
        // swept or evicted while computing
        if (uncount()) {
          size.addAndGet(-data.length);
        }
        return;
      }
      if (total > size_limit) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Will not keep key [" + key + "] due to size limit.");
        }
        cache.asMap().remove(key, this);
      }
    }
    
    /** @return True if the bytes were counted and must be released. */
    boolean uncount() {
      return counted.compareAndSet(true, false);
    }
  }
  
  /** Super simple listener that decrements our size counter. */
  private class Decrementer implements RemovalListener<String, CacheItem> {
    @Override
    public void onRemoval(
        final RemovalNotification<String, CacheItem> notification) {
      final CacheItem item = notification.getValue();
      if (item != null && item.uncount()) {
        size.addAndGet(-item.data().length);
      }
    }
  }
}
