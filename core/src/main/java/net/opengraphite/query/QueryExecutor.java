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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;
import io.netty.util.TimerTask;

import net.opengraphite.data.MetricData;
import net.opengraphite.exceptions.QueryExecutionException;
import net.opengraphite.query.expression.Expr;
import net.opengraphite.query.expression.ExpressionEvaluator;
import net.opengraphite.query.expression.ExpressionFactory;
import net.opengraphite.query.expression.Expressions;
import net.opengraphite.query.readcache.CacheLookup;
import net.opengraphite.query.readcache.DefaultQueryCacheKeyGenerator;
import net.opengraphite.query.readcache.GuavaQueryCache;
import net.opengraphite.query.readcache.JsonReadCacheSerdes;
import net.opengraphite.query.readcache.QueryCacheItem;
import net.opengraphite.query.readcache.QueryCacheKeyGenerator;
import net.opengraphite.query.readcache.QueryReadCache;
import net.opengraphite.query.readcache.ReadCacheSerdes;
import net.opengraphite.utils.Config;
import net.opengraphite.utils.DateTime;

/**
 * Runs render requests: parses every target, fetches the distinct metric 
 * requests they need concurrently, then evaluates each target. A target 
 * that fails to parse or evaluate reports its error without failing the
 * others.
 * <p>
 * With a cache, identical requests are computed once. The first caller 
 * computes and publishes the serialized series while the rest wait on it.
 * Results with target errors are not cached and the computer aborts so 
 * the waiters compute for themselves.
 * 
 * @since 1.0
 */
public class QueryExecutor {
  private static final Logger LOG = 
      LoggerFactory.getLogger(QueryExecutor.class);
  
  /** The source of series. */
  private final MetricFetcher fetcher;
  
  /** Schedules fetch timeouts. */
  private final Timer timer;
  
  /** Whether or not the timer and cache were created here. */
  private final boolean owns_resources;
  
  /** An optional cache. */
  private final QueryReadCache cache;
  
  /** Generates cache keys, null if the cache is null. */
  private final QueryCacheKeyGenerator key_generator;
  
  /** Serializes cached results, null if the cache is null. */
  private final ReadCacheSerdes serdes;
  
  /** How long to wait on a computer in ms. */
  private final long cache_wait_timeout;
  
  /** How long to wait on each fetch in ms. */
  private final long fetch_timeout;
  
  /**
   * Ctor that sets up its own timer and the default cache when it's enabled
   * in the config and applies the config's function defaults to the 
   * registry if no earlier executor did. Call {@link #shutdown()} when done.
   * @param config A non-null config.
   * @param fetcher A non-null fetcher.
   */
  public QueryExecutor(final Config config, final MetricFetcher fetcher) {
    this(config, fetcher, new HashedWheelTimer());
  }
  
  private QueryExecutor(final Config config, 
                        final MetricFetcher fetcher, 
                        final Timer timer) {
    this(config, fetcher, timer, 
        config.enableCache() ? new GuavaQueryCache(config, timer) : null, 
        new DefaultQueryCacheKeyGenerator(), 
        new JsonReadCacheSerdes(), 
        true);
    ExpressionFactory.initialize(config);
  }
  
  /**
   * Ctor with collaborators. The timer and cache are not shut down by 
   * {@link #shutdown()}.
   * @param config A non-null config.
   * @param fetcher A non-null fetcher.
   * @param timer A non-null timer for fetch timeouts.
   * @param cache An optional cache, may be null to disable caching.
   * @param key_generator A key generator, required with a cache.
   * @param serdes A serdes implementation, required with a cache.
   */
  public QueryExecutor(final Config config, 
                       final MetricFetcher fetcher, 
                       final Timer timer, 
                       final QueryReadCache cache, 
                       final QueryCacheKeyGenerator key_generator, 
                       final ReadCacheSerdes serdes) {
    this(config, fetcher, timer, cache, key_generator, serdes, false);
  }
  
  private QueryExecutor(final Config config, 
                        final MetricFetcher fetcher, 
                        final Timer timer, 
                        final QueryReadCache cache, 
                        final QueryCacheKeyGenerator key_generator, 
                        final ReadCacheSerdes serdes, 
                        final boolean owns_resources) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    if (fetcher == null) {
      throw new IllegalArgumentException("Fetcher cannot be null.");
    }
    if (timer == null) {
      throw new IllegalArgumentException("Timer cannot be null.");
    }
    if (cache != null && (key_generator == null || serdes == null)) {
      throw new IllegalArgumentException("A cache requires a key generator "
          + "and serdes.");
    }
    this.fetcher = fetcher;
    this.timer = timer;
    this.cache = cache;
    this.key_generator = key_generator;
    this.serdes = serdes;
    this.owns_resources = owns_resources;
    cache_wait_timeout = config.cacheWaitTimeout();
    fetch_timeout = config.fetchTimeout();
  }
  
  /**
   * Executes the request, through the cache if there is one.
   * @param request A non-null request.
   * @return A deferred resolving to the result or a 
   * {@link QueryExecutionException} if waiting on the cache timed out or 
   * was interrupted.
   */
  public Deferred<RenderResult> execute(final RenderRequest request) {
    if (cache == null) {
      return compute(request);
    }
    
    final String key = key_generator.generate(request.cacheParams());
    while (true) {
      final QueryCacheItem item = cache.getItem(key);
      final CacheLookup lookup = item.fetchOrLock(cache_wait_timeout);
      switch (lookup.status()) {
      case HIT:
        if (LOG.isDebugEnabled()) {
          LOG.debug("Cache hit for key [" + key + "]");
        }
        return Deferred.fromResult(new RenderResult(
            serdes.deserialize(lookup.data()), 
            Collections.<String, QueryExecutionException>emptyMap()));
      case LOCKED:
        final Deferred<RenderResult> deferred;
        try {
          deferred = compute(request);
        } catch (RuntimeException e) {
          item.abort();
          throw e;
        }
        return deferred.addCallbacks(new PublishCB(key, item), 
            new AbortCB(key, item));
      case RETRY:
        if (LOG.isDebugEnabled()) {
          LOG.debug("Retrying key [" + key + "] after the computer aborted");
        }
        continue;
      default:
        return Deferred.fromError(new QueryExecutionException(
            "Timed out or interrupted waiting on a concurrent query", 504));
      }
    }
  }
  
  /** @return The cache, may be null. */
  public QueryReadCache cache() {
    return cache;
  }
  
  /** Stops the timer and cache if this executor created them. */
  public void shutdown() {
    if (!owns_resources) {
      return;
    }
    if (cache != null) {
      cache.shutdown();
    }
    timer.stop();
  }
  
  /**
   * Parses, fetches and evaluates without the cache.
   * @param request A non-null request.
   * @return A deferred resolving to the result.
   */
  Deferred<RenderResult> compute(final RenderRequest request) {
    final long start = DateTime.nanoTime();
    final Map<String, QueryExecutionException> errors = 
        new LinkedHashMap<String, QueryExecutionException>();
    final List<Expr> expressions = new ArrayList<Expr>();
    final Set<MetricRequest> requests = new LinkedHashSet<MetricRequest>();
    
    for (final String target : request.targets()) {
      try {
        final Expr expression = Expressions.parse(target);
        requests.addAll(expression.metrics(request.from(), request.until()));
        expressions.add(expression);
      } catch (QueryExecutionException e) {
        errors.put(target, e);
        expressions.add(null);
      }
    }
    
    final List<MetricRequest> ordered = Lists.newArrayList(requests);
    final List<Deferred<List<MetricData>>> deferreds = 
        Lists.newArrayListWithCapacity(ordered.size());
    for (final MetricRequest metric_request : ordered) {
      deferreds.add(fetch(metric_request));
    }
    
    class EvaluateCB implements 
        Callback<RenderResult, ArrayList<List<MetricData>>> {
      @Override
      public RenderResult call(final ArrayList<List<MetricData>> fetches) {
        final Map<MetricRequest, List<MetricData>> fetched = 
            Maps.newHashMapWithExpectedSize(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
          fetched.put(ordered.get(i), fetches.get(i));
        }
        
        final ExpressionEvaluator evaluator = 
            new ExpressionEvaluator(fetcher, fetch_timeout);
        final List<MetricData> series = new ArrayList<MetricData>();
        for (int i = 0; i < expressions.size(); i++) {
          final Expr expression = expressions.get(i);
          if (expression == null) {
            continue;
          }
          final String target = request.targets().get(i);
          try {
            series.addAll(evaluator.evaluate(expression, request.from(), 
                request.until(), fetched));
          } catch (QueryExecutionException e) {
            errors.put(target, e);
          } catch (RuntimeException e) {
            LOG.warn("Unexpected failure evaluating target: " + target, e);
            errors.put(target, new QueryExecutionException(
                "Failed to evaluate target: " + target, 500, e));
          }
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Computed " + series.size() + " series with " 
              + errors.size() + " errors for " + request + " in " 
              + DateTime.msFromNanoDiff(DateTime.nanoTime(), start) + "ms");
        }
        return new RenderResult(series, errors);
      }
    }
    
    if (deferreds.isEmpty()) {
      return Deferred.fromResult(new EvaluateCB().call(
          new ArrayList<List<MetricData>>()));
    }
    return Deferred.group(deferreds).addCallback(new EvaluateCB());
  }
  
  /**
   * Fetches a request, replacing a failure with an empty list.
   * @param request The non-null request.
   * @return A deferred that always resolves to a list.
   */
  private Deferred<List<MetricData>> fetch(final MetricRequest request) {
    class ErrorCB implements Callback<List<MetricData>, Exception> {
      @Override
      public List<MetricData> call(final Exception e) {
        LOG.warn("Failed to fetch " + request, e);
        return Collections.emptyList();
      }
    }
    
    class NullCB implements Callback<List<MetricData>, List<MetricData>> {
      @Override
      public List<MetricData> call(final List<MetricData> series) {
        return series == null ? 
            Collections.<MetricData>emptyList() : series;
      }
    }
    
    final Deferred<List<MetricData>> deferred;
    try {
      deferred = fetcher.fetch(request);
    } catch (RuntimeException e) {
      LOG.warn("Failed to fetch " + request, e);
      return Deferred.fromResult(Collections.<MetricData>emptyList());
    }
    if (deferred == null) {
      return Deferred.fromResult(Collections.<MetricData>emptyList());
    }
    return withTimeout(request, 
        deferred.addCallbacks(new NullCB(), new ErrorCB()));
  }
  
  /**
   * Resolves to the fetched series or, when the fetch timeout elapses 
   * first, to an empty list.
   * @param request The non-null request, for logging.
   * @param deferred The fetch that always resolves to a list.
   * @return A deferred that resolves exactly once.
   */
  private Deferred<List<MetricData>> withTimeout(final MetricRequest request, 
      final Deferred<List<MetricData>> deferred) {
    if (fetch_timeout <= 0) {
      return deferred;
    }
    final Deferred<List<MetricData>> result = new Deferred<List<MetricData>>();
    final AtomicBoolean completed = new AtomicBoolean();
    final Timeout timeout = timer.newTimeout(new TimerTask() {
      @Override
      public void run(final Timeout ignored) {
        if (completed.compareAndSet(false, true)) {
          LOG.warn("Timed out after " + fetch_timeout + "ms fetching " 
              + request);
          result.callback(Collections.<MetricData>emptyList());
        }
      }
    }, fetch_timeout, TimeUnit.MILLISECONDS);
    
    class CompleteCB implements Callback<Object, List<MetricData>> {
      @Override
      public Object call(final List<MetricData> series) {
        if (timeout != null) {
          timeout.cancel();
        }
        if (completed.compareAndSet(false, true)) {
          result.callback(series);
        }
        return null;
      }
    }
    
    deferred.addCallback(new CompleteCB());
    return result;
  }
  
  /** Publishes a clean result or aborts. */
  private class PublishCB implements Callback<RenderResult, RenderResult> {
    private final String key;
    private final QueryCacheItem item;
    
    PublishCB(final String key, final QueryCacheItem item) {
      this.key = key;
      this.item = item;
    }
    
    @Override
    public RenderResult call(final RenderResult result) {
      if (result.hasErrors()) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Not caching key [" + key + "] with target errors: " 
              + result.errors().keySet());
        }
        item.abort();
        return result;
      }
      final byte[] data;
      try {
        data = serdes.serialize(result.series());
      } catch (RuntimeException e) {
        LOG.warn("Failed to serialize the result for key [" + key 
            + "], aborting", e);
        item.abort();
        return result;
      }
      item.publish(data);
      return result;
    }
  }
  
  /** Aborts the item and passes the error along. */
  private class AbortCB implements Callback<Exception, Exception> {
    private final String key;
    private final QueryCacheItem item;
    
    AbortCB(final String key, final QueryCacheItem item) {
      this.key = key;
      this.item = item;
    }
    
    @Override
    public Exception call(final Exception e) {
      LOG.warn("Computing key [" + key + "] failed, aborting", e);
      item.abort();
      return e;
    }
  }
}
