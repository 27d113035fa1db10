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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import net.opengraphite.query.readcache.CacheLookup.Status;

public class TestQueryItem {
  private static final byte[] DATA = new byte[] { 42, 24 };
  private static final long TTL = TimeUnit.SECONDS.toNanos(60);
  
  @Test
  public void ctor() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    assertEquals("key", item.key());
    assertEquals(QueryItem.State.EMPTY, item.state());
    assertEquals(0, item.generation());
    assertFalse(item.isReady());
    assertNull(item.data());
  }
  
  @Test
  public void lockThenPublish() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    assertEquals(Status.LOCKED, item.fetchOrLock(0).status());
    assertEquals(QueryItem.State.PENDING, item.state());
    
    item.publish(DATA);
    assertEquals(QueryItem.State.READY, item.state());
    assertTrue(item.isReady());
    assertSame(DATA, item.data());
    
    final CacheLookup lookup = item.fetchOrLock(0);
    assertEquals(Status.HIT, lookup.status());
    assertArrayEquals(DATA, lookup.data());
  }
  
  @Test
  public void publishNotPending() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    try {
      item.publish(DATA);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    
    item.fetchOrLock(0);
    item.publish(DATA);
    try {
      item.publish(DATA);
      fail("Expected IllegalStateException");
    } catch (IllegalStateException e) { }
    assertSame(DATA, item.data());
  }
  
  @Test (expected = IllegalArgumentException.class)
  public void publishNull() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    item.fetchOrLock(0);
    item.publish(null);
  }
  
  @Test
  public void abort() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    item.fetchOrLock(0);
    item.abort();
    assertEquals(QueryItem.State.EMPTY, item.state());
    assertEquals(1, item.generation());
    
    // the next caller computes
    assertEquals(Status.LOCKED, item.fetchOrLock(0).status());
    item.publish(DATA);
    assertEquals(1, item.generation());
  }
  
  @Test
  public void abortNoop() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    item.abort();
    assertEquals(QueryItem.State.EMPTY, item.state());
    assertEquals(0, item.generation());
    
    item.fetchOrLock(0);
    item.publish(DATA);
    item.abort();
    assertEquals(QueryItem.State.READY, item.state());
    assertSame(DATA, item.data());
  }
  
  @Test
  public void waitTimesOut() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    item.fetchOrLock(0);
    assertEquals(Status.CANCELLED, item.fetchOrLock(10).status());
    assertEquals(QueryItem.State.PENDING, item.state());
  }
  
  @Test
  public void waiterSeesPublish() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    assertEquals(Status.LOCKED, item.fetchOrLock(0).status());
    
    final AtomicReference<CacheLookup> result = 
        new AtomicReference<CacheLookup>();
    final CountDownLatch started = new CountDownLatch(1);
    final Thread waiter = new Thread(new Runnable() {
      @Override
      public void run() {
        started.countDown();
        result.set(item.fetchOrLock(5000));
      }
    });
    waiter.start();
    started.await();
    Thread.sleep(50);
    item.publish(DATA);
    waiter.join(5000);
    
    assertEquals(Status.HIT, result.get().status());
    assertSame(DATA, result.get().data());
  }
  
  @Test
  public void waiterSeesAbort() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    assertEquals(Status.LOCKED, item.fetchOrLock(0).status());
    
    final AtomicReference<CacheLookup> result = 
        new AtomicReference<CacheLookup>();
    final CountDownLatch started = new CountDownLatch(1);
    final Thread waiter = new Thread(new Runnable() {
      @Override
      public void run() {
        started.countDown();
        result.set(item.fetchOrLock(5000));
      }
    });
    waiter.start();
    started.await();
    Thread.sleep(50);
    item.abort();
    waiter.join(5000);
    
    // either retry or, if the waiter raced the abort, the lock
    final Status status = result.get().status();
    assertTrue(status == Status.RETRY || status == Status.LOCKED);
  }
  
  @Test
  public void waiterAfterPublishDoesNotBlock() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    item.fetchOrLock(0);
    item.publish(DATA);
    // a zero timeout waits forever so this would hang if it blocked
    assertEquals(Status.HIT, item.fetchOrLock(0).status());
  }
  
  @Test
  public void expired() throws Exception {
    final QueryItem item = new QueryItem("key", TTL);
    final long now = System.nanoTime();
    assertFalse(item.expired(now));
    assertTrue(item.expired(now + TTL + TimeUnit.SECONDS.toNanos(1)));
  }
  
  @Test
  public void expiredNoTtl() throws Exception {
    final QueryItem item = new QueryItem("key", 0);
    assertFalse(item.expired(System.nanoTime() + TTL));
  }
  
  @Test
  public void publishResetsExpiration() throws Exception {
    final QueryItem item = new QueryItem("key", TimeUnit.MILLISECONDS.toNanos(
        100));
    Thread.sleep(150);
    assertTrue(item.expired(System.nanoTime()));
    item.fetchOrLock(0);
    item.publish(DATA);
    assertFalse(item.expired(System.nanoTime()));
  }
  
  @Test
  public void onPublish() throws Exception {
    final AtomicReference<byte[]> published = new AtomicReference<byte[]>();
    final QueryItem item = new QueryItem("key", TTL) {
      @Override
      protected void onPublish(final byte[] data) {
        published.set(data);
      }
    };
    item.fetchOrLock(0);
    item.publish(DATA);
    assertSame(DATA, published.get());
  }
}
