/* -*- mode: Java; c-basic-offset: 2; indent-tabs-mode: nil; coding: utf-8-unix -*-
 *
 * Copyright © 2017-2018 microBean.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or
 * implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.microbean.kubernetes.poller;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.fabric8.kubernetes.api.model.ConfigMap;

import org.junit.Test;

import org.microbean.kubernetes.poller.client.ResourceIdentity;
import org.microbean.kubernetes.poller.client.Scope;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestSubscription {

  public TestSubscription() {
    super();
  }

  private final ChangeEvent<ConfigMap> added(final String namespace, final String name, final long version) {
    return new ChangeEvent<>(this,
                             ChangeEvent.Type.ADDED,
                             new ResourceIdentity(namespace, name),
                             WidgetConverter.configMap(namespace, name, "v", version),
                             null,
                             version);
  }

  @Test
  public void testFullSubscriptionDropsNewestAndCountsIt() {
    final Subscription<ConfigMap> subscription = new Subscription<>(Scope.all(), 2);
    final ChangeEvent<ConfigMap> first = this.added("default", "a", 1L);
    final ChangeEvent<ConfigMap> second = this.added("default", "b", 1L);
    assertTrue(subscription.offer(first));
    assertTrue(subscription.offer(second));
    assertFalse(subscription.offer(this.added("default", "c", 1L)));
    assertEquals(1L, subscription.getDroppedEventCount());
    assertSame(first, subscription.poll());
    assertSame(second, subscription.poll());
    assertNull(subscription.poll());
  }

  @Test
  public void testOneFullSubscriptionDoesNotAffectAnother() {
    final Subscription<ConfigMap> slow = new Subscription<>(Scope.all(), 1);
    final Subscription<ConfigMap> fast = new Subscription<>(Scope.all(), 10);
    for (int i = 0; i < 5; i++) {
      final ChangeEvent<ConfigMap> event = this.added("default", "r" + i, 1L);
      slow.offer(event);
      fast.offer(event);
    }
    assertEquals(1, slow.size());
    assertEquals(4L, slow.getDroppedEventCount());
    assertEquals(5, fast.size());
    assertEquals(0L, fast.getDroppedEventCount());
  }

  @Test
  public void testScopeFiltersEvents() {
    final Subscription<ConfigMap> subscription = new Subscription<>(Scope.namespace("mine"), 10);
    assertFalse(subscription.offer(this.added("theirs", "a", 1L)));
    assertTrue(subscription.offer(this.added("mine", "a", 1L)));
    assertEquals(1, subscription.size());
    assertEquals(0L, subscription.getDroppedEventCount());
  }

  @Test
  public void testBufferedEventsOutliveClose() throws Exception {
    final Subscription<ConfigMap> subscription = new Subscription<>(null, 10);
    final ChangeEvent<ConfigMap> event = this.added("default", "a", 1L);
    subscription.offer(event);
    subscription.close();
    subscription.close();
    assertTrue(subscription.isClosed());
    assertFalse(subscription.offer(this.added("default", "b", 1L)));
    assertSame(event, subscription.take());
    assertNull(subscription.take());
  }

  @Test
  public void testCloseWakesABlockedTake() throws Exception {
    final Subscription<ConfigMap> subscription = new Subscription<>(null, 10);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<ChangeEvent<ConfigMap>> taken = executor.submit(subscription::take);
      Thread.sleep(100L);
      assertFalse(taken.isDone());
      subscription.close();
      assertNull(taken.get(5L, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testTimedPollTimesOut() throws Exception {
    final Subscription<ConfigMap> subscription = new Subscription<>(null, 10);
    final long start = System.nanoTime();
    assertNull(subscription.poll(50L, TimeUnit.MILLISECONDS));
    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50L));
  }

}
