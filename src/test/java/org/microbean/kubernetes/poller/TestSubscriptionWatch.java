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

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicReference;

import io.fabric8.kubernetes.api.model.ConfigMap;

import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;

import org.junit.Test;

import org.microbean.kubernetes.poller.client.ResourceIdentity;
import org.microbean.kubernetes.poller.client.Scope;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestSubscriptionWatch {

  public TestSubscriptionWatch() {
    super();
  }

  @Test
  public void testEventsArePumpedAndDeletionsCarryThePriorResource() throws Exception {
    final Subscription<ConfigMap> subscription = new Subscription<>(Scope.all(), 10);
    final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    final CountDownLatch closed = new CountDownLatch(1);
    final SubscriptionWatch<ConfigMap> watch = new SubscriptionWatch<>(subscription, new Watcher<ConfigMap>() {
        @Override
        public void eventReceived(final Watcher.Action action, final ConfigMap resource) {
          received.add(action + " " + resource.getMetadata().getName() + " " + resource.getData().get("value"));
        }

        @Override
        public void onClose() {
          closed.countDown();
        }

        @Override
        public void onClose(final WatcherException cause) {
          throw new AssertionError(cause);
        }
      });
    watch.start();

    final ResourceIdentity identity = new ResourceIdentity("default", "a");
    final ConfigMap v1 = WidgetConverter.configMap("default", "a", "1", 1L);
    subscription.offer(new ChangeEvent<>(this, ChangeEvent.Type.ADDED, identity, v1, null, 1L));
    subscription.offer(new ChangeEvent<ConfigMap>(this, ChangeEvent.Type.DELETED, identity, null, v1, 2L));

    assertEquals("ADDED a 1", received.poll(5L, TimeUnit.SECONDS));
    assertEquals("DELETED a 1", received.poll(5L, TimeUnit.SECONDS));

    watch.close();
    assertTrue(closed.await(5L, TimeUnit.SECONDS));
    assertTrue(subscription.isClosed());
  }

  @Test
  public void testFailingWatcherIsClosedWithAnException() throws Exception {
    final Subscription<ConfigMap> subscription = new Subscription<>(Scope.all(), 10);
    final AtomicReference<WatcherException> cause = new AtomicReference<>();
    final CountDownLatch closed = new CountDownLatch(1);
    final IllegalStateException boom = new IllegalStateException("boom");
    final SubscriptionWatch<ConfigMap> watch = new SubscriptionWatch<>(subscription, new Watcher<ConfigMap>() {
        @Override
        public void eventReceived(final Watcher.Action action, final ConfigMap resource) {
          throw boom;
        }

        @Override
        public void onClose(final WatcherException e) {
          cause.set(e);
          closed.countDown();
        }
      });
    watch.start();
    subscription.offer(new ChangeEvent<>(this,
                                         ChangeEvent.Type.ADDED,
                                         new ResourceIdentity("default", "a"),
                                         WidgetConverter.configMap("default", "a", "1", 1L),
                                         null,
                                         1L));
    assertTrue(closed.await(5L, TimeUnit.SECONDS));
    assertSame(boom, cause.get().getCause());
    assertTrue(subscription.isClosed());
    watch.close();
    assertNull(subscription.poll());
  }

}
