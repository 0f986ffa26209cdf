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

import java.time.Duration;

import java.util.ArrayList;
import java.util.List;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import io.fabric8.kubernetes.api.model.ConfigMap;

import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.microbean.kubernetes.poller.client.BackendClientConfiguration;
import org.microbean.kubernetes.poller.client.BackendException;
import org.microbean.kubernetes.poller.client.FlakyBackendClient;
import org.microbean.kubernetes.poller.client.InMemoryBackendClient;
import org.microbean.kubernetes.poller.client.ResilientClient;
import org.microbean.kubernetes.poller.client.ResourceIdentity;
import org.microbean.kubernetes.poller.client.ResourceType;
import org.microbean.kubernetes.poller.client.Scope;
import org.microbean.kubernetes.poller.client.Widget;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestPollerManager {

  private InMemoryBackendClient backend;

  private FlakyBackendClient flaky;

  private ResilientClient client;

  private PollerManager manager;

  public TestPollerManager() {
    super();
  }

  @Before
  public void setUp() throws Exception {
    this.backend = new InMemoryBackendClient();
    this.backend.register(Widget.TYPE, Widget::getIdentity);
    this.backend.create(Widget.TYPE, new Widget("default", "a", "1", 1L));
    this.flaky = new FlakyBackendClient(this.backend);
    this.client = new ResilientClient(this.flaky, new BackendClientConfiguration.Builder()
                                      .requestTimeout(Duration.ofSeconds(5L))
                                      .cooldown(Duration.ofMillis(100L))
                                      .build());
    this.manager = new PollerManager(this.client, new PollerConfiguration.Builder()
                                     .pollInterval(Duration.ofMillis(50L))
                                     .maxBackoff(Duration.ofMillis(200L))
                                     .shutdownTimeout(Duration.ofSeconds(5L))
                                     .build());
    this.manager.register(new WidgetConverter());
  }

  @After
  public void tearDown() throws Exception {
    this.manager.close();
    this.client.close();
  }

  @Test
  public void testConcurrentFirstSubscribersShareOnePoller() throws Exception {
    final int threads = 8;
    final CountDownLatch go = new CountDownLatch(1);
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<SharedPoller<Widget, ConfigMap>>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(executor.submit(() -> {
              go.await();
              return this.manager.getPoller(Widget.TYPE);
            }));
      }
      go.countDown();
      final SharedPoller<Widget, ConfigMap> poller = futures.get(0).get(5L, TimeUnit.SECONDS);
      assertNotNull(poller);
      for (final Future<SharedPoller<Widget, ConfigMap>> future : futures) {
        assertSame(poller, future.get(5L, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnregisteredTypeIsRejected() {
    this.manager.subscribe(new ResourceType<>("gadgets", Widget.class, ConfigMap.class), Scope.all());
  }

  @Test
  public void testSubscribersFollowTheBackend() throws Exception {
    final Subscription<ConfigMap> subscription = this.manager.subscribe(Widget.TYPE, Scope.all());
    ChangeEvent<ConfigMap> event = subscription.poll(5L, TimeUnit.SECONDS);
    assertNotNull(event);
    assertEquals(ChangeEvent.Type.ADDED, event.getType());

    this.client.create(Widget.TYPE, new Widget("default", "b", "1", 1L));
    event = subscription.poll(5L, TimeUnit.SECONDS);
    assertNotNull(event);
    assertEquals(ChangeEvent.Type.ADDED, event.getType());
    assertEquals(new ResourceIdentity("default", "b"), event.getIdentity());

    assertTrue(this.manager.unsubscribe(Widget.TYPE, subscription.getId()));
    assertTrue(subscription.isClosed());
  }

  @Test
  public void testSubscribersNeverSeeBackendErrors() throws Exception {
    final Subscription<ConfigMap> subscription = this.manager.subscribe(Widget.TYPE, Scope.all());
    assertNotNull(subscription.poll(5L, TimeUnit.SECONDS));
    this.flaky.failWith(new BackendException("down"));
    Thread.sleep(300L);
    assertNull(subscription.poll());
    assertTrue(this.flaky.getListCount() > 1);
    assertTrue(this.client.getStaleServedCount() > 0L);
    this.flaky.recover();
    this.backend.create(Widget.TYPE, new Widget("default", "b", "1", 1L));
    final ChangeEvent<ConfigMap> event = subscription.poll(5L, TimeUnit.SECONDS);
    assertNotNull(event);
    assertEquals(new ResourceIdentity("default", "b"), event.getIdentity());
  }

  @Test
  public void testWatch() throws Exception {
    final BlockingQueue<Watcher.Action> actions = new LinkedBlockingQueue<>();
    final CountDownLatch closed = new CountDownLatch(1);
    final Watch watch = this.manager.watch(Widget.TYPE, Scope.namespace("default"), new Watcher<ConfigMap>() {
        @Override
        public void eventReceived(final Watcher.Action action, final ConfigMap resource) {
          actions.add(action);
        }

        @Override
        public void onClose() {
          closed.countDown();
        }

        @Override
        public void onClose(final WatcherException cause) {
          closed.countDown();
        }
      });
    assertEquals(Watcher.Action.ADDED, actions.poll(5L, TimeUnit.SECONDS));
    this.backend.delete(Widget.TYPE, new ResourceIdentity("default", "a"));
    assertEquals(Watcher.Action.DELETED, actions.poll(5L, TimeUnit.SECONDS));
    watch.close();
    assertTrue(closed.await(5L, TimeUnit.SECONDS));
  }

  @Test
  public void testShutdownClosesEverything() throws Exception {
    final SharedPoller<Widget, ConfigMap> poller = this.manager.getPoller(Widget.TYPE);
    final Subscription<ConfigMap> subscription = this.manager.subscribe(Widget.TYPE, null);
    final CountDownLatch closed = new CountDownLatch(1);
    this.manager.watch(Widget.TYPE, null, new Watcher<ConfigMap>() {
        @Override
        public void eventReceived(final Watcher.Action action, final ConfigMap resource) {

        }

        @Override
        public void onClose() {
          closed.countDown();
        }

        @Override
        public void onClose(final WatcherException cause) {

        }
      });
    this.manager.shutdown();
    assertTrue(this.manager.isClosed());
    assertEquals(SharedPoller.State.STOPPED, poller.getState());
    assertTrue(subscription.isClosed());
    assertTrue(closed.await(5L, TimeUnit.SECONDS));
    try {
      this.manager.subscribe(Widget.TYPE, null);
      fail();
    } catch (final IllegalStateException expected) {

    }
    try {
      this.manager.register(new WidgetConverter());
      fail();
    } catch (final IllegalStateException expected) {

    }
    this.manager.close();
  }

}
