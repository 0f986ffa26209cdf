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
package org.microbean.kubernetes.poller.client;

import java.time.Duration;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicInteger;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestBackendCircuitBreaker {

  private static final ResourceIdentity IDENTITY = new ResourceIdentity("default", "missing");

  private final AtomicInteger invocations;

  public TestBackendCircuitBreaker() {
    super();
    this.invocations = new AtomicInteger();
  }

  private final String succeed() {
    this.invocations.incrementAndGet();
    return "ok";
  }

  private final String failure() throws BackendException {
    this.invocations.incrementAndGet();
    throw new BackendException("unavailable");
  }

  private final String notFound() throws BackendException {
    this.invocations.incrementAndGet();
    throw new ResourceNotFoundException("widgets", IDENTITY);
  }

  private final void failOnce(final BackendCircuitBreaker breaker) {
    try {
      breaker.execute(this::failure);
      fail();
    } catch (final CircuitOpenException expected) {
      fail("Unexpected rejection");
    } catch (final BackendException expected) {

    }
  }

  private final void open(final BackendCircuitBreaker breaker, final int threshold) {
    for (int i = 0; i < threshold; i++) {
      this.failOnce(breaker);
    }
    assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
  }

  @Test
  public void testOpensAfterThresholdConsecutiveFailuresAndRejectsWithoutCalling() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 3, 1, Duration.ofMinutes(1L));
    this.failOnce(breaker);
    this.failOnce(breaker);
    assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    this.failOnce(breaker);
    assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    assertEquals(3, this.invocations.get());
    try {
      breaker.execute(this::succeed);
      fail();
    } catch (final CircuitOpenException expected) {

    }
    assertEquals(3, this.invocations.get());
  }

  @Test
  public void testSuccessInterruptsAFailureStreak() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 3, 1, Duration.ofMinutes(1L));
    this.failOnce(breaker);
    this.failOnce(breaker);
    assertEquals("ok", breaker.execute(this::succeed));
    this.failOnce(breaker);
    this.failOnce(breaker);
    assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
  }

  @Test
  public void testNotFoundIsNotAFailure() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 2, 1, Duration.ofMinutes(1L));
    for (int i = 0; i < 5; i++) {
      try {
        breaker.execute(this::notFound);
        fail();
      } catch (final ResourceNotFoundException expected) {
        assertEquals(IDENTITY, expected.getIdentity());
      }
    }
    assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
  }

  @Test
  public void testSuccessfulTrialCallClosesTheBreaker() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 2, 1, Duration.ofMillis(100L));
    this.open(breaker, 2);
    Thread.sleep(250L);
    assertEquals("ok", breaker.execute(this::succeed));
    assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
  }

  @Test
  public void testFailedTrialCallReopensTheBreaker() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 2, 1, Duration.ofMillis(100L));
    this.open(breaker, 2);
    Thread.sleep(250L);
    this.failOnce(breaker);
    assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
    final int invocationsSoFar = this.invocations.get();
    try {
      breaker.execute(this::succeed);
      fail();
    } catch (final CircuitOpenException expected) {

    }
    assertEquals(invocationsSoFar, this.invocations.get());
  }

  @Test
  public void testAnyFailedTrialReopensEvenWithSeveralTrialsAllowed() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 2, 3, Duration.ofMillis(100L));
    this.open(breaker, 2);
    Thread.sleep(250L);
    assertEquals("ok", breaker.execute(this::succeed));
    assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
    this.failOnce(breaker);
    assertEquals(CircuitBreaker.State.OPEN, breaker.getState());
  }

  @Test
  public void testOnlyOneTrialCallIsAdmittedAtATime() throws Exception {
    final BackendCircuitBreaker breaker = new BackendCircuitBreaker("test", 2, 1, Duration.ofMillis(100L));
    this.open(breaker, 2);
    Thread.sleep(250L);

    final CountDownLatch trialStarted = new CountDownLatch(1);
    final CountDownLatch releaseTrial = new CountDownLatch(1);
    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<String> trial = executor.submit(() -> breaker.execute(() -> {
            trialStarted.countDown();
            try {
              releaseTrial.await();
            } catch (final InterruptedException interruptedException) {
              Thread.currentThread().interrupt();
            }
            return "trial";
          }));
      trialStarted.await();
      assertEquals(CircuitBreaker.State.HALF_OPEN, breaker.getState());
      try {
        breaker.execute(this::succeed);
        fail();
      } catch (final CircuitOpenException expected) {

      }
      releaseTrial.countDown();
      assertEquals("trial", trial.get(5L, TimeUnit.SECONDS));
      assertEquals(CircuitBreaker.State.CLOSED, breaker.getState());
    } finally {
      executor.shutdownNow();
    }
  }

}
