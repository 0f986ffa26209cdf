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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestRateLimiter {

  public TestRateLimiter() {
    super();
  }

  @Test
  public void testBurstPlusOneCallsYieldsExactlyOneDenial() {
    final RateLimiter limiter = new RateLimiter(10.0d, 5, new MutableClock());
    int denials = 0;
    for (int i = 0; i < 6; i++) {
      if (!limiter.allow()) {
        denials++;
      }
    }
    assertEquals(1, denials);
  }

  @Test
  public void testTokensAccrueAtTheConfiguredRateUpToTheBurst() {
    final MutableClock clock = new MutableClock();
    final RateLimiter limiter = new RateLimiter(10.0d, 5, clock);
    for (int i = 0; i < 5; i++) {
      assertTrue(limiter.allow());
    }
    assertFalse(limiter.allow());

    clock.advance(Duration.ofMillis(50L));
    assertFalse(limiter.allow());

    clock.advance(Duration.ofMillis(50L));
    assertTrue(limiter.allow());
    assertFalse(limiter.allow());

    clock.advance(Duration.ofSeconds(10L));
    assertEquals(5, limiter.getAvailableTokens());
  }

  @Test
  public void testRefillResumesAfterTheClockStepsBackwards() {
    final MutableClock clock = new MutableClock();
    final RateLimiter limiter = new RateLimiter(10.0d, 5, clock);
    clock.advance(Duration.ofHours(-1L));
    for (int i = 0; i < 5; i++) {
      assertTrue(limiter.allow());
    }
    assertFalse(limiter.allow());

    clock.advance(Duration.ofMillis(100L));
    assertTrue(limiter.allow());
    assertFalse(limiter.allow());

    clock.advance(Duration.ofSeconds(30L));
    assertEquals(5, limiter.getAvailableTokens());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroBurstIsRejected() {
    new RateLimiter(1.0d, 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroRateIsRejected() {
    new RateLimiter(0.0d, 1);
  }

}
