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

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestResultCache {

  private MutableClock clock;

  private ResultCache<String, String> cache;

  public TestResultCache() {
    super();
  }

  @Before
  public void setUp() {
    this.clock = new MutableClock();
    this.cache = new ResultCache<>(Duration.ofMinutes(5L), this.clock);
  }

  @Test
  public void testSuccessfulFetchIsFreshAndCached() throws Exception {
    final CacheResult<String> result = this.cache.getOrFetch("a", () -> "1");
    assertEquals("1", result.getValue());
    assertFalse(result.isStale());
    assertEquals("1", this.cache.getIfPresent("a"));
    assertTrue(this.cache.isFresh("a"));
  }

  @Test
  public void testFetchIsAlwaysInvokedEvenWhenFresh() throws Exception {
    this.cache.getOrFetch("a", () -> "1");
    final CacheResult<String> result = this.cache.getOrFetch("a", () -> "2");
    assertEquals("2", result.getValue());
    assertFalse(result.isStale());
  }

  @Test
  public void testExpiredValueIsServedStaleWhenFetchFails() throws Exception {
    this.cache.getOrFetch("a", () -> "1");
    this.clock.advance(Duration.ofMinutes(6L));
    assertFalse(this.cache.isFresh("a"));
    final CacheResult<String> result = this.cache.getOrFetch("a", () -> {
        throw new BackendException("down");
      });
    assertEquals("1", result.getValue());
    assertTrue(result.isStale());
  }

  @Test
  public void testFailureWithNothingCachedPropagates() {
    final BackendException failure = new BackendException("down");
    try {
      this.cache.getOrFetch("a", () -> {
          throw failure;
        });
      fail();
    } catch (final BackendException expected) {
      assertSame(failure, expected);
    }
  }

  @Test
  public void testNotFoundInvalidatesAndPropagates() throws Exception {
    this.cache.getOrFetch("a", () -> "1");
    try {
      this.cache.getOrFetch("a", () -> {
          throw new ResourceNotFoundException("widgets", new ResourceIdentity(null, "a"));
        });
      fail();
    } catch (final ResourceNotFoundException expected) {

    }
    assertNull(this.cache.getIfPresent("a"));
    assertEquals(0, this.cache.size());
  }

  @Test
  public void testEvictStaleRemovesOnlyLongExpiredEntries() throws Exception {
    this.cache.getOrFetch("old", () -> "1");
    this.clock.advance(Duration.ofMinutes(10L));
    this.cache.getOrFetch("new", () -> "2");
    this.clock.advance(Duration.ofMinutes(6L));
    // "old" expired 11 minutes ago; "new" expired 1 minute ago.
    assertEquals(1, this.cache.evictStale(Duration.ofMinutes(5L)));
    assertNull(this.cache.getIfPresent("old"));
    assertEquals("2", this.cache.getIfPresent("new"));
  }

  @Test
  public void testInvalidateAll() throws Exception {
    this.cache.getOrFetch("widgets:a", () -> "1");
    this.cache.getOrFetch("widgets:b", () -> "2");
    this.cache.getOrFetch("gadgets:a", () -> "3");
    this.cache.invalidateAll(key -> key.startsWith("widgets:"));
    assertEquals(1, this.cache.size());
    assertEquals("3", this.cache.getIfPresent("gadgets:a"));
  }

}
