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

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class TestBackendClientConfiguration {

  public TestBackendClientConfiguration() {
    super();
  }

  @Test
  public void testDefaults() {
    final BackendClientConfiguration configuration = BackendClientConfiguration.defaults();
    assertEquals(100.0d, configuration.getRateLimit(), 0.0d);
    assertEquals(200, configuration.getRateBurst());
    assertEquals(5, configuration.getFailureThreshold());
    assertEquals(1, configuration.getHalfOpenTrials());
    assertEquals(Duration.ofSeconds(60L), configuration.getCooldown());
    assertEquals(Duration.ofSeconds(30L), configuration.getRequestTimeout());
    assertEquals(Duration.ofMinutes(5L), configuration.getCacheTimeToLive());
    assertEquals(Duration.ofMinutes(10L), configuration.getCacheCleanupInterval());
    assertNull(configuration.getCacheMaxStaleness());
  }

  @Test
  public void testEnvironmentOverridesProperties() {
    final Properties properties = new Properties();
    properties.setProperty("backend.rate_limit", "5");
    properties.setProperty("backend.rate_burst", "7");
    properties.setProperty("backend.cb_timeout", "30s");
    final Map<String, String> environment = new HashMap<>();
    environment.put("BACKEND_RATE_BURST", "9");
    environment.put("BACKEND_REQUEST_TIMEOUT", "500ms");
    environment.put("BACKEND_CACHE_MAX_STALENESS", "PT1H");
    final BackendClientConfiguration configuration = BackendClientConfiguration.load(properties, environment);
    assertEquals(5.0d, configuration.getRateLimit(), 0.0d);
    assertEquals(9, configuration.getRateBurst());
    assertEquals(Duration.ofSeconds(30L), configuration.getCooldown());
    assertEquals(Duration.ofMillis(500L), configuration.getRequestTimeout());
    assertEquals(Duration.ofHours(1L), configuration.getCacheMaxStaleness());
    assertEquals(Duration.ofMinutes(5L), configuration.getCacheTimeToLive());
  }

  @Test
  public void testParseDuration() {
    assertEquals(Duration.ofMillis(500L), BackendClientConfiguration.parseDuration("500ms"));
    assertEquals(Duration.ofSeconds(10L), BackendClientConfiguration.parseDuration("10s"));
    assertEquals(Duration.ofMinutes(5L), BackendClientConfiguration.parseDuration(" 5m "));
    assertEquals(Duration.ofHours(1L), BackendClientConfiguration.parseDuration("1h"));
    assertEquals(Duration.ofSeconds(90L), BackendClientConfiguration.parseDuration("PT1M30S"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnparseableDurationIsRejected() {
    BackendClientConfiguration.parseDuration("ten seconds");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNonPositiveBurstIsRejected() {
    final Map<String, String> environment = new HashMap<>();
    environment.put("BACKEND_RATE_BURST", "0");
    BackendClientConfiguration.load(null, environment);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroRequestTimeoutIsRejected() {
    new BackendClientConfiguration.Builder().requestTimeout(Duration.ZERO).build();
  }

}
