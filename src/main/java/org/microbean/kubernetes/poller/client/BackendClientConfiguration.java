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
import java.time.format.DateTimeParseException;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.jcip.annotations.Immutable;

/**
 * The immutable settings of a {@link ResilientClient}: its rate
 * limit, its circuit breaker, its request timeout and its result
 * caches.
 *
 * <p>Instances are made with a {@link Builder}, or {@linkplain
 * #load(Properties, Map) loaded} from a {@link Properties} source
 * whose values may be overridden by environment variables.  The
 * recognized keys are:</p>
 *
 * <table>
 * <caption>Configuration keys</caption>
 * <tr><th>Property</th><th>Environment variable</th><th>Default</th></tr>
 * <tr><td>{@code backend.rate_limit}</td><td>{@code BACKEND_RATE_LIMIT}</td><td>{@code 100}</td></tr>
 * <tr><td>{@code backend.rate_burst}</td><td>{@code BACKEND_RATE_BURST}</td><td>{@code 200}</td></tr>
 * <tr><td>{@code backend.cb_failure_threshold}</td><td>{@code BACKEND_CB_FAILURE_THRESHOLD}</td><td>{@code 5}</td></tr>
 * <tr><td>{@code backend.cb_max_requests}</td><td>{@code BACKEND_CB_MAX_REQUESTS}</td><td>{@code 1}</td></tr>
 * <tr><td>{@code backend.cb_timeout}</td><td>{@code BACKEND_CB_TIMEOUT}</td><td>{@code 60s}</td></tr>
 * <tr><td>{@code backend.request_timeout}</td><td>{@code BACKEND_REQUEST_TIMEOUT}</td><td>{@code 30s}</td></tr>
 * <tr><td>{@code backend.cache_default_ttl}</td><td>{@code BACKEND_CACHE_DEFAULT_TTL}</td><td>{@code 5m}</td></tr>
 * <tr><td>{@code backend.cache_cleanup_interval}</td><td>{@code BACKEND_CACHE_CLEANUP_INTERVAL}</td><td>{@code 10m}</td></tr>
 * <tr><td>{@code backend.cache_max_staleness}</td><td>{@code BACKEND_CACHE_MAX_STALENESS}</td><td>unbounded</td></tr>
 * </table>
 *
 * <p>Durations are written either as a whole number followed by one
 * of {@code ms}, {@code s}, {@code m} or {@code h}, or in {@linkplain
 * Duration#parse(CharSequence) ISO-8601 form}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #validate()
 */
@Immutable
public final class BackendClientConfiguration {


  /*
   * Static fields.
   */


  private static final Pattern DURATION_PATTERN = Pattern.compile("(\\d+)(ms|s|m|h)");

  private static final BackendClientConfiguration DEFAULTS = new Builder().build();


  /*
   * Instance fields.
   */


  private final double rateLimit;

  private final int rateBurst;

  private final int failureThreshold;

  private final int halfOpenTrials;

  private final Duration cooldown;

  private final Duration requestTimeout;

  private final Duration cacheTimeToLive;

  private final Duration cacheCleanupInterval;

  private final Duration cacheMaxStaleness;


  /*
   * Constructors.
   */


  private BackendClientConfiguration(final Builder builder) {
    super();
    this.rateLimit = builder.rateLimit;
    this.rateBurst = builder.rateBurst;
    this.failureThreshold = builder.failureThreshold;
    this.halfOpenTrials = builder.halfOpenTrials;
    this.cooldown = builder.cooldown;
    this.requestTimeout = builder.requestTimeout;
    this.cacheTimeToLive = builder.cacheTimeToLive;
    this.cacheCleanupInterval = builder.cacheCleanupInterval;
    this.cacheMaxStaleness = builder.cacheMaxStaleness;
  }


  /*
   * Instance methods.
   */


  public final double getRateLimit() {
    return this.rateLimit;
  }

  public final int getRateBurst() {
    return this.rateBurst;
  }

  public final int getFailureThreshold() {
    return this.failureThreshold;
  }

  public final int getHalfOpenTrials() {
    return this.halfOpenTrials;
  }

  public final Duration getCooldown() {
    return this.cooldown;
  }

  public final Duration getRequestTimeout() {
    return this.requestTimeout;
  }

  public final Duration getCacheTimeToLive() {
    return this.cacheTimeToLive;
  }

  public final Duration getCacheCleanupInterval() {
    return this.cacheCleanupInterval;
  }

  /**
   * Returns how long past its expiry a cached result may still be
   * served, or {@code null} if cached results may be served
   * indefinitely.
   *
   * @return the maximum staleness, or {@code null}
   */
  public final Duration getCacheMaxStaleness() {
    return this.cacheMaxStaleness;
  }

  /**
   * Checks that every setting of this {@link
   * BackendClientConfiguration} is usable.
   *
   * @exception IllegalArgumentException if any numeric setting or
   * duration is not positive
   */
  public final void validate() {
    if (!(this.rateLimit > 0.0d)) {
      throw new IllegalArgumentException("rate_limit must be positive");
    }
    if (this.rateBurst <= 0) {
      throw new IllegalArgumentException("rate_burst must be positive");
    }
    if (this.failureThreshold <= 0) {
      throw new IllegalArgumentException("cb_failure_threshold must be positive");
    }
    if (this.halfOpenTrials <= 0) {
      throw new IllegalArgumentException("cb_max_requests must be positive");
    }
    requirePositive(this.cooldown, "cb_timeout");
    requirePositive(this.requestTimeout, "request_timeout");
    requirePositive(this.cacheTimeToLive, "cache_default_ttl");
    requirePositive(this.cacheCleanupInterval, "cache_cleanup_interval");
    if (this.cacheMaxStaleness != null && this.cacheMaxStaleness.isNegative()) {
      throw new IllegalArgumentException("cache_max_staleness cannot be negative");
    }
  }

  @Override
  public final String toString() {
    return new StringBuilder("BackendClientConfiguration[")
      .append("rateLimit=").append(this.rateLimit)
      .append(", rateBurst=").append(this.rateBurst)
      .append(", failureThreshold=").append(this.failureThreshold)
      .append(", halfOpenTrials=").append(this.halfOpenTrials)
      .append(", cooldown=").append(this.cooldown)
      .append(", requestTimeout=").append(this.requestTimeout)
      .append(", cacheTimeToLive=").append(this.cacheTimeToLive)
      .append(", cacheCleanupInterval=").append(this.cacheCleanupInterval)
      .append(", cacheMaxStaleness=").append(this.cacheMaxStaleness)
      .append("]")
      .toString();
  }


  /*
   * Static methods.
   */


  /**
   * Returns a {@link BackendClientConfiguration} holding every
   * default setting.
   *
   * @return a non-{@code null} {@link BackendClientConfiguration}
   */
  public static final BackendClientConfiguration defaults() {
    return DEFAULTS;
  }

  /**
   * Loads a {@link BackendClientConfiguration} from the current
   * process' environment variables alone.
   *
   * @return a non-{@code null}, {@linkplain #validate() valid} {@link
   * BackendClientConfiguration}
   *
   * @exception IllegalArgumentException if a value cannot be parsed
   * or is invalid
   *
   * @see #load(Properties, Map)
   */
  public static final BackendClientConfiguration fromEnvironment() {
    return load(null, System.getenv());
  }

  /**
   * Loads a {@link BackendClientConfiguration} from the supplied
   * {@link Properties}, letting any of the supplied environment
   * variables override them.
   *
   * <p>Settings present in neither source take their default
   * values.</p>
   *
   * @param properties the {@link Properties} to read; may be {@code
   * null}
   *
   * @param environment the environment variables to read; may be
   * {@code null}
   *
   * @return a non-{@code null}, {@linkplain #validate() valid} {@link
   * BackendClientConfiguration}
   *
   * @exception IllegalArgumentException if a value cannot be parsed
   * or is invalid
   */
  public static final BackendClientConfiguration load(final Properties properties, final Map<String, String> environment) {
    final Properties p = properties == null ? new Properties() : properties;
    final Map<String, String> env = environment == null ? Collections.<String, String>emptyMap() : environment;
    final Builder builder = new Builder();
    String value = lookup(p, env, "backend.rate_limit", "BACKEND_RATE_LIMIT");
    if (value != null) {
      try {
        builder.rateLimit(Double.parseDouble(value));
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException("Invalid rate_limit: " + value, e);
      }
    }
    value = lookup(p, env, "backend.rate_burst", "BACKEND_RATE_BURST");
    if (value != null) {
      builder.rateBurst(parseInt(value, "rate_burst"));
    }
    value = lookup(p, env, "backend.cb_failure_threshold", "BACKEND_CB_FAILURE_THRESHOLD");
    if (value != null) {
      builder.failureThreshold(parseInt(value, "cb_failure_threshold"));
    }
    value = lookup(p, env, "backend.cb_max_requests", "BACKEND_CB_MAX_REQUESTS");
    if (value != null) {
      builder.halfOpenTrials(parseInt(value, "cb_max_requests"));
    }
    value = lookup(p, env, "backend.cb_timeout", "BACKEND_CB_TIMEOUT");
    if (value != null) {
      builder.cooldown(parseDuration(value));
    }
    value = lookup(p, env, "backend.request_timeout", "BACKEND_REQUEST_TIMEOUT");
    if (value != null) {
      builder.requestTimeout(parseDuration(value));
    }
    value = lookup(p, env, "backend.cache_default_ttl", "BACKEND_CACHE_DEFAULT_TTL");
    if (value != null) {
      builder.cacheTimeToLive(parseDuration(value));
    }
    value = lookup(p, env, "backend.cache_cleanup_interval", "BACKEND_CACHE_CLEANUP_INTERVAL");
    if (value != null) {
      builder.cacheCleanupInterval(parseDuration(value));
    }
    value = lookup(p, env, "backend.cache_max_staleness", "BACKEND_CACHE_MAX_STALENESS");
    if (value != null) {
      builder.cacheMaxStaleness(parseDuration(value));
    }
    return builder.build();
  }

  /**
   * Parses a duration written either as a whole number followed by
   * one of {@code ms}, {@code s}, {@code m} or {@code h} (for
   * example, {@code 500ms} or {@code 5m}), or in ISO-8601 form (for
   * example, {@code PT5M}).
   *
   * @param text the text to parse; must not be {@code null}
   *
   * @return a non-{@code null} {@link Duration}
   *
   * @exception NullPointerException if {@code text} is {@code null}
   *
   * @exception IllegalArgumentException if {@code text} cannot be
   * parsed
   */
  public static final Duration parseDuration(final String text) {
    Objects.requireNonNull(text, "text");
    final String trimmed = text.trim();
    if (!trimmed.isEmpty() && (trimmed.charAt(0) == 'P' || trimmed.charAt(0) == 'p')) {
      try {
        return Duration.parse(trimmed);
      } catch (final DateTimeParseException e) {
        throw new IllegalArgumentException("Invalid duration: " + text, e);
      }
    }
    final Matcher matcher = DURATION_PATTERN.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Invalid duration: " + text);
    }
    final long amount;
    try {
      amount = Long.parseLong(matcher.group(1));
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration: " + text, e);
    }
    switch (matcher.group(2)) {
    case "ms":
      return Duration.ofMillis(amount);
    case "s":
      return Duration.ofSeconds(amount);
    case "m":
      return Duration.ofMinutes(amount);
    case "h":
      return Duration.ofHours(amount);
    default:
      throw new IllegalArgumentException("Invalid duration: " + text);
    }
  }

  static final String lookup(final Properties properties,
                             final Map<String, String> environment,
                             final String propertyName,
                             final String environmentVariableName) {
    String returnValue = environment.get(environmentVariableName);
    if (returnValue == null || returnValue.trim().isEmpty()) {
      returnValue = properties.getProperty(propertyName);
    }
    if (returnValue != null) {
      returnValue = returnValue.trim();
      if (returnValue.isEmpty()) {
        returnValue = null;
      }
    }
    return returnValue;
  }

  static final int parseInt(final String value, final String settingName) {
    try {
      return Integer.parseInt(value);
    } catch (final NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + settingName + ": " + value, e);
    }
  }

  private static final void requirePositive(final Duration duration, final String settingName) {
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException(settingName + " must be positive");
    }
  }


  /*
   * Inner and nested classes.
   */


  /**
   * A builder of {@link BackendClientConfiguration}s, initially
   * populated with every default setting.
   *
   * <p>Instances of this class are not safe for concurrent use.</p>
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  public static final class Builder {

    private double rateLimit;

    private int rateBurst;

    private int failureThreshold;

    private int halfOpenTrials;

    private Duration cooldown;

    private Duration requestTimeout;

    private Duration cacheTimeToLive;

    private Duration cacheCleanupInterval;

    private Duration cacheMaxStaleness;

    public Builder() {
      super();
      this.rateLimit = 100.0d;
      this.rateBurst = 200;
      this.failureThreshold = 5;
      this.halfOpenTrials = 1;
      this.cooldown = Duration.ofSeconds(60L);
      this.requestTimeout = Duration.ofSeconds(30L);
      this.cacheTimeToLive = Duration.ofMinutes(5L);
      this.cacheCleanupInterval = Duration.ofMinutes(10L);
    }

    public Builder rateLimit(final double rateLimit) {
      this.rateLimit = rateLimit;
      return this;
    }

    public Builder rateBurst(final int rateBurst) {
      this.rateBurst = rateBurst;
      return this;
    }

    public Builder failureThreshold(final int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    public Builder halfOpenTrials(final int halfOpenTrials) {
      this.halfOpenTrials = halfOpenTrials;
      return this;
    }

    public Builder cooldown(final Duration cooldown) {
      this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
      return this;
    }

    public Builder requestTimeout(final Duration requestTimeout) {
      this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
      return this;
    }

    public Builder cacheTimeToLive(final Duration cacheTimeToLive) {
      this.cacheTimeToLive = Objects.requireNonNull(cacheTimeToLive, "cacheTimeToLive");
      return this;
    }

    public Builder cacheCleanupInterval(final Duration cacheCleanupInterval) {
      this.cacheCleanupInterval = Objects.requireNonNull(cacheCleanupInterval, "cacheCleanupInterval");
      return this;
    }

    /**
     * Sets how long past its expiry a cached result may still be
     * served.
     *
     * @param cacheMaxStaleness the maximum staleness; may be {@code
     * null} in which case cached results may be served indefinitely
     *
     * @return this {@link Builder}
     */
    public Builder cacheMaxStaleness(final Duration cacheMaxStaleness) {
      this.cacheMaxStaleness = cacheMaxStaleness;
      return this;
    }

    /**
     * Builds a new {@link BackendClientConfiguration}.
     *
     * @return a new, {@linkplain BackendClientConfiguration#validate()
     * valid} {@link BackendClientConfiguration}
     *
     * @exception IllegalArgumentException if any setting is invalid
     */
    public BackendClientConfiguration build() {
      final BackendClientConfiguration returnValue = new BackendClientConfiguration(this);
      returnValue.validate();
      return returnValue;
    }

  }

}
