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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

import net.jcip.annotations.Immutable;

import org.microbean.kubernetes.poller.client.BackendClientConfiguration;

/**
 * The immutable settings of a {@link PollerManager} and of the
 * {@link SharedPoller}s it creates.
 *
 * <p>Instances are made with a {@link Builder}, or {@linkplain
 * #load(Properties, Map) loaded} from a {@link Properties} source
 * whose values may be overridden by environment variables:</p>
 *
 * <table>
 * <caption>Configuration keys</caption>
 * <tr><th>Property</th><th>Environment variable</th><th>Default</th></tr>
 * <tr><td>{@code watch.polling_interval}</td><td>{@code WATCH_POLLING_INTERVAL}</td><td>{@code 5s}</td></tr>
 * <tr><td>{@code watch.max_backoff}</td><td>{@code WATCH_MAX_BACKOFF}</td><td>{@code 60s}</td></tr>
 * <tr><td>{@code watch.queue_capacity}</td><td>{@code WATCH_QUEUE_CAPACITY}</td><td>{@code 100}</td></tr>
 * <tr><td>{@code watch.threads}</td><td>{@code WATCH_THREADS}</td><td>{@code 2}</td></tr>
 * <tr><td>{@code watch.shutdown_timeout}</td><td>{@code WATCH_SHUTDOWN_TIMEOUT}</td><td>{@code 60s}</td></tr>
 * </table>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see BackendClientConfiguration#parseDuration(String)
 */
@Immutable
public final class PollerConfiguration {

  private static final PollerConfiguration DEFAULTS = new Builder().build();

  private final Duration pollInterval;

  private final Duration maxBackoff;

  private final int queueCapacity;

  private final int threadCount;

  private final Duration shutdownTimeout;

  private PollerConfiguration(final Builder builder) {
    super();
    this.pollInterval = builder.pollInterval;
    this.maxBackoff = builder.maxBackoff;
    this.queueCapacity = builder.queueCapacity;
    this.threadCount = builder.threadCount;
    this.shutdownTimeout = builder.shutdownTimeout;
  }

  /**
   * Returns the delay between the end of one poll cycle and the start
   * of the next while polling succeeds.
   *
   * @return a positive {@link Duration}
   */
  public final Duration getPollInterval() {
    return this.pollInterval;
  }

  /**
   * Returns the longest delay between poll cycles while polling keeps
   * failing.
   *
   * @return a positive {@link Duration} no shorter than the
   * {@linkplain #getPollInterval() poll interval}
   */
  public final Duration getMaxBackoff() {
    return this.maxBackoff;
  }

  public final int getQueueCapacity() {
    return this.queueCapacity;
  }

  public final int getThreadCount() {
    return this.threadCount;
  }

  public final Duration getShutdownTimeout() {
    return this.shutdownTimeout;
  }

  /**
   * Checks that every setting of this {@link PollerConfiguration} is
   * usable.
   *
   * @exception IllegalArgumentException if a setting is invalid
   */
  public final void validate() {
    requirePositive(this.pollInterval, "polling_interval");
    requirePositive(this.maxBackoff, "max_backoff");
    if (this.maxBackoff.compareTo(this.pollInterval) < 0) {
      throw new IllegalArgumentException("max_backoff must not be shorter than polling_interval");
    }
    if (this.queueCapacity <= 0) {
      throw new IllegalArgumentException("queue_capacity must be positive");
    }
    if (this.threadCount <= 0) {
      throw new IllegalArgumentException("threads must be positive");
    }
    requirePositive(this.shutdownTimeout, "shutdown_timeout");
  }

  @Override
  public final String toString() {
    return "PollerConfiguration[pollInterval=" + this.pollInterval +
      ", maxBackoff=" + this.maxBackoff +
      ", queueCapacity=" + this.queueCapacity +
      ", threadCount=" + this.threadCount +
      ", shutdownTimeout=" + this.shutdownTimeout + "]";
  }

  public static final PollerConfiguration defaults() {
    return DEFAULTS;
  }

  /**
   * Loads a {@link PollerConfiguration} from the supplied {@link
   * Properties}, letting any of the supplied environment variables
   * override them.
   *
   * @param properties the {@link Properties} to read; may be {@code
   * null}
   *
   * @param environment the environment variables to read; may be
   * {@code null}
   *
   * @return a non-{@code null}, {@linkplain #validate() valid} {@link
   * PollerConfiguration}
   *
   * @exception IllegalArgumentException if a value cannot be parsed
   * or is invalid
   */
  public static final PollerConfiguration load(final Properties properties, final Map<String, String> environment) {
    final Properties p = properties == null ? new Properties() : properties;
    final Map<String, String> env = environment == null ? Collections.<String, String>emptyMap() : environment;
    final Builder builder = new Builder();
    String value = lookup(p, env, "watch.polling_interval", "WATCH_POLLING_INTERVAL");
    if (value != null) {
      builder.pollInterval(BackendClientConfiguration.parseDuration(value));
    }
    value = lookup(p, env, "watch.max_backoff", "WATCH_MAX_BACKOFF");
    if (value != null) {
      builder.maxBackoff(BackendClientConfiguration.parseDuration(value));
    }
    value = lookup(p, env, "watch.queue_capacity", "WATCH_QUEUE_CAPACITY");
    if (value != null) {
      builder.queueCapacity(parseInt(value, "queue_capacity"));
    }
    value = lookup(p, env, "watch.threads", "WATCH_THREADS");
    if (value != null) {
      builder.threadCount(parseInt(value, "threads"));
    }
    value = lookup(p, env, "watch.shutdown_timeout", "WATCH_SHUTDOWN_TIMEOUT");
    if (value != null) {
      builder.shutdownTimeout(BackendClientConfiguration.parseDuration(value));
    }
    return builder.build();
  }

  private static final String lookup(final Properties properties,
                                     final Map<String, String> environment,
                                     final String propertyName,
                                     final String environmentVariableName) {
    String returnValue = environment.get(environmentVariableName);
    if (returnValue == null || returnValue.trim().isEmpty()) {
      returnValue = properties.getProperty(propertyName);
    }
    return returnValue == null || returnValue.trim().isEmpty() ? null : returnValue.trim();
  }

  private static final int parseInt(final String value, final String settingName) {
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

  /**
   * A builder of {@link PollerConfiguration}s, initially populated
   * with every default setting.
   *
   * <p>Instances of this class are not safe for concurrent use.</p>
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  public static final class Builder {

    private Duration pollInterval;

    private Duration maxBackoff;

    private int queueCapacity;

    private int threadCount;

    private Duration shutdownTimeout;

    public Builder() {
      super();
      this.pollInterval = Duration.ofSeconds(5L);
      this.maxBackoff = Duration.ofSeconds(60L);
      this.queueCapacity = 100;
      this.threadCount = 2;
      this.shutdownTimeout = Duration.ofSeconds(60L);
    }

    public Builder pollInterval(final Duration pollInterval) {
      this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
      return this;
    }

    public Builder maxBackoff(final Duration maxBackoff) {
      this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
      return this;
    }

    public Builder queueCapacity(final int queueCapacity) {
      this.queueCapacity = queueCapacity;
      return this;
    }

    public Builder threadCount(final int threadCount) {
      this.threadCount = threadCount;
      return this;
    }

    public Builder shutdownTimeout(final Duration shutdownTimeout) {
      this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      return this;
    }

    /**
     * Builds a new {@link PollerConfiguration}.
     *
     * @return a new, {@linkplain PollerConfiguration#validate() valid}
     * {@link PollerConfiguration}
     *
     * @exception IllegalArgumentException if any setting is invalid
     */
    public PollerConfiguration build() {
      final PollerConfiguration returnValue = new PollerConfiguration(this);
      returnValue.validate();
      return returnValue;
    }

  }

}
