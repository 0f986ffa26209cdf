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

import java.time.Clock;
import java.time.Instant;

import java.util.Objects;

import java.util.logging.Level;
import java.util.logging.Logger;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

/**
 * A non-blocking token bucket that admits, on average, a fixed
 * number of calls per second while tolerating bursts of up to a fixed
 * capacity.
 *
 * <p>The bucket starts full.  Tokens accrue continuously at the
 * configured rate and never exceed the configured burst.  Each
 * successful {@linkplain #allow() admission} consumes exactly one
 * token.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.  One instance is normally shared by every caller
 * of a {@link ResilientClient}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
@ThreadSafe
public class RateLimiter {


  /*
   * Instance fields.
   */


  private final double ratePerNano;

  private final double burst;

  private final Clock clock;

  @GuardedBy("this")
  private double tokens;

  @GuardedBy("this")
  private long lastRefillNanos;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link RateLimiter} that uses the {@linkplain
   * Clock#systemUTC() system clock}.
   *
   * @param ratePerSecond the number of tokens added per second; must
   * be positive
   *
   * @param burst the capacity of the bucket; must be positive
   *
   * @exception IllegalArgumentException if either parameter is not
   * positive
   *
   * @see #RateLimiter(double, int, Clock)
   */
  public RateLimiter(final double ratePerSecond, final int burst) {
    this(ratePerSecond, burst, Clock.systemUTC());
  }

  /**
   * Creates a new {@link RateLimiter}.
   *
   * @param ratePerSecond the number of tokens added per second; must
   * be positive
   *
   * @param burst the capacity of the bucket; must be positive
   *
   * @param clock the {@link Clock} supplying the current time; must
   * not be {@code null}
   *
   * @exception NullPointerException if {@code clock} is {@code null}
   *
   * @exception IllegalArgumentException if either numeric parameter
   * is not positive
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public RateLimiter(final double ratePerSecond, final int burst, final Clock clock) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    if (!(ratePerSecond > 0.0d)) {
      throw new IllegalArgumentException("ratePerSecond <= 0: " + ratePerSecond);
    }
    if (burst <= 0) {
      throw new IllegalArgumentException("burst <= 0: " + burst);
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    this.ratePerNano = ratePerSecond / 1_000_000_000.0d;
    this.burst = burst;
    this.tokens = burst;
    this.lastRefillNanos = this.currentNanos();
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  /**
   * Attempts to take one token from this {@link RateLimiter} without
   * blocking.
   *
   * @return {@code true} if a token was available and has been
   * consumed; {@code false} if the caller should be refused
   */
  public final synchronized boolean allow() {
    this.refill();
    if (this.tokens >= 1.0d) {
      this.tokens -= 1.0d;
      return true;
    }
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "allow", "Rate limit exceeded");
    }
    return false;
  }

  /**
   * Returns the number of whole tokens currently available.
   *
   * @return the number of available tokens
   */
  public final synchronized int getAvailableTokens() {
    this.refill();
    return (int)this.tokens;
  }

  @GuardedBy("this")
  private final void refill() {
    final long now = this.currentNanos();
    final long elapsed = now - this.lastRefillNanos;
    if (elapsed > 0L) {
      this.tokens = Math.min(this.burst, this.tokens + elapsed * this.ratePerNano);
    }
    // The clock may step backwards; refill resumes from the new reading.
    this.lastRefillNanos = now;
  }

  private final long currentNanos() {
    final Instant now = this.clock.instant();
    return now.getEpochSecond() * 1_000_000_000L + now.getNano();
  }

}
