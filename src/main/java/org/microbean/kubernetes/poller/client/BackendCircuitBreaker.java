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

import java.util.Objects;

import java.util.concurrent.TimeUnit;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;

import io.github.resilience4j.circuitbreaker.event.CircuitBreakerOnStateTransitionEvent;

import net.jcip.annotations.ThreadSafe;

/**
 * A circuit breaker guarding calls to a {@link BackendClient}.
 *
 * <p>A {@link BackendCircuitBreaker} starts {@linkplain
 * CircuitBreaker.State#CLOSED closed}.  After a configurable number
 * of consecutive failed calls it {@linkplain
 * CircuitBreaker.State#OPEN opens} and rejects every call with a
 * {@link CircuitOpenException} for a cooldown period.  Once the
 * cooldown elapses it becomes {@linkplain
 * CircuitBreaker.State#HALF_OPEN half-open} and admits a configurable
 * number of trial calls: if they all succeed the breaker closes
 * again, and if any one of them fails it opens again at once.</p>
 *
 * <p>A {@link ResourceNotFoundException} is a legitimate answer from
 * the backend and is never counted as a failure.</p>
 *
 * <p>The underlying state machine is a resilience4j {@link
 * CircuitBreaker} whose state transitions are logged at {@link
 * Level#INFO}.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #execute(BackendCall)
 */
@ThreadSafe
public class BackendCircuitBreaker {


  /*
   * Instance fields.
   */


  private final CircuitBreaker circuitBreaker;

  private final Object outcomeLock;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link BackendCircuitBreaker}.
   *
   * @param name the name of this breaker, used in log records and
   * exception messages; must not be {@code null}
   *
   * @param failureThreshold the number of consecutive failures that
   * opens the breaker; must be positive
   *
   * @param halfOpenTrials the number of consecutive successful trial
   * calls that closes a half-open breaker; must be positive
   *
   * @param cooldown how long the breaker stays open before admitting
   * trial calls; must not be {@code null} and must be positive
   *
   * @exception NullPointerException if {@code name} or {@code
   * cooldown} is {@code null}
   *
   * @exception IllegalArgumentException if a numeric parameter is not
   * positive
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public BackendCircuitBreaker(final String name,
                               final int failureThreshold,
                               final int halfOpenTrials,
                               final Duration cooldown) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(cooldown, "cooldown");
    if (failureThreshold <= 0) {
      throw new IllegalArgumentException("failureThreshold <= 0: " + failureThreshold);
    }
    if (halfOpenTrials <= 0) {
      throw new IllegalArgumentException("halfOpenTrials <= 0: " + halfOpenTrials);
    }
    if (cooldown.isNegative() || cooldown.isZero()) {
      throw new IllegalArgumentException("cooldown <= 0: " + cooldown);
    }
    // A count-based window of N calls with a 100% threshold opens
    // after exactly N consecutive failures.
    final CircuitBreakerConfig config = CircuitBreakerConfig.custom()
      .slidingWindowType(SlidingWindowType.COUNT_BASED)
      .slidingWindowSize(failureThreshold)
      .minimumNumberOfCalls(failureThreshold)
      .failureRateThreshold(100.0f)
      .slowCallRateThreshold(100.0f)
      .slowCallDurationThreshold(Duration.ofDays(1L))
      .waitDurationInOpenState(cooldown)
      .permittedNumberOfCallsInHalfOpenState(halfOpenTrials)
      .automaticTransitionFromOpenToHalfOpenEnabled(false)
      .ignoreExceptions(ResourceNotFoundException.class)
      .build();
    this.circuitBreaker = CircuitBreaker.of(name, config);
    this.outcomeLock = new Object();
    this.circuitBreaker.getEventPublisher().onStateTransition(this::stateTransitioned);
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  /**
   * Returns the name of this {@link BackendCircuitBreaker}.
   *
   * @return the name; never {@code null}
   */
  public final String getName() {
    return this.circuitBreaker.getName();
  }

  /**
   * Returns the current state of this {@link BackendCircuitBreaker}.
   *
   * <p>An open breaker whose cooldown has elapsed keeps reporting
   * {@link CircuitBreaker.State#OPEN} until the next call attempt
   * moves it to {@link CircuitBreaker.State#HALF_OPEN}.</p>
   *
   * @return the current {@link CircuitBreaker.State}; never {@code
   * null}
   */
  public final CircuitBreaker.State getState() {
    return this.circuitBreaker.getState();
  }

  /**
   * Invokes the supplied {@link BackendCall} if this breaker permits
   * it, recording its outcome.
   *
   * @param <V> the type of value returned by the call
   *
   * @param call the {@link BackendCall} to invoke; must not be {@code
   * null}
   *
   * @return the result of the call
   *
   * @exception NullPointerException if {@code call} is {@code null}
   *
   * @exception CircuitOpenException if the breaker is open, or is
   * half-open and has already admitted all of its trial calls; the
   * call is not invoked in this case
   *
   * @exception BackendException if the call itself fails
   */
  public final <V> V execute(final BackendCall<? extends V> call) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "execute";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, call);
    }
    Objects.requireNonNull(call, "call");
    if (!this.circuitBreaker.tryAcquirePermission()) {
      throw new CircuitOpenException("Circuit breaker " + this.getName() + " is " + this.getState());
    }
    final long start = System.nanoTime();
    final V returnValue;
    try {
      returnValue = call.call();
    } catch (final ResourceNotFoundException notFound) {
      // Ignored by configuration; this releases the permission.
      this.circuitBreaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, notFound);
      throw notFound;
    } catch (final BackendException | RuntimeException | Error failure) {
      this.recordFailure(System.nanoTime() - start, failure);
      throw failure;
    }
    this.circuitBreaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  private final void recordFailure(final long durationNanos, final Throwable failure) {
    synchronized (this.outcomeLock) {
      final CircuitBreaker.State priorState = this.circuitBreaker.getState();
      this.circuitBreaker.onError(durationNanos, TimeUnit.NANOSECONDS, failure);
      // One failed trial is enough to reopen a half-open breaker.
      if (priorState == CircuitBreaker.State.HALF_OPEN &&
          this.circuitBreaker.getState() == CircuitBreaker.State.HALF_OPEN) {
        this.circuitBreaker.transitionToOpenState();
      }
    }
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "recordFailure", "Call through {0} failed", new Object[] { this.getName(), failure });
    }
  }

  private final void stateTransitioned(final CircuitBreakerOnStateTransitionEvent event) {
    if (this.logger.isLoggable(Level.INFO)) {
      this.logger.logp(Level.INFO, this.getClass().getName(), "stateTransitioned",
                       "Circuit breaker {0} changed from {1} to {2}",
                       new Object[] { this.getName(), event.getStateTransition().getFromState(), event.getStateTransition().getToState() });
    }
  }

}
