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

import java.io.IOException;

import java.time.Clock;
import java.time.Duration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

import net.jcip.annotations.ThreadSafe;

/**
 * A {@link BackendClient} that wraps another {@link BackendClient}
 * with a {@linkplain RateLimiter rate limiter}, a {@linkplain
 * BackendCircuitBreaker circuit breaker}, a request timeout and, for
 * reads, {@linkplain ResultCache result caches} that serve the last
 * good result when the backend cannot be reached.
 *
 * <p>A read passes, in order, through the rate limiter, the result
 * cache, the circuit breaker and the request timeout before reaching
 * the delegate.  A write passes through the rate limiter, the circuit
 * breaker and the request timeout only; writes are never cached and
 * never retried.</p>
 *
 * <p>When a read fails and a result for the same request is cached,
 * that result is returned instead, a {@link Level#WARNING} record is
 * logged and the {@linkplain #getStaleServedCount() stale-served
 * count} is incremented.  A {@link ResourceNotFoundException} is
 * never masked in this way.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.  The rate limiter, the circuit breaker and the
 * caches of a {@link ResilientClient} are shared by all of its
 * callers.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see BackendClientConfiguration
 */
@ThreadSafe
public class ResilientClient implements BackendClient {


  /*
   * Instance fields.
   */


  private final BackendClient delegate;

  private final BackendClientConfiguration configuration;

  private final RateLimiter rateLimiter;

  private final BackendCircuitBreaker circuitBreaker;

  private final ResultCache<String, Object> itemCache;

  private final ResultCache<String, List<?>> listCache;

  private final ExecutorService callExecutorService;

  private final ScheduledExecutorService cleanupExecutorService;

  private final AtomicLong staleServedCount;

  private final AtomicBoolean closed;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ResilientClient} with {@linkplain
   * BackendClientConfiguration#defaults() default settings}.
   *
   * @param delegate the {@link BackendClient} to wrap; must not be
   * {@code null}
   *
   * @exception NullPointerException if {@code delegate} is {@code
   * null}
   *
   * @see #ResilientClient(BackendClient, BackendClientConfiguration,
   * Clock)
   */
  public ResilientClient(final BackendClient delegate) {
    this(delegate, BackendClientConfiguration.defaults(), Clock.systemUTC());
  }

  /**
   * Creates a new {@link ResilientClient}.
   *
   * @param delegate the {@link BackendClient} to wrap; must not be
   * {@code null}
   *
   * @param configuration the {@link BackendClientConfiguration} to
   * use; must not be {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @see #ResilientClient(BackendClient, BackendClientConfiguration,
   * Clock)
   */
  public ResilientClient(final BackendClient delegate, final BackendClientConfiguration configuration) {
    this(delegate, configuration, Clock.systemUTC());
  }

  /**
   * Creates a new {@link ResilientClient}.
   *
   * @param delegate the {@link BackendClient} to wrap; must not be
   * {@code null}
   *
   * @param configuration the {@link BackendClientConfiguration} to
   * use; must not be {@code null}
   *
   * @param clock the {@link Clock} used by the rate limiter and the
   * caches; must not be {@code null}
   *
   * @exception NullPointerException if any parameter is {@code null}
   *
   * @exception IllegalArgumentException if {@code configuration} is
   * not {@linkplain BackendClientConfiguration#validate() valid}
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public ResilientClient(final BackendClient delegate,
                         final BackendClientConfiguration configuration,
                         final Clock clock) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    final String cn = this.getClass().getName();
    final String mn = "<init>";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { delegate, configuration, clock });
    }
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    Objects.requireNonNull(clock, "clock");
    configuration.validate();
    this.rateLimiter = new RateLimiter(configuration.getRateLimit(), configuration.getRateBurst(), clock);
    this.circuitBreaker = new BackendCircuitBreaker("backend",
                                                    configuration.getFailureThreshold(),
                                                    configuration.getHalfOpenTrials(),
                                                    configuration.getCooldown());
    this.itemCache = new ResultCache<>(configuration.getCacheTimeToLive(), clock);
    this.listCache = new ResultCache<>(configuration.getCacheTimeToLive(), clock);
    this.callExecutorService = Executors.newCachedThreadPool(new NamedThreadFactory("backend-call-thread-", true));
    final Duration maxStaleness = configuration.getCacheMaxStaleness();
    if (maxStaleness == null) {
      this.cleanupExecutorService = null;
    } else {
      this.cleanupExecutorService = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("cache-cleanup-thread-", true));
      final long intervalMillis = configuration.getCacheCleanupInterval().toMillis();
      this.cleanupExecutorService.scheduleWithFixedDelay(this::evictStale, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }
    this.staleServedCount = new AtomicLong();
    this.closed = new AtomicBoolean();
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  public final BackendClientConfiguration getConfiguration() {
    return this.configuration;
  }

  /**
   * Returns the current state of this {@link ResilientClient}'s
   * circuit breaker.
   *
   * @return a non-{@code null} {@link CircuitBreaker.State}
   */
  public final CircuitBreaker.State getCircuitBreakerState() {
    return this.circuitBreaker.getState();
  }

  /**
   * Returns the number of reads that have been answered with a stale
   * cached result since this {@link ResilientClient} was created.
   *
   * @return the number of stale results served
   */
  public final long getStaleServedCount() {
    return this.staleServedCount.get();
  }

  @Override
  public <R> R get(final ResourceType<R, ?> type, final ResourceIdentity identity) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "get";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, identity });
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(identity, "identity");
    this.acquirePermit(mn, type);
    final String description = "get " + type + " " + identity;
    final CacheResult<Object> result =
      this.itemCache.getOrFetch(itemKey(type, identity),
                                () -> this.guard(description, () -> this.delegate.get(type, identity)));
    if (result.isStale()) {
      this.staleServed(mn, description);
    }
    final R returnValue = type.getBackendClass().cast(result.getValue());
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  @Override
  public <R> List<R> list(final ResourceType<R, ?> type, final Scope scope) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "list";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, scope });
    }
    Objects.requireNonNull(type, "type");
    final Scope effectiveScope = scope == null ? Scope.all() : scope;
    this.acquirePermit(mn, type);
    final String description = "list " + type + " " + effectiveScope;
    final CacheResult<List<?>> result =
      this.listCache.getOrFetch(listKey(type, effectiveScope),
                                () -> unmodifiableCopyOf(this.guard(description, () -> this.delegate.list(type, effectiveScope))));
    if (result.isStale()) {
      this.staleServed(mn, description);
    }
    // Callers get their own copy; the cached list backs later stale reads.
    final List<?> cached = result.getValue();
    final Class<R> backendClass = type.getBackendClass();
    final List<R> returnValue = new ArrayList<>(cached.size());
    for (final Object item : cached) {
      returnValue.add(backendClass.cast(item));
    }
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  @Override
  public <R> void create(final ResourceType<R, ?> type, final R resource) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "create";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, resource });
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(resource, "resource");
    this.acquirePermit(mn, type);
    this.guard("create " + type, () -> {
        this.delegate.create(type, resource);
        return null;
      });
    this.invalidateLists(type);
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  /**
   * Updates the supplied resource in the backend.
   *
   * <p>Because this {@link ResilientClient} cannot identify raw
   * resources, a successful update invalidates every cached read of
   * the supplied {@link ResourceType}.</p>
   */
  @Override
  public <R> void update(final ResourceType<R, ?> type, final R resource) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "update";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, resource });
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(resource, "resource");
    this.acquirePermit(mn, type);
    this.guard("update " + type, () -> {
        this.delegate.update(type, resource);
        return null;
      });
    final String prefix = type.getName() + ":";
    this.itemCache.invalidateAll(key -> key.startsWith(prefix));
    this.invalidateLists(type);
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  @Override
  public void delete(final ResourceType<?, ?> type, final ResourceIdentity identity) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "delete";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, identity });
    }
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(identity, "identity");
    this.acquirePermit(mn, type);
    this.guard("delete " + type + " " + identity, () -> {
        this.delegate.delete(type, identity);
        return null;
      });
    this.itemCache.invalidate(itemKey(type, identity));
    this.invalidateLists(type);
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  /**
   * Releases this {@link ResilientClient}'s threads and {@linkplain
   * BackendClient#close() closes} its delegate.
   *
   * <p>Calling this method more than once has no further effect.</p>
   *
   * @exception IOException if the delegate could not be closed
   */
  @Override
  public void close() throws IOException {
    final String cn = this.getClass().getName();
    final String mn = "close";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn);
    }
    if (this.closed.compareAndSet(false, true)) {
      if (this.cleanupExecutorService != null) {
        this.cleanupExecutorService.shutdownNow();
      }
      this.callExecutorService.shutdown();
      try {
        if (!this.callExecutorService.awaitTermination(60L, TimeUnit.SECONDS)) {
          this.callExecutorService.shutdownNow();
          if (!this.callExecutorService.awaitTermination(60L, TimeUnit.SECONDS)) {
            if (this.logger.isLoggable(Level.WARNING)) {
              this.logger.logp(Level.WARNING, cn, mn, "callExecutorService did not terminate cleanly after 60 seconds");
            }
          }
        }
      } catch (final InterruptedException interruptedException) {
        this.callExecutorService.shutdownNow();
        Thread.currentThread().interrupt();
      }
      this.itemCache.clear();
      this.listCache.clear();
      this.delegate.close();
    }
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  private final void acquirePermit(final String operation, final ResourceType<?, ?> type) throws RateLimitExceededException {
    if (this.closed.get()) {
      throw new IllegalStateException("closed");
    }
    if (!this.rateLimiter.allow()) {
      throw new RateLimitExceededException("rate limit exceeded: " + operation + " " + type);
    }
  }

  /**
   * Runs the supplied {@link BackendCall} through the circuit breaker
   * and the request timeout, turning any failure other than a {@link
   * CircuitOpenException} or a {@link ResourceNotFoundException},
   * including an unchecked exception thrown by the delegate, into a
   * {@link BackendCallFailedException}.
   */
  private final <V> V guard(final String description, final BackendCall<? extends V> call) throws BackendException {
    try {
      return this.circuitBreaker.execute(() -> this.callWithTimeout(description, call));
    } catch (final CircuitOpenException | ResourceNotFoundException | BackendCallFailedException e) {
      throw e;
    } catch (final BackendException e) {
      throw new BackendCallFailedException(description + " failed", e);
    }
  }

  private final <V> V callWithTimeout(final String description, final BackendCall<? extends V> call) throws BackendException {
    final Duration timeout = this.configuration.getRequestTimeout();
    final Future<? extends V> future = this.callExecutorService.submit(call::call);
    try {
      return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (final TimeoutException timeoutException) {
      future.cancel(true);
      throw new BackendException(description + " timed out after " + timeout, timeoutException);
    } catch (final InterruptedException interruptedException) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new BackendException(description + " interrupted", interruptedException);
    } catch (final ExecutionException executionException) {
      final Throwable cause = executionException.getCause();
      if (cause instanceof BackendException) {
        throw (BackendException)cause;
      } else if (cause instanceof Error) {
        throw (Error)cause;
      } else {
        throw new BackendCallFailedException(description + " failed", cause);
      }
    }
  }

  private final void staleServed(final String methodName, final String description) {
    this.staleServedCount.incrementAndGet();
    if (this.logger.isLoggable(Level.WARNING)) {
      this.logger.logp(Level.WARNING, this.getClass().getName(), methodName,
                       "Backend unavailable; serving cached result of {0}", description);
    }
  }

  private final void invalidateLists(final ResourceType<?, ?> type) {
    final String prefix = type.getName() + "?";
    this.listCache.invalidateAll(key -> key.startsWith(prefix));
  }

  private final void evictStale() {
    final Duration maxStaleness = this.configuration.getCacheMaxStaleness();
    assert maxStaleness != null;
    this.itemCache.evictStale(maxStaleness);
    this.listCache.evictStale(maxStaleness);
  }


  /*
   * Static methods.
   */


  static final String itemKey(final ResourceType<?, ?> type, final ResourceIdentity identity) {
    return type.getName() + ":" + identity.getKey();
  }

  private static final List<?> unmodifiableCopyOf(final List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(new ArrayList<>(list));
  }

  static final String listKey(final ResourceType<?, ?> type, final Scope scope) {
    return type.getName() + "?" + scope.getCacheKey();
  }

}
