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
import java.time.Duration;
import java.time.Instant;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import java.util.function.Predicate;

import java.util.logging.Level;
import java.util.logging.Logger;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.Immutable;
import net.jcip.annotations.ThreadSafe;

/**
 * A time-to-live cache of the results of {@link BackendCall}s that
 * can serve an old result when a fresh one cannot be obtained.
 *
 * <p>{@link #getOrFetch(Object, BackendCall)} always invokes its
 * {@link BackendCall}; the cache is consulted only when that call
 * fails.  An entry is therefore never consulted merely because it is
 * still fresh.  Expired entries are kept so that they can still be
 * served on failure, and are removed only by {@link
 * #invalidate(Object)}, by a {@link ResourceNotFoundException}, or by
 * {@link #evictStale(Duration)}.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.  The {@link BackendCall} is invoked without any
 * lock held.</p>
 *
 * @param <K> the type of key
 *
 * @param <V> the type of cached value
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
@ThreadSafe
public class ResultCache<K, V> {


  /*
   * Instance fields.
   */


  private final Lock readLock;

  private final Lock writeLock;

  @GuardedBy("readLock && writeLock")
  private final Map<K, CacheEntry<V>> entries;

  private final Duration timeToLive;

  private final Clock clock;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ResultCache}.
   *
   * @param timeToLive how long a stored value is considered fresh;
   * must not be {@code null} or negative
   *
   * @param clock the {@link Clock} supplying the current time; must
   * not be {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception IllegalArgumentException if {@code timeToLive} is
   * negative
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public ResultCache(final Duration timeToLive, final Clock clock) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    this.timeToLive = Objects.requireNonNull(timeToLive, "timeToLive");
    if (timeToLive.isNegative()) {
      throw new IllegalArgumentException("timeToLive.isNegative(): " + timeToLive);
    }
    this.clock = Objects.requireNonNull(clock, "clock");
    final ReadWriteLock lock = new ReentrantReadWriteLock();
    this.readLock = lock.readLock();
    this.writeLock = lock.writeLock();
    this.entries = new HashMap<>();
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  /**
   * Invokes the supplied {@link BackendCall} and caches and returns
   * its result, or, if it fails, returns the value previously cached
   * under the supplied key, whether or not that value has expired.
   *
   * <p>If the call fails with a {@link ResourceNotFoundException} any
   * entry stored under {@code key} is {@linkplain #invalidate(Object)
   * invalidated} and the exception is rethrown.</p>
   *
   * @param key the key; must not be {@code null}
   *
   * @param fetch the {@link BackendCall} producing a fresh value; must
   * not be {@code null}
   *
   * @return a non-{@code null} {@link CacheResult}, {@linkplain
   * CacheResult#isStale() marked stale} if it came from the cache
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception BackendException if {@code fetch} fails and there is
   * nothing cached under {@code key}, or if it fails with a {@link
   * ResourceNotFoundException}
   */
  public final CacheResult<V> getOrFetch(final K key, final BackendCall<? extends V> fetch) throws BackendException {
    final String cn = this.getClass().getName();
    final String mn = "getOrFetch";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { key, fetch });
    }
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(fetch, "fetch");
    final V value;
    try {
      value = fetch.call();
    } catch (final ResourceNotFoundException notFound) {
      this.invalidate(key);
      throw notFound;
    } catch (final BackendException failure) {
      final CacheEntry<V> entry;
      this.readLock.lock();
      try {
        entry = this.entries.get(key);
      } finally {
        this.readLock.unlock();
      }
      if (entry == null) {
        throw failure;
      }
      if (this.logger.isLoggable(Level.FINE)) {
        this.logger.logp(Level.FINE, cn, mn, "Serving cached value for {0} stored at {1}", new Object[] { key, entry.getStoredAt() });
      }
      final CacheResult<V> returnValue = new CacheResult<>(entry.getValue(), true);
      if (this.logger.isLoggable(Level.FINER)) {
        this.logger.exiting(cn, mn, returnValue);
      }
      return returnValue;
    }
    final Instant now = this.clock.instant();
    this.writeLock.lock();
    try {
      this.entries.put(key, new CacheEntry<>(value, now, now.plus(this.timeToLive)));
    } finally {
      this.writeLock.unlock();
    }
    final CacheResult<V> returnValue = new CacheResult<>(value, false);
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  /**
   * Returns the value cached under the supplied key, expired or not,
   * or {@code null} if there is none.
   *
   * @param key the key; may be {@code null}
   *
   * @return the cached value, or {@code null}
   */
  public final V getIfPresent(final K key) {
    V returnValue = null;
    if (key != null) {
      this.readLock.lock();
      try {
        final CacheEntry<V> entry = this.entries.get(key);
        if (entry != null) {
          returnValue = entry.getValue();
        }
      } finally {
        this.readLock.unlock();
      }
    }
    return returnValue;
  }

  /**
   * Returns {@code true} if a value is cached under the supplied key
   * and its time to live has not yet elapsed.
   *
   * @param key the key; may be {@code null}
   *
   * @return {@code true} if a fresh value is cached
   */
  public final boolean isFresh(final K key) {
    boolean returnValue = false;
    if (key != null) {
      final Instant now = this.clock.instant();
      this.readLock.lock();
      try {
        final CacheEntry<V> entry = this.entries.get(key);
        returnValue = entry != null && now.isBefore(entry.getExpiresAt());
      } finally {
        this.readLock.unlock();
      }
    }
    return returnValue;
  }

  /**
   * Removes any value cached under the supplied key.
   *
   * @param key the key; may be {@code null} in which case no action
   * is taken
   */
  public final void invalidate(final K key) {
    if (key != null) {
      this.writeLock.lock();
      try {
        this.entries.remove(key);
      } finally {
        this.writeLock.unlock();
      }
    }
  }

  /**
   * Removes every value whose key matches the supplied {@link
   * Predicate}.
   *
   * @param keyPredicate the {@link Predicate} selecting keys to
   * remove; must not be {@code null}
   *
   * @exception NullPointerException if {@code keyPredicate} is {@code
   * null}
   */
  public final void invalidateAll(final Predicate<? super K> keyPredicate) {
    Objects.requireNonNull(keyPredicate, "keyPredicate");
    this.writeLock.lock();
    try {
      this.entries.keySet().removeIf(keyPredicate);
    } finally {
      this.writeLock.unlock();
    }
  }

  /**
   * Removes every entry that expired more than {@code maxStaleness}
   * ago.
   *
   * @param maxStaleness how long past its expiry an entry may still be
   * served; must not be {@code null}
   *
   * @return the number of entries removed
   *
   * @exception NullPointerException if {@code maxStaleness} is {@code
   * null}
   */
  public final int evictStale(final Duration maxStaleness) {
    Objects.requireNonNull(maxStaleness, "maxStaleness");
    final Instant cutoff = this.clock.instant().minus(maxStaleness);
    int returnValue = 0;
    this.writeLock.lock();
    try {
      final Iterator<CacheEntry<V>> iterator = this.entries.values().iterator();
      while (iterator.hasNext()) {
        if (iterator.next().getExpiresAt().isBefore(cutoff)) {
          iterator.remove();
          returnValue++;
        }
      }
    } finally {
      this.writeLock.unlock();
    }
    if (returnValue > 0 && this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "evictStale", "Evicted {0} entries", returnValue);
    }
    return returnValue;
  }

  public final int size() {
    this.readLock.lock();
    try {
      return this.entries.size();
    } finally {
      this.readLock.unlock();
    }
  }

  public final void clear() {
    this.writeLock.lock();
    try {
      this.entries.clear();
    } finally {
      this.writeLock.unlock();
    }
  }


  /*
   * Inner and nested classes.
   */


  @Immutable
  private static final class CacheEntry<V> {

    private final V value;

    private final Instant storedAt;

    private final Instant expiresAt;

    private CacheEntry(final V value, final Instant storedAt, final Instant expiresAt) {
      super();
      this.value = value;
      this.storedAt = storedAt;
      this.expiresAt = expiresAt;
    }

    private final V getValue() {
      return this.value;
    }

    private final Instant getStoredAt() {
      return this.storedAt;
    }

    private final Instant getExpiresAt() {
      return this.expiresAt;
    }

  }

}
