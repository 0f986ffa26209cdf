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

import java.io.Closeable;

import java.time.Duration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.fabric8.kubernetes.api.model.HasMetadata;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

import org.microbean.kubernetes.poller.client.BackendClient;
import org.microbean.kubernetes.poller.client.BackendException;
import org.microbean.kubernetes.poller.client.ResourceIdentity;
import org.microbean.kubernetes.poller.client.ResourceType;
import org.microbean.kubernetes.poller.client.Scope;

/**
 * Periodically lists every resource of one {@link ResourceType}
 * through a {@link BackendClient}, works out what changed since the
 * previous listing, and offers the resulting {@link ChangeEvent}s to
 * every {@link Subscription} it has handed out.
 *
 * <p>A {@link SharedPoller} emulates a Kubernetes watch on top of a
 * backend that can only be listed.  However many subscribers it has,
 * it issues one list call per poll cycle.</p>
 *
 * <p>A {@link SharedPoller} starts out {@linkplain State#IDLE idle}.
 * Its first {@linkplain #subscribe(Scope) subscriber} makes it
 * {@linkplain State#ACTIVE active}: a first poll cycle runs at once,
 * and each cycle schedules the next when it finishes, after the
 * {@linkplain PollerConfiguration#getPollInterval() poll interval}
 * or, while cycles keep failing, after an exponentially growing delay
 * capped at the {@linkplain PollerConfiguration#getMaxBackoff()
 * maximum backoff}.  It stays active when its last subscriber leaves
 * and stops only when {@linkplain #close() closed}.</p>
 *
 * <p>A failed cycle is logged and skipped; subscribers never see
 * backend errors.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.  Poll cycles of one {@link SharedPoller} never
 * overlap.</p>
 *
 * @param <R> the type of raw backend object
 *
 * @param <T> the type of Kubernetes resource
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see PollerManager
 *
 * @see SnapshotDiffer
 */
@ThreadSafe
public class SharedPoller<R, T extends HasMetadata> implements Closeable {


  /*
   * Instance fields.
   */


  private final BackendClient client;

  private final Converter<R, T> converter;

  private final PollerConfiguration configuration;

  private final ScheduledExecutorService executorService;

  private final Lock cycleLock;

  private final Lock subscribersReadLock;

  private final Lock subscribersWriteLock;

  @GuardedBy("subscribersReadLock && subscribersWriteLock")
  private final Map<UUID, Subscription<T>> subscribers;

  @GuardedBy("cycleLock")
  private volatile ResourceSnapshot<T> snapshot;

  @GuardedBy("this")
  private volatile State state;

  @GuardedBy("this")
  private ScheduledFuture<?> task;

  private final AtomicInteger consecutiveFailures;

  private final AtomicLong failureCount;

  private final AtomicLong cycleCount;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link SharedPoller}.
   *
   * @param client the {@link BackendClient} to list resources with;
   * must not be {@code null}
   *
   * @param converter the {@link Converter} for the {@link
   * ResourceType} to poll; must not be {@code null}
   *
   * @param configuration the {@link PollerConfiguration} to use; must
   * not be {@code null}
   *
   * @param executorService the {@link ScheduledExecutorService} on
   * which poll cycles run; must not be {@code null}; it is not shut
   * down by this {@link SharedPoller}
   *
   * @exception NullPointerException if any parameter is {@code null}
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public SharedPoller(final BackendClient client,
                      final Converter<R, T> converter,
                      final PollerConfiguration configuration,
                      final ScheduledExecutorService executorService) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    this.client = Objects.requireNonNull(client, "client");
    this.converter = Objects.requireNonNull(converter, "converter");
    Objects.requireNonNull(converter.getResourceType(), "converter.getResourceType()");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    this.executorService = Objects.requireNonNull(executorService, "executorService");
    this.cycleLock = new ReentrantLock();
    final ReadWriteLock subscribersLock = new ReentrantReadWriteLock();
    this.subscribersReadLock = subscribersLock.readLock();
    this.subscribersWriteLock = subscribersLock.writeLock();
    this.subscribers = new LinkedHashMap<>();
    this.snapshot = ResourceSnapshot.empty();
    this.state = State.IDLE;
    this.consecutiveFailures = new AtomicInteger();
    this.failureCount = new AtomicLong();
    this.cycleCount = new AtomicLong();
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  public final ResourceType<R, T> getResourceType() {
    return this.converter.getResourceType();
  }

  public final State getState() {
    return this.state;
  }

  /**
   * Returns the most recent {@link ResourceSnapshot} this {@link
   * SharedPoller} has produced, which is {@linkplain
   * ResourceSnapshot#empty() empty} before its first successful
   * cycle.
   *
   * @return a non-{@code null} {@link ResourceSnapshot}
   */
  public final ResourceSnapshot<T> getSnapshot() {
    return this.snapshot;
  }

  public final int getSubscriberCount() {
    this.subscribersReadLock.lock();
    try {
      return this.subscribers.size();
    } finally {
      this.subscribersReadLock.unlock();
    }
  }

  /**
   * Returns the number of poll cycles that have failed since this
   * {@link SharedPoller} was created.
   *
   * @return the number of failed cycles
   */
  public final long getFailureCount() {
    return this.failureCount.get();
  }

  /**
   * Returns the number of poll cycles, successful or not, that have
   * run since this {@link SharedPoller} was created.
   *
   * @return the number of cycles
   */
  public final long getCycleCount() {
    return this.cycleCount.get();
  }

  /**
   * Returns a new {@link Subscription} to this {@link SharedPoller}'s
   * {@link ChangeEvent}s, starting this {@link SharedPoller} if it is
   * {@linkplain State#IDLE idle}.
   *
   * <p>The new {@link Subscription} first receives an {@link
   * ChangeEvent.Type#ADDED ADDED} event for every resource of the
   * {@linkplain #getSnapshot() current snapshot} within its {@link
   * Scope}, and then every event of every subsequent cycle within its
   * {@link Scope}, with nothing duplicated or lost in between.</p>
   *
   * <p>{@linkplain Subscription#close() Closing} the returned {@link
   * Subscription} removes it from this {@link SharedPoller}.</p>
   *
   * @param scope the {@link Scope} of the new {@link Subscription};
   * may be {@code null} in which case {@link Scope#all()} is used
   *
   * @return a new {@link Subscription}; never {@code null}
   *
   * @exception IllegalStateException if this {@link SharedPoller} has
   * been {@linkplain #close() closed}
   */
  public final Subscription<T> subscribe(final Scope scope) {
    final String cn = this.getClass().getName();
    final String mn = "subscribe";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, scope);
    }
    final Subscription<T> subscription = new Subscription<>(scope, this.configuration.getQueueCapacity());
    subscription.setCloseHandler(() -> this.remove(subscription));
    this.subscribersWriteLock.lock();
    try {
      if (this.isClosed()) {
        throw new IllegalStateException("closed");
      }
      final ResourceSnapshot<T> snapshot = this.snapshot;
      for (final ResourceSnapshot.Entry<T> entry : snapshot.getEntries()) {
        subscription.offer(new ChangeEvent<>(this, ChangeEvent.Type.ADDED, entry.getIdentity(), entry.getResource(), null, snapshot.getVersion()));
      }
      this.subscribers.put(subscription.getId(), subscription);
    } finally {
      this.subscribersWriteLock.unlock();
    }
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, cn, mn, "Added {0} to the {1} poller", new Object[] { subscription, this.getResourceType() });
    }
    this.start();
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, subscription);
    }
    return subscription;
  }

  /**
   * Removes the {@link Subscription} with the supplied identifier
   * from this {@link SharedPoller} and {@linkplain
   * Subscription#close() closes} it.
   *
   * <p>This {@link SharedPoller} stays {@linkplain State#ACTIVE
   * active} even when its last {@link Subscription} is removed.</p>
   *
   * @param id the identifier of the {@link Subscription} to remove;
   * may be {@code null}
   *
   * @return {@code true} if a {@link Subscription} was removed
   */
  public final boolean unsubscribe(final UUID id) {
    final Subscription<T> subscription;
    if (id == null) {
      subscription = null;
    } else {
      this.subscribersWriteLock.lock();
      try {
        subscription = this.subscribers.remove(id);
      } finally {
        this.subscribersWriteLock.unlock();
      }
    }
    if (subscription == null) {
      return false;
    }
    subscription.close();
    return true;
  }

  private final void remove(final Subscription<T> subscription) {
    this.subscribersWriteLock.lock();
    try {
      this.subscribers.remove(subscription.getId());
    } finally {
      this.subscribersWriteLock.unlock();
    }
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "remove", "Removed {0} from the {1} poller", new Object[] { subscription, this.getResourceType() });
    }
  }

  /**
   * Runs one poll cycle on the calling {@link Thread}, waiting for
   * any cycle already in progress to finish first.
   *
   * <p>This is useful for refreshing subscribers right after a
   * write.</p>
   *
   * @return {@code true} if the cycle succeeded; {@code false} if it
   * failed and was skipped
   *
   * @exception IllegalStateException if this {@link SharedPoller} has
   * been {@linkplain #close() closed}
   */
  public final boolean poll() {
    if (this.isClosed()) {
      throw new IllegalStateException("closed");
    }
    return this.cycle();
  }

  private final synchronized void start() {
    if (this.state == State.IDLE) {
      this.state = State.ACTIVE;
      if (this.logger.isLoggable(Level.INFO)) {
        this.logger.logp(Level.INFO, this.getClass().getName(), "start",
                         "Polling {0} every {1}", new Object[] { this.getResourceType(), this.configuration.getPollInterval() });
      }
      try {
        this.task = this.executorService.schedule(this::runScheduledCycle, 0L, TimeUnit.MILLISECONDS);
      } catch (final RejectedExecutionException rejectedExecutionException) {
        this.state = State.STOPPED;
        throw new IllegalStateException("The poll executor is shut down", rejectedExecutionException);
      }
    }
  }

  private final void runScheduledCycle() {
    if (this.state != State.ACTIVE) {
      return;
    }
    this.cycle();
    synchronized (this) {
      if (this.state == State.ACTIVE) {
        final Duration delay = this.getNextDelay();
        try {
          this.task = this.executorService.schedule(this::runScheduledCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException rejectedExecutionException) {
          if (this.logger.isLoggable(Level.FINE)) {
            this.logger.logp(Level.FINE, this.getClass().getName(), "runScheduledCycle",
                             "Poll executor is shut down; not rescheduling {0}", this.getResourceType());
          }
        }
      }
    }
  }

  final Duration getNextDelay() {
    final Duration interval = this.configuration.getPollInterval();
    final int failures = this.consecutiveFailures.get();
    if (failures <= 0) {
      return interval;
    }
    final Duration maxBackoff = this.configuration.getMaxBackoff();
    final Duration backoff = interval.multipliedBy(1L << Math.min(failures, 20));
    return backoff.compareTo(maxBackoff) > 0 ? maxBackoff : backoff;
  }

  private final boolean cycle() {
    final String cn = this.getClass().getName();
    final String mn = "cycle";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn);
    }
    final ResourceType<R, T> type = this.getResourceType();
    boolean returnValue = false;
    this.cycleLock.lock();
    try {
      this.cycleCount.incrementAndGet();
      final ResourceSnapshot<T> previous = this.snapshot;
      ResourceSnapshot<T> current = null;
      try {
        current = this.list(type, previous.getVersion() + 1L);
      } catch (final BackendException | RuntimeException e) {
        final int failures = this.consecutiveFailures.incrementAndGet();
        this.failureCount.incrementAndGet();
        if (this.logger.isLoggable(Level.WARNING)) {
          this.logger.logp(Level.WARNING, cn, mn,
                           "Skipping poll cycle for " + type + " after " + failures + " consecutive failure(s)", e);
        }
      }
      if (current != null) {
        this.consecutiveFailures.set(0);
        returnValue = true;
        final List<ChangeEvent<T>> events = SnapshotDiffer.diff(this, previous, current);
        if (!events.isEmpty()) {
          if (this.logger.isLoggable(Level.FINE)) {
            this.logger.logp(Level.FINE, cn, mn, "{0} change(s) to {1} at version {2}",
                             new Object[] { Integer.valueOf(events.size()), type, Long.valueOf(current.getVersion()) });
          }
          this.subscribersReadLock.lock();
          try {
            this.snapshot = current;
            final Collection<Subscription<T>> subscriptions = this.subscribers.values();
            for (final Subscription<T> subscription : subscriptions) {
              for (final ChangeEvent<T> event : events) {
                subscription.offer(event);
              }
            }
          } finally {
            this.subscribersReadLock.unlock();
          }
        }
      }
    } finally {
      this.cycleLock.unlock();
    }
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, Boolean.valueOf(returnValue));
    }
    return returnValue;
  }

  private final ResourceSnapshot<T> list(final ResourceType<R, T> type, final long version) throws BackendException {
    final List<R> raws = this.client.list(type, Scope.all());
    final ResourceSnapshot.Builder<T> builder = new ResourceSnapshot.Builder<>();
    if (raws != null) {
      for (final R raw : raws) {
        if (raw == null) {
          continue;
        }
        final T resource = this.converter.convert(raw);
        if (resource == null) {
          throw new IllegalStateException("converter.convert(" + raw + ") == null");
        }
        final ResourceIdentity identity = this.converter.getIdentity(raw, resource);
        if (identity == null) {
          throw new IllegalStateException("converter.getIdentity(" + raw + ") == null");
        }
        if (!builder.put(identity, resource, this.converter.getVersion(raw, resource))) {
          if (this.logger.isLoggable(Level.WARNING)) {
            this.logger.logp(Level.WARNING, this.getClass().getName(), "list",
                             "Ignoring duplicate {0} {1}", new Object[] { type, identity });
          }
        }
      }
    }
    return builder.build(version);
  }

  public final boolean isClosed() {
    final State state = this.state;
    return state == State.SHUTTING_DOWN || state == State.STOPPED;
  }

  /**
   * Stops this {@link SharedPoller} and {@linkplain
   * Subscription#close() closes} every one of its {@link
   * Subscription}s.
   *
   * <p>A poll cycle already in progress is not interrupted, but its
   * results are delivered to no one.  Calling this method more than
   * once has no further effect.</p>
   */
  @Override
  public final void close() {
    final String cn = this.getClass().getName();
    final String mn = "close";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn);
    }
    final ScheduledFuture<?> task;
    synchronized (this) {
      if (this.isClosed()) {
        if (this.logger.isLoggable(Level.FINER)) {
          this.logger.exiting(cn, mn);
        }
        return;
      }
      this.state = State.SHUTTING_DOWN;
      task = this.task;
      this.task = null;
    }
    if (task != null) {
      task.cancel(false);
    }
    final List<Subscription<T>> subscriptions;
    this.subscribersWriteLock.lock();
    try {
      subscriptions = new ArrayList<>(this.subscribers.values());
      this.subscribers.clear();
    } finally {
      this.subscribersWriteLock.unlock();
    }
    for (final Subscription<T> subscription : subscriptions) {
      subscription.close();
    }
    synchronized (this) {
      this.state = State.STOPPED;
    }
    if (this.logger.isLoggable(Level.INFO)) {
      this.logger.logp(Level.INFO, cn, mn, "Stopped polling {0}", this.getResourceType());
    }
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  @Override
  public String toString() {
    return "SharedPoller[" + this.getResourceType() + ", " + this.state + "]";
  }


  /*
   * Inner and nested classes.
   */


  /**
   * The lifecycle states of a {@link SharedPoller}.
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  public static enum State {

    /**
     * Created but not yet polling.
     */
    IDLE,

    /**
     * Polling.
     */
    ACTIVE,

    /**
     * Being {@linkplain SharedPoller#close() closed}.
     */
    SHUTTING_DOWN,

    /**
     * Closed.
     */
    STOPPED

  }

}
