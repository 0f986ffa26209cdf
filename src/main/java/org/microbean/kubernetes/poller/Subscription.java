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

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;

import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicLong;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.fabric8.kubernetes.api.model.HasMetadata;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

import org.microbean.kubernetes.poller.client.Scope;

/**
 * A bounded mailbox of {@link ChangeEvent}s for one subscriber to a
 * {@link SharedPoller}.
 *
 * <p>Events are delivered to a {@link Subscription} without ever
 * blocking the deliverer: when the mailbox is full the newly arriving
 * event is dropped, {@linkplain #getDroppedEventCount() counted} and
 * logged.  A subscriber that misses events in this way should
 * resynchronize from a fresh list.  Only events whose {@linkplain
 * ChangeEvent#getIdentity() identity} {@linkplain
 * Scope#matches(org.microbean.kubernetes.poller.client.ResourceIdentity)
 * matches} this {@link Subscription}'s {@linkplain #getScope() scope}
 * are accepted.</p>
 *
 * <p>Once {@linkplain #close() closed}, a {@link Subscription}
 * accepts no further events, but events already buffered remain
 * readable.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.</p>
 *
 * @param <T> the type of Kubernetes resource
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #take()
 */
@ThreadSafe
public class Subscription<T extends HasMetadata> implements Closeable {


  /*
   * Instance fields.
   */


  private final UUID id;

  private final Scope scope;

  private final int capacity;

  @GuardedBy("this")
  private final Queue<ChangeEvent<T>> events;

  @GuardedBy("this")
  private boolean closed;

  private final AtomicLong droppedEventCount;

  private volatile Runnable closeHandler;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link Subscription}.
   *
   * @param scope the {@link Scope} restricting which events are
   * accepted; may be {@code null} in which case {@link Scope#all()}
   * is used
   *
   * @param capacity the maximum number of buffered events; must be
   * positive
   *
   * @exception IllegalArgumentException if {@code capacity} is not
   * positive
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public Subscription(final Scope scope, final int capacity) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity <= 0: " + capacity);
    }
    this.id = UUID.randomUUID();
    this.scope = scope == null ? Scope.all() : scope;
    this.capacity = capacity;
    this.events = new ArrayDeque<>(capacity);
    this.droppedEventCount = new AtomicLong();
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  public final UUID getId() {
    return this.id;
  }

  public final Scope getScope() {
    return this.scope;
  }

  public final int getCapacity() {
    return this.capacity;
  }

  /**
   * Returns the number of events that were dropped because this
   * {@link Subscription}'s mailbox was full.
   *
   * @return the number of dropped events
   */
  public final long getDroppedEventCount() {
    return this.droppedEventCount.get();
  }

  public final synchronized boolean isClosed() {
    return this.closed;
  }

  /**
   * Returns the number of events currently buffered.
   *
   * @return the number of buffered events
   */
  public final synchronized int size() {
    return this.events.size();
  }

  /**
   * Offers the supplied {@link ChangeEvent} to this {@link
   * Subscription} without blocking.
   *
   * @param event the {@link ChangeEvent}; must not be {@code null}
   *
   * @return {@code true} if the event was buffered; {@code false} if
   * it was outside this {@link Subscription}'s scope, if this {@link
   * Subscription} is closed, or if it was dropped because the mailbox
   * was full
   */
  final boolean offer(final ChangeEvent<T> event) {
    Objects.requireNonNull(event, "event");
    if (!this.scope.matches(event.getIdentity())) {
      return false;
    }
    synchronized (this) {
      if (this.closed) {
        return false;
      }
      if (this.events.size() < this.capacity) {
        this.events.add(event);
        this.notifyAll();
        return true;
      }
    }
    final long dropped = this.droppedEventCount.incrementAndGet();
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "offer",
                       "Subscription {0} is full; dropped {1} ({2} dropped so far)",
                       new Object[] { this.id, event, Long.valueOf(dropped) });
    }
    return false;
  }

  /**
   * Removes and returns the next {@link ChangeEvent}, blocking until
   * one is available or this {@link Subscription} is {@linkplain
   * #close() closed}.
   *
   * @return the next {@link ChangeEvent}, or {@code null} if this
   * {@link Subscription} is closed and no buffered events remain
   *
   * @exception InterruptedException if the calling {@link Thread} is
   * interrupted while waiting
   */
  public final synchronized ChangeEvent<T> take() throws InterruptedException {
    while (this.events.isEmpty() && !this.closed) {
      this.wait();
    }
    return this.events.poll();
  }

  /**
   * Removes and returns the next {@link ChangeEvent}, waiting up to
   * the supplied amount of time for one to become available.
   *
   * @param timeout the maximum time to wait
   *
   * @param unit the {@link TimeUnit} of {@code timeout}; must not be
   * {@code null}
   *
   * @return the next {@link ChangeEvent}, or {@code null} if none
   * became available in time or this {@link Subscription} is closed
   * and drained
   *
   * @exception InterruptedException if the calling {@link Thread} is
   * interrupted while waiting
   */
  public final synchronized ChangeEvent<T> poll(final long timeout, final TimeUnit unit) throws InterruptedException {
    Objects.requireNonNull(unit, "unit");
    long remainingNanos = unit.toNanos(timeout);
    final long deadline = System.nanoTime() + remainingNanos;
    while (this.events.isEmpty() && !this.closed && remainingNanos > 0L) {
      TimeUnit.NANOSECONDS.timedWait(this, remainingNanos);
      remainingNanos = deadline - System.nanoTime();
    }
    return this.events.poll();
  }

  /**
   * Removes and returns the next {@link ChangeEvent} if one is
   * immediately available.
   *
   * @return the next {@link ChangeEvent}, or {@code null}
   */
  public final synchronized ChangeEvent<T> poll() {
    return this.events.poll();
  }

  /**
   * Closes this {@link Subscription} so that it accepts no further
   * events and wakes up any {@link Thread} blocked in {@link
   * #take()} or {@link #poll(long, TimeUnit)}.
   *
   * <p>Calling this method more than once has no further effect.</p>
   */
  @Override
  public final void close() {
    final Runnable handler;
    synchronized (this) {
      if (this.closed) {
        return;
      }
      this.closed = true;
      this.notifyAll();
      handler = this.closeHandler;
    }
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "close", "Subscription {0} closed", this.id);
    }
    if (handler != null) {
      handler.run();
    }
  }

  final void setCloseHandler(final Runnable closeHandler) {
    this.closeHandler = closeHandler;
  }

  @Override
  public String toString() {
    return "Subscription[" + this.id + ", " + this.scope + "]";
  }

}
