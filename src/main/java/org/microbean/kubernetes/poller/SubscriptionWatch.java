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

import java.util.Objects;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;
import io.fabric8.kubernetes.client.WatcherException;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

import org.microbean.kubernetes.poller.client.NamedThreadFactory;

/**
 * A {@link Watch} that pumps the {@link ChangeEvent}s of a {@link
 * Subscription} into a {@link Watcher} on a dedicated {@link Thread}.
 *
 * <p>Each {@link ChangeEvent} is handed to {@link
 * Watcher#eventReceived(Watcher.Action, Object)} with its {@linkplain
 * ChangeEvent#getAction() action} and its {@linkplain
 * ChangeEvent#getLatestResource() latest resource}, so a deletion
 * carries the last known state of the deleted resource.  When the
 * {@link Subscription} ends, {@link Watcher#onClose()} is called.  If
 * the {@link Watcher} throws, the {@link Subscription} is closed and
 * {@link Watcher#onClose(WatcherException)} is called instead.</p>
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
 * @see PollerManager#watch(org.microbean.kubernetes.poller.client.ResourceType,
 * org.microbean.kubernetes.poller.client.Scope, Watcher)
 */
@ThreadSafe
public class SubscriptionWatch<T extends HasMetadata> implements Watch {


  /*
   * Static fields.
   */


  private static final ThreadFactory pumpThreadFactory = new NamedThreadFactory("watch-pump-thread-", true);


  /*
   * Instance fields.
   */


  private final Subscription<T> subscription;

  private final Watcher<T> watcher;

  @GuardedBy("this")
  private ExecutorService executorService;

  private volatile Thread pumpThread;

  private volatile Runnable closeHandler;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new, unstarted {@link SubscriptionWatch}.
   *
   * @param subscription the {@link Subscription} to drain; must not
   * be {@code null}
   *
   * @param watcher the {@link Watcher} to notify; must not be {@code
   * null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   *
   * @see #start()
   */
  public SubscriptionWatch(final Subscription<T> subscription, final Watcher<T> watcher) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.watcher = Objects.requireNonNull(watcher, "watcher");
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  public final Subscription<T> getSubscription() {
    return this.subscription;
  }

  /**
   * Starts pumping events to this {@link SubscriptionWatch}'s {@link
   * Watcher}.
   *
   * <p>Calling this method more than once has no further effect.</p>
   */
  public final synchronized void start() {
    if (this.executorService == null) {
      this.executorService = Executors.newSingleThreadExecutor(pumpThreadFactory);
      this.executorService.execute(this::pump);
      this.executorService.shutdown();
    }
  }

  final void setCloseHandler(final Runnable closeHandler) {
    this.closeHandler = closeHandler;
  }

  private final void pump() {
    final String cn = this.getClass().getName();
    final String mn = "pump";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn);
    }
    this.pumpThread = Thread.currentThread();
    WatcherException failure = null;
    try {
      ChangeEvent<T> event;
      while ((event = this.subscription.take()) != null) {
        try {
          this.watcher.eventReceived(event.getAction(), event.getLatestResource());
        } catch (final RuntimeException e) {
          if (this.logger.isLoggable(Level.SEVERE)) {
            this.logger.logp(Level.SEVERE, cn, mn, "Watcher " + this.watcher + " failed to handle " + event, e);
          }
          failure = new WatcherException("Watcher failed to handle " + event, e);
          break;
        }
      }
    } catch (final InterruptedException interruptedException) {
      Thread.currentThread().interrupt();
    } finally {
      this.subscription.close();
      try {
        if (failure == null) {
          this.watcher.onClose();
        } else {
          this.watcher.onClose(failure);
        }
      } catch (final RuntimeException e) {
        if (this.logger.isLoggable(Level.WARNING)) {
          this.logger.logp(Level.WARNING, cn, mn, "Watcher " + this.watcher + " failed to close", e);
        }
      }
      final Runnable closeHandler = this.closeHandler;
      if (closeHandler != null) {
        closeHandler.run();
      }
    }
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  /**
   * {@linkplain Subscription#close() Closes} the underlying {@link
   * Subscription} and, unless called from a {@link Watcher} callback,
   * waits for the {@link Watcher} to be told.
   */
  @Override
  public final void close() {
    final String cn = this.getClass().getName();
    final String mn = "close";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn);
    }
    this.subscription.close();
    final ExecutorService executorService;
    synchronized (this) {
      executorService = this.executorService;
    }
    if (executorService != null && Thread.currentThread() != this.pumpThread) {
      try {
        if (!executorService.awaitTermination(60L, TimeUnit.SECONDS)) {
          executorService.shutdownNow();
          if (!executorService.awaitTermination(60L, TimeUnit.SECONDS)) {
            if (this.logger.isLoggable(Level.WARNING)) {
              this.logger.logp(Level.WARNING, cn, mn, "Pump did not terminate cleanly after 60 seconds");
            }
          }
        }
      } catch (final InterruptedException interruptedException) {
        executorService.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  @Override
  public String toString() {
    return "SubscriptionWatch[" + this.subscription + "]";
  }

}
