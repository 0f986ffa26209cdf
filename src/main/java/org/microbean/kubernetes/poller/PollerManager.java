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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import java.util.logging.Level;
import java.util.logging.Logger;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.fabric8.kubernetes.client.Watch;
import io.fabric8.kubernetes.client.Watcher;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

import org.microbean.kubernetes.poller.client.BackendClient;
import org.microbean.kubernetes.poller.client.NamedThreadFactory;
import org.microbean.kubernetes.poller.client.ResourceType;
import org.microbean.kubernetes.poller.client.Scope;

/**
 * Owns one {@link SharedPoller} per {@linkplain
 * #register(Converter) registered} {@link ResourceType}, creating
 * each lazily on first use, together with the {@link
 * ScheduledExecutorService} on which all of their poll cycles run.
 *
 * <p>A {@link PollerManager} is an ordinary object: create as many as
 * needed, and {@linkplain #close() close} each when done.  Closing a
 * {@link PollerManager} closes every {@link SharedPoller}, every
 * {@link Subscription} and every {@link Watch} it handed out and
 * joins its threads.  It does not close its {@link
 * BackendClient}.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.  Concurrent first subscribers to the same {@link
 * ResourceType} share one {@link SharedPoller}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #subscribe(ResourceType, Scope)
 *
 * @see #watch(ResourceType, Scope, Watcher)
 */
@ThreadSafe
public class PollerManager implements Closeable {


  /*
   * Instance fields.
   */


  private final BackendClient client;

  private final PollerConfiguration configuration;

  private final ScheduledExecutorService executorService;

  @GuardedBy("this")
  private final Map<ResourceType<?, ?>, Converter<?, ?>> converters;

  @GuardedBy("this")
  private final Map<ResourceType<?, ?>, SharedPoller<?, ?>> pollers;

  @GuardedBy("this")
  private final Set<SubscriptionWatch<?>> watches;

  @GuardedBy("this")
  private boolean closed;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link PollerManager} with {@linkplain
   * PollerConfiguration#defaults() default settings}.
   *
   * @param client the {@link BackendClient} every {@link
   * SharedPoller} lists resources with, normally a {@link
   * org.microbean.kubernetes.poller.client.ResilientClient}; must not
   * be {@code null}
   *
   * @exception NullPointerException if {@code client} is {@code null}
   */
  public PollerManager(final BackendClient client) {
    this(client, PollerConfiguration.defaults());
  }

  /**
   * Creates a new {@link PollerManager}.
   *
   * @param client the {@link BackendClient} every {@link
   * SharedPoller} lists resources with, normally a {@link
   * org.microbean.kubernetes.poller.client.ResilientClient}; must not
   * be {@code null}
   *
   * @param configuration the {@link PollerConfiguration} to use; must
   * not be {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public PollerManager(final BackendClient client, final PollerConfiguration configuration) {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    this.client = Objects.requireNonNull(client, "client");
    this.configuration = Objects.requireNonNull(configuration, "configuration");
    final ScheduledThreadPoolExecutor executor =
      new ScheduledThreadPoolExecutor(configuration.getThreadCount(), new NamedThreadFactory("poller-thread-", true));
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    this.executorService = executor;
    this.converters = new HashMap<>();
    this.pollers = new HashMap<>();
    this.watches = new LinkedHashSet<>();
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  public final PollerConfiguration getConfiguration() {
    return this.configuration;
  }

  /**
   * Registers the supplied {@link Converter} for its {@linkplain
   * Converter#getResourceType() resource type}, replacing any {@link
   * Converter} previously registered for it.
   *
   * <p>A replacement takes effect only for a {@link SharedPoller}
   * that has not yet been created.</p>
   *
   * @param converter the {@link Converter}; must not be {@code null}
   *
   * @exception NullPointerException if {@code converter} or its
   * {@link ResourceType} is {@code null}
   *
   * @exception IllegalStateException if this {@link PollerManager}
   * has been {@linkplain #close() closed}
   */
  public final synchronized void register(final Converter<?, ?> converter) {
    Objects.requireNonNull(converter, "converter");
    final ResourceType<?, ?> type = Objects.requireNonNull(converter.getResourceType(), "converter.getResourceType()");
    this.checkOpen();
    this.converters.put(type, converter);
    if (this.logger.isLoggable(Level.FINE)) {
      this.logger.logp(Level.FINE, this.getClass().getName(), "register", "Registered {0} for {1}", new Object[] { converter, type });
    }
  }

  /**
   * Returns the {@link SharedPoller} for the supplied {@link
   * ResourceType}, creating it if necessary.
   *
   * @param <R> the type of raw backend object
   *
   * @param <T> the type of Kubernetes resource
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @return a non-{@code null} {@link SharedPoller}
   *
   * @exception NullPointerException if {@code type} is {@code null}
   *
   * @exception IllegalArgumentException if no {@link Converter} is
   * registered for {@code type}
   *
   * @exception IllegalStateException if this {@link PollerManager}
   * has been {@linkplain #close() closed}
   */
  public final synchronized <R, T extends HasMetadata> SharedPoller<R, T> getPoller(final ResourceType<R, T> type) {
    Objects.requireNonNull(type, "type");
    this.checkOpen();
    @SuppressWarnings("unchecked")
    SharedPoller<R, T> returnValue = (SharedPoller<R, T>)this.pollers.get(type);
    if (returnValue == null) {
      @SuppressWarnings("unchecked")
      final Converter<R, T> converter = (Converter<R, T>)this.converters.get(type);
      if (converter == null) {
        throw new IllegalArgumentException("No converter registered for resource type " + type);
      }
      returnValue = this.createPoller(converter);
      this.pollers.put(type, returnValue);
      if (this.logger.isLoggable(Level.FINE)) {
        this.logger.logp(Level.FINE, this.getClass().getName(), "getPoller", "Created {0}", returnValue);
      }
    }
    return returnValue;
  }

  /**
   * Creates a new {@link SharedPoller} for the supplied {@link
   * Converter}.
   *
   * <p>Overrides of this method must not return {@code null}.</p>
   *
   * @param <R> the type of raw backend object
   *
   * @param <T> the type of Kubernetes resource
   *
   * @param converter the {@link Converter}; never {@code null}
   *
   * @return a new, {@linkplain SharedPoller.State#IDLE idle} {@link
   * SharedPoller}
   */
  protected <R, T extends HasMetadata> SharedPoller<R, T> createPoller(final Converter<R, T> converter) {
    return new SharedPoller<>(this.client, converter, this.configuration, this.executorService);
  }

  /**
   * Subscribes to changes to resources of the supplied {@link
   * ResourceType} within the supplied {@link Scope}.
   *
   * @param <T> the type of Kubernetes resource
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param scope the {@link Scope}; may be {@code null} in which case
   * {@link Scope#all()} is used
   *
   * @return a new {@link Subscription}; never {@code null}
   *
   * @exception NullPointerException if {@code type} is {@code null}
   *
   * @exception IllegalArgumentException if no {@link Converter} is
   * registered for {@code type}
   *
   * @exception IllegalStateException if this {@link PollerManager}
   * has been {@linkplain #close() closed}
   *
   * @see SharedPoller#subscribe(Scope)
   */
  public final <T extends HasMetadata> Subscription<T> subscribe(final ResourceType<?, T> type, final Scope scope) {
    final String cn = this.getClass().getName();
    final String mn = "subscribe";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, scope });
    }
    final Subscription<T> returnValue = this.subscribeTo(type, scope);
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  private final <R, T extends HasMetadata> Subscription<T> subscribeTo(final ResourceType<R, T> type, final Scope scope) {
    return this.getPoller(type).subscribe(scope);
  }

  /**
   * Removes the {@link Subscription} with the supplied identifier
   * from the {@link SharedPoller} for the supplied {@link
   * ResourceType} and {@linkplain Subscription#close() closes} it.
   *
   * <p>The {@link SharedPoller} keeps running.</p>
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param id the identifier of the {@link Subscription}; may be
   * {@code null}
   *
   * @return {@code true} if a {@link Subscription} was removed
   *
   * @exception NullPointerException if {@code type} is {@code null}
   */
  public final boolean unsubscribe(final ResourceType<?, ?> type, final UUID id) {
    Objects.requireNonNull(type, "type");
    final SharedPoller<?, ?> poller;
    synchronized (this) {
      poller = this.pollers.get(type);
    }
    return poller != null && poller.unsubscribe(id);
  }

  /**
   * Delivers changes to resources of the supplied {@link
   * ResourceType} within the supplied {@link Scope} to the supplied
   * {@link Watcher}, Kubernetes watch style, on a dedicated
   * {@link Thread}.
   *
   * @param <T> the type of Kubernetes resource
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param scope the {@link Scope}; may be {@code null} in which case
   * {@link Scope#all()} is used
   *
   * @param watcher the {@link Watcher}; must not be {@code null}
   *
   * @return a started {@link Watch} that can be {@linkplain
   * Watch#close() closed} to stop delivery; never {@code null}
   *
   * @exception NullPointerException if {@code type} or {@code
   * watcher} is {@code null}
   *
   * @exception IllegalArgumentException if no {@link Converter} is
   * registered for {@code type}
   *
   * @exception IllegalStateException if this {@link PollerManager}
   * has been {@linkplain #close() closed}
   */
  public final <T extends HasMetadata> Watch watch(final ResourceType<?, T> type, final Scope scope, final Watcher<T> watcher) {
    final String cn = this.getClass().getName();
    final String mn = "watch";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn, new Object[] { type, scope, watcher });
    }
    Objects.requireNonNull(watcher, "watcher");
    final Subscription<T> subscription = this.subscribeTo(type, scope);
    final SubscriptionWatch<T> returnValue = new SubscriptionWatch<>(subscription, watcher);
    synchronized (this) {
      if (this.closed) {
        subscription.close();
        throw new IllegalStateException("closed");
      }
      this.watches.add(returnValue);
    }
    returnValue.setCloseHandler(() -> this.forget(returnValue));
    returnValue.start();
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn, returnValue);
    }
    return returnValue;
  }

  private final synchronized void forget(final SubscriptionWatch<?> watch) {
    this.watches.remove(watch);
  }

  public final synchronized boolean isClosed() {
    return this.closed;
  }

  /**
   * Equivalent to {@link #close()}.
   *
   * @see #close()
   */
  public final void shutdown() {
    this.close();
  }

  /**
   * Closes every {@link SharedPoller} and {@link Watch} this {@link
   * PollerManager} created, forgets every registered {@link
   * Converter}, and shuts down and joins the threads on which poll
   * cycles run.
   *
   * <p>Calling this method more than once has no further effect.</p>
   */
  @Override
  public final void close() {
    final String cn = this.getClass().getName();
    final String mn = "close";
    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.entering(cn, mn);
    }
    final Collection<SharedPoller<?, ?>> pollers;
    final Collection<SubscriptionWatch<?>> watches;
    synchronized (this) {
      if (this.closed) {
        if (this.logger.isLoggable(Level.FINER)) {
          this.logger.exiting(cn, mn);
        }
        return;
      }
      this.closed = true;
      pollers = new ArrayList<>(this.pollers.values());
      watches = new ArrayList<>(this.watches);
      this.pollers.clear();
      this.watches.clear();
      this.converters.clear();
    }

    for (final SharedPoller<?, ?> poller : pollers) {
      poller.close();
    }

    final long timeoutMillis = this.configuration.getShutdownTimeout().toMillis();
    this.executorService.shutdown();
    try {
      if (!this.executorService.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        this.executorService.shutdownNow();
        if (!this.executorService.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
          if (this.logger.isLoggable(Level.WARNING)) {
            this.logger.logp(Level.WARNING, cn, mn, "executorService did not terminate cleanly after {0} milliseconds", Long.valueOf(timeoutMillis));
          }
        }
      }
    } catch (final InterruptedException interruptedException) {
      this.executorService.shutdownNow();
      Thread.currentThread().interrupt();
    }

    // Closing the pollers has already closed each watch's
    // subscription; this joins the pump threads.
    for (final SubscriptionWatch<?> watch : watches) {
      watch.close();
    }

    if (this.logger.isLoggable(Level.FINER)) {
      this.logger.exiting(cn, mn);
    }
  }

  private final void checkOpen() {
    assert Thread.holdsLock(this);
    if (this.closed) {
      throw new IllegalStateException("closed");
    }
  }

}
