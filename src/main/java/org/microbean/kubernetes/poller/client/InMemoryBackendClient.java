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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import java.util.function.Function;

import java.util.logging.Level;
import java.util.logging.Logger;

import net.jcip.annotations.GuardedBy;
import net.jcip.annotations.ThreadSafe;

/**
 * A {@link BackendClient} that keeps resources in memory, suitable for
 * local development and for testing the machinery layered on top of
 * a {@link BackendClient}.
 *
 * <p>Each {@link ResourceType} must be {@linkplain
 * #register(ResourceType, Function) registered} together with a
 * {@link Function} that extracts a {@link ResourceIdentity} from its
 * raw objects before it can be used.  Resources are listed in the
 * order in which they were created.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Instances of this class are safe for concurrent use by multiple
 * {@link Thread}s.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
@ThreadSafe
public class InMemoryBackendClient implements BackendClient {


  /*
   * Instance fields.
   */


  private final Lock readLock;

  private final Lock writeLock;

  @GuardedBy("readLock && writeLock")
  private final Map<ResourceType<?, ?>, Map<ResourceIdentity, Object>> resources;

  @GuardedBy("readLock && writeLock")
  private final Map<ResourceType<?, ?>, Function<Object, ResourceIdentity>> identifiers;

  protected final Logger logger;


  /*
   * Constructors.
   */


  /**
   * Creates a new, empty {@link InMemoryBackendClient}.
   *
   * @exception IllegalStateException if the {@link #createLogger()}
   * method returns {@code null}
   */
  public InMemoryBackendClient() {
    super();
    this.logger = this.createLogger();
    if (this.logger == null) {
      throw new IllegalStateException("createLogger() == null");
    }
    final ReadWriteLock lock = new ReentrantReadWriteLock();
    this.readLock = lock.readLock();
    this.writeLock = lock.writeLock();
    this.resources = new HashMap<>();
    this.identifiers = new HashMap<>();
  }


  /*
   * Instance methods.
   */


  protected Logger createLogger() {
    return Logger.getLogger(this.getClass().getName());
  }

  /**
   * Makes the supplied {@link ResourceType} known to this {@link
   * InMemoryBackendClient}.
   *
   * <p>Registering a {@link ResourceType} a second time replaces its
   * identifier but keeps any resources already stored.</p>
   *
   * @param <R> the type of raw backend object
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param identifier a {@link Function} returning the {@link
   * ResourceIdentity} of a raw object; must not be {@code null}
   *
   * @exception NullPointerException if either parameter is {@code
   * null}
   */
  public final <R> void register(final ResourceType<R, ?> type, final Function<? super R, ResourceIdentity> identifier) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(identifier, "identifier");
    final Class<R> backendClass = type.getBackendClass();
    this.writeLock.lock();
    try {
      this.identifiers.put(type, raw -> identifier.apply(backendClass.cast(raw)));
      this.resources.computeIfAbsent(type, t -> new LinkedHashMap<>());
    } finally {
      this.writeLock.unlock();
    }
  }

  @Override
  public <R> R get(final ResourceType<R, ?> type, final ResourceIdentity identity) throws BackendException {
    Objects.requireNonNull(identity, "identity");
    final Object returnValue;
    this.readLock.lock();
    try {
      returnValue = this.getStore(type).get(identity);
    } finally {
      this.readLock.unlock();
    }
    if (returnValue == null) {
      throw new ResourceNotFoundException(type.getName(), identity);
    }
    return type.getBackendClass().cast(returnValue);
  }

  @Override
  public <R> List<R> list(final ResourceType<R, ?> type, final Scope scope) throws BackendException {
    final Scope effectiveScope = scope == null ? Scope.all() : scope;
    final Class<R> backendClass = type.getBackendClass();
    final List<R> returnValue = new ArrayList<>();
    this.readLock.lock();
    try {
      for (final Map.Entry<ResourceIdentity, Object> entry : this.getStore(type).entrySet()) {
        if (effectiveScope.matches(entry.getKey())) {
          returnValue.add(backendClass.cast(entry.getValue()));
        }
      }
    } finally {
      this.readLock.unlock();
    }
    return Collections.unmodifiableList(returnValue);
  }

  @Override
  public <R> void create(final ResourceType<R, ?> type, final R resource) throws BackendException {
    Objects.requireNonNull(resource, "resource");
    this.writeLock.lock();
    try {
      final ResourceIdentity identity = this.identify(type, resource);
      final Map<ResourceIdentity, Object> store = this.getStore(type);
      if (store.containsKey(identity)) {
        throw new BackendException(type.getName() + " \"" + identity + "\" already exists");
      }
      store.put(identity, resource);
      if (this.logger.isLoggable(Level.FINE)) {
        this.logger.logp(Level.FINE, this.getClass().getName(), "create", "Created {0} {1}", new Object[] { type, identity });
      }
    } finally {
      this.writeLock.unlock();
    }
  }

  @Override
  public <R> void update(final ResourceType<R, ?> type, final R resource) throws BackendException {
    Objects.requireNonNull(resource, "resource");
    this.writeLock.lock();
    try {
      final ResourceIdentity identity = this.identify(type, resource);
      final Map<ResourceIdentity, Object> store = this.getStore(type);
      if (!store.containsKey(identity)) {
        throw new ResourceNotFoundException(type.getName(), identity);
      }
      store.put(identity, resource);
      if (this.logger.isLoggable(Level.FINE)) {
        this.logger.logp(Level.FINE, this.getClass().getName(), "update", "Updated {0} {1}", new Object[] { type, identity });
      }
    } finally {
      this.writeLock.unlock();
    }
  }

  @Override
  public void delete(final ResourceType<?, ?> type, final ResourceIdentity identity) throws BackendException {
    Objects.requireNonNull(identity, "identity");
    this.writeLock.lock();
    try {
      if (this.getStore(type).remove(identity) == null) {
        throw new ResourceNotFoundException(type.getName(), identity);
      }
      if (this.logger.isLoggable(Level.FINE)) {
        this.logger.logp(Level.FINE, this.getClass().getName(), "delete", "Deleted {0} {1}", new Object[] { type, identity });
      }
    } finally {
      this.writeLock.unlock();
    }
  }

  private final Map<ResourceIdentity, Object> getStore(final ResourceType<?, ?> type) {
    Objects.requireNonNull(type, "type");
    final Map<ResourceIdentity, Object> returnValue = this.resources.get(type);
    if (returnValue == null) {
      throw new IllegalArgumentException("Unregistered resource type: " + type);
    }
    return returnValue;
  }

  private final ResourceIdentity identify(final ResourceType<?, ?> type, final Object resource) {
    final Function<Object, ResourceIdentity> identifier = this.identifiers.get(type);
    if (identifier == null) {
      throw new IllegalArgumentException("Unregistered resource type: " + type);
    }
    final ResourceIdentity returnValue = identifier.apply(resource);
    if (returnValue == null) {
      throw new IllegalArgumentException("No identity for " + resource);
    }
    return returnValue;
  }

}
