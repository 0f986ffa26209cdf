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

import java.io.Closeable;
import java.io.IOException;

import java.util.List;

/**
 * A synchronous, point-in-time client of a configuration backend.
 *
 * <p>A {@link BackendClient} can get, list, create, update and delete
 * resources of any {@linkplain ResourceType resource type} it knows
 * about.  It does not support streaming or watching of any kind;
 * change notification is emulated on top of {@link #list(ResourceType,
 * Scope)} by {@link org.microbean.kubernetes.poller.SharedPoller}.</p>
 *
 * <h2>Thread Safety</h2>
 *
 * <p><strong>Implementations of this interface must be safe for
 * concurrent use by multiple {@link Thread}s.</strong></p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see ResilientClient
 *
 * @see InMemoryBackendClient
 */
public interface BackendClient extends Closeable {

  /**
   * Returns the raw backend object of the supplied {@link
   * ResourceType} identified by the supplied {@link
   * ResourceIdentity}.
   *
   * @param <R> the type of raw backend object
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param identity the {@link ResourceIdentity}; must not be {@code
   * null}
   *
   * @return the raw backend object; never {@code null}
   *
   * @exception ResourceNotFoundException if there is no such resource
   *
   * @exception BackendException if the call failed
   */
  public <R> R get(final ResourceType<R, ?> type, final ResourceIdentity identity) throws BackendException;

  /**
   * Returns all raw backend objects of the supplied {@link
   * ResourceType} that fall within the supplied {@link Scope}, in the
   * order the backend supplies them.
   *
   * @param <R> the type of raw backend object
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param scope the {@link Scope}; may be {@code null} in which case
   * {@link Scope#all()} is used instead
   *
   * @return a non-{@code null}, unmodifiable {@link List}
   *
   * @exception BackendException if the call failed
   */
  public <R> List<R> list(final ResourceType<R, ?> type, final Scope scope) throws BackendException;

  public <R> void create(final ResourceType<R, ?> type, final R resource) throws BackendException;

  public <R> void update(final ResourceType<R, ?> type, final R resource) throws BackendException;

  /**
   * Deletes the resource of the supplied {@link ResourceType}
   * identified by the supplied {@link ResourceIdentity}.
   *
   * @param type the {@link ResourceType}; must not be {@code null}
   *
   * @param identity the {@link ResourceIdentity}; must not be {@code
   * null}
   *
   * @exception ResourceNotFoundException if there is no such resource
   *
   * @exception BackendException if the call failed
   */
  public void delete(final ResourceType<?, ?> type, final ResourceIdentity identity) throws BackendException;

  /**
   * Releases any resources held by this {@link BackendClient}.
   *
   * <p>The default implementation does nothing.</p>
   *
   * @exception IOException if an error occurs
   */
  @Override
  public default void close() throws IOException {

  }

}
