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

import io.fabric8.kubernetes.api.model.HasMetadata;

import org.microbean.kubernetes.poller.client.ResourceIdentity;
import org.microbean.kubernetes.poller.client.ResourceType;

/**
 * Converts raw backend objects of one {@link ResourceType} into the
 * Kubernetes resources that are handed to subscribers.
 *
 * <p>One {@link Converter} is {@linkplain
 * PollerManager#register(Converter) registered} with a {@link
 * PollerManager} for each {@link ResourceType} it is to poll.</p>
 *
 * @param <R> the type of raw backend object
 *
 * @param <T> the type of Kubernetes resource
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
public interface Converter<R, T extends HasMetadata> {

  /**
   * Returns the {@link ResourceType} this {@link Converter} handles.
   *
   * @return a non-{@code null} {@link ResourceType}
   */
  public ResourceType<R, T> getResourceType();

  /**
   * Converts the supplied raw object into a Kubernetes resource.
   *
   * @param raw the raw object; never {@code null}
   *
   * @return a non-{@code null} Kubernetes resource
   *
   * @exception RuntimeException if {@code raw} cannot be converted
   */
  public T convert(final R raw);

  /**
   * Returns the {@link ResourceIdentity} of the supplied raw object.
   *
   * <p>The default implementation returns the {@linkplain
   * HasMetadatas#getIdentity(HasMetadata) identity recorded in the
   * converted resource's metadata}.</p>
   *
   * @param raw the raw object; never {@code null}
   *
   * @param resource the result of {@linkplain #convert(Object)
   * converting} {@code raw}; never {@code null}
   *
   * @return a non-{@code null} {@link ResourceIdentity}
   */
  public default ResourceIdentity getIdentity(final R raw, final T resource) {
    return HasMetadatas.getIdentity(resource);
  }

  /**
   * Returns an opaque token that changes whenever the supplied raw
   * object changes, or {@code null} if there is none, in which case
   * changes are detected by comparing converted resources for
   * {@linkplain Object#equals(Object) equality}.
   *
   * <p>The default implementation returns the converted resource's
   * {@linkplain HasMetadatas#getResourceVersion(HasMetadata) resource
   * version}.</p>
   *
   * @param raw the raw object; never {@code null}
   *
   * @param resource the result of {@linkplain #convert(Object)
   * converting} {@code raw}; never {@code null}
   *
   * @return a version token, or {@code null}
   */
  public default Object getVersion(final R raw, final T resource) {
    return HasMetadatas.getResourceVersion(resource);
  }

}
