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

import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

import net.jcip.annotations.Immutable;

/**
 * A typed token naming one category of managed resource, such as
 * {@code services} or {@code addressgroups}.
 *
 * <p>A {@link ResourceType} links the class of the raw object a
 * {@link BackendClient} deals in with the class of the Kubernetes
 * resource that object is presented as to watchers.  Two {@link
 * ResourceType}s are equal if their {@linkplain #getName() names} are
 * equal.</p>
 *
 * @param <R> the type of raw backend object
 *
 * @param <T> the type of Kubernetes resource
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
@Immutable
public final class ResourceType<R, T extends HasMetadata> {

  private final String name;

  private final Class<R> backendClass;

  private final Class<T> resourceClass;

  /**
   * Creates a new {@link ResourceType}.
   *
   * @param name the plural, lowercase name of the resource type; must
   * not be {@code null} or empty
   *
   * @param backendClass the class of raw backend objects; must not
   * be {@code null}
   *
   * @param resourceClass the class of Kubernetes resources; must not
   * be {@code null}
   *
   * @exception NullPointerException if any parameter is {@code null}
   *
   * @exception IllegalArgumentException if {@code name} is empty
   */
  public ResourceType(final String name, final Class<R> backendClass, final Class<T> resourceClass) {
    super();
    this.name = Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name.isEmpty()");
    }
    this.backendClass = Objects.requireNonNull(backendClass, "backendClass");
    this.resourceClass = Objects.requireNonNull(resourceClass, "resourceClass");
  }

  public final String getName() {
    return this.name;
  }

  public final Class<R> getBackendClass() {
    return this.backendClass;
  }

  public final Class<T> getResourceClass() {
    return this.resourceClass;
  }

  @Override
  public final int hashCode() {
    return this.name.hashCode();
  }

  @Override
  public final boolean equals(final Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof ResourceType) {
      return this.name.equals(((ResourceType<?, ?>)other).name);
    } else {
      return false;
    }
  }

  @Override
  public final String toString() {
    return this.name;
  }

}
