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

import java.io.Serializable;

import java.util.Objects;

import net.jcip.annotations.Immutable;

/**
 * An immutable composite key, made up of a namespace and a name, that
 * uniquely identifies one resource within a {@linkplain ResourceType
 * resource type}.
 *
 * <p>The namespace may be {@code null} or {@linkplain
 * String#isEmpty() empty}, in which case the resource is treated as
 * not being namespaced.  {@code null} and empty namespaces are
 * considered equal.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #getKey()
 */
@Immutable
public final class ResourceIdentity implements Comparable<ResourceIdentity>, Serializable {


  /*
   * Static fields.
   */


  private static final long serialVersionUID = 1L;


  /*
   * Instance fields.
   */


  private final String namespace;

  private final String name;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ResourceIdentity}.
   *
   * @param namespace the namespace; may be {@code null}
   *
   * @param name the name; must not be {@code null} or {@linkplain
   * String#isEmpty() empty}
   *
   * @exception NullPointerException if {@code name} is {@code null}
   *
   * @exception IllegalArgumentException if {@code name} is empty
   */
  public ResourceIdentity(final String namespace, final String name) {
    super();
    Objects.requireNonNull(name, "name");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name.isEmpty()");
    }
    this.namespace = namespace == null ? "" : namespace;
    this.name = name;
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the namespace of this {@link ResourceIdentity}, which
   * will be {@linkplain String#isEmpty() empty} but never {@code
   * null} if the resource is not namespaced.
   *
   * @return the namespace; never {@code null}
   */
  public final String getNamespace() {
    return this.namespace;
  }

  /**
   * Returns the name of this {@link ResourceIdentity}.
   *
   * @return the name; never {@code null}
   */
  public final String getName() {
    return this.name;
  }

  /**
   * Returns a {@link String} key for this {@link ResourceIdentity} of
   * the form <code><em>namespace</em>/<em>name</em></code>, or just
   * <code><em>name</em></code> if there is no namespace.
   *
   * @return a non-{@code null} key
   */
  public final String getKey() {
    if (this.namespace.isEmpty()) {
      return this.name;
    }
    return new StringBuilder(this.namespace).append("/").append(this.name).toString();
  }

  @Override
  public final int compareTo(final ResourceIdentity other) {
    final int namespaceComparison = this.namespace.compareTo(other.namespace);
    if (namespaceComparison != 0) {
      return namespaceComparison;
    }
    return this.name.compareTo(other.name);
  }

  @Override
  public final int hashCode() {
    return this.namespace.hashCode() * 31 + this.name.hashCode();
  }

  @Override
  public final boolean equals(final Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof ResourceIdentity) {
      final ResourceIdentity her = (ResourceIdentity)other;
      return this.namespace.equals(her.namespace) && this.name.equals(her.name);
    } else {
      return false;
    }
  }

  @Override
  public final String toString() {
    return this.getKey();
  }

}
