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

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import net.jcip.annotations.Immutable;

/**
 * A restriction, made up of an optional namespace and an optional
 * set of names, on which resources a {@linkplain
 * BackendClient#list(ResourceType, Scope) list operation} returns or
 * on which resources a subscription is told about.
 *
 * <p>A {@link Scope} with no namespace and no names {@linkplain
 * #isUnrestricted() matches everything}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #getCacheKey()
 */
@Immutable
public final class Scope {


  /*
   * Static fields.
   */


  private static final Scope ALL = new Scope(null, null);


  /*
   * Instance fields.
   */


  private final String namespace;

  private final Set<String> names;


  /*
   * Constructors.
   */


  private Scope(final String namespace, final Collection<? extends String> names) {
    super();
    this.namespace = namespace == null || namespace.isEmpty() ? null : namespace;
    if (names == null || names.isEmpty()) {
      this.names = Collections.emptySet();
    } else {
      this.names = Collections.unmodifiableSet(new TreeSet<>(names));
    }
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the namespace this {@link Scope} is restricted to, or
   * {@code null} if it spans all namespaces.
   *
   * @return the namespace, or {@code null}
   */
  public final String getNamespace() {
    return this.namespace;
  }

  /**
   * Returns the sorted, unmodifiable set of names this {@link Scope}
   * is restricted to; an empty set means "any name".
   *
   * @return a non-{@code null} {@link Set}
   */
  public final Set<String> getNames() {
    return this.names;
  }

  /**
   * Returns {@code true} if this {@link Scope} matches every
   * resource.
   *
   * @return {@code true} if this {@link Scope} imposes no restriction
   */
  public final boolean isUnrestricted() {
    return this.namespace == null && this.names.isEmpty();
  }

  /**
   * Returns {@code true} if the resource identified by the supplied
   * {@link ResourceIdentity} falls within this {@link Scope}.
   *
   * @param identity the {@link ResourceIdentity} to test; may be
   * {@code null} in which case {@code false} is returned
   *
   * @return {@code true} if the identity matches
   */
  public final boolean matches(final ResourceIdentity identity) {
    if (identity == null) {
      return false;
    }
    if (this.namespace != null && !this.namespace.equals(identity.getNamespace())) {
      return false;
    }
    return this.names.isEmpty() || this.names.contains(identity.getName());
  }

  /**
   * Returns a normalized {@link String} representation of this {@link
   * Scope} suitable for use in a cache key.
   *
   * <p>Two {@link Scope}s that match the same resources return equal
   * cache keys, and an unrestricted {@link Scope} never collides with
   * a namespaced one.</p>
   *
   * @return a non-{@code null} cache key
   */
  public final String getCacheKey() {
    if (this.isUnrestricted()) {
      return "*";
    }
    final StringBuilder sb = new StringBuilder("ns=");
    if (this.namespace != null) {
      sb.append(this.namespace);
    }
    sb.append(";names=").append(String.join(",", this.names));
    return sb.toString();
  }

  @Override
  public final int hashCode() {
    return Objects.hashCode(this.namespace) * 31 + this.names.hashCode();
  }

  @Override
  public final boolean equals(final Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof Scope) {
      final Scope her = (Scope)other;
      return Objects.equals(this.namespace, her.namespace) && this.names.equals(her.names);
    } else {
      return false;
    }
  }

  @Override
  public final String toString() {
    return this.getCacheKey();
  }


  /*
   * Static methods.
   */


  /**
   * Returns the unrestricted {@link Scope}.
   *
   * @return a non-{@code null} {@link Scope}
   */
  public static final Scope all() {
    return ALL;
  }

  /**
   * Returns a {@link Scope} restricted to the supplied namespace.
   *
   * @param namespace the namespace; may be {@code null} in which
   * case {@link #all()} is returned
   *
   * @return a non-{@code null} {@link Scope}
   */
  public static final Scope namespace(final String namespace) {
    return of(namespace, null);
  }

  /**
   * Returns a {@link Scope} restricted to the supplied namespace and
   * names.
   *
   * @param namespace the namespace; may be {@code null}
   *
   * @param names the names; may be {@code null} or empty
   *
   * @return a non-{@code null} {@link Scope}
   */
  public static final Scope of(final String namespace, final Collection<? extends String> names) {
    final Scope candidate = new Scope(namespace, names);
    return candidate.isUnrestricted() ? ALL : candidate;
  }

}
