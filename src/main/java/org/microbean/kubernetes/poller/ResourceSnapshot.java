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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import io.fabric8.kubernetes.api.model.HasMetadata;

import net.jcip.annotations.Immutable;

import org.microbean.kubernetes.poller.client.ResourceIdentity;

/**
 * An immutable, versioned, point-in-time view of every resource of
 * one {@linkplain org.microbean.kubernetes.poller.client.ResourceType
 * resource type}, indexed by {@link ResourceIdentity}.
 *
 * <p>A {@link ResourceSnapshot} never contains two entries with the
 * same {@link ResourceIdentity}.  Its entries are iterated in the
 * order in which they were {@linkplain Builder#put(ResourceIdentity,
 * HasMetadata, Object) added}.</p>
 *
 * @param <T> the type of Kubernetes resource
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see SnapshotDiffer
 */
@Immutable
public final class ResourceSnapshot<T extends HasMetadata> {


  /*
   * Static fields.
   */


  private static final ResourceSnapshot<?> EMPTY = new ResourceSnapshot<>(0L, Collections.emptyMap());


  /*
   * Instance fields.
   */


  private final long version;

  private final Map<ResourceIdentity, Entry<T>> entries;


  /*
   * Constructors.
   */


  private ResourceSnapshot(final long version, final Map<ResourceIdentity, Entry<T>> entries) {
    super();
    this.version = version;
    this.entries = entries;
  }


  /*
   * Instance methods.
   */


  /**
   * Returns the version of this {@link ResourceSnapshot}.
   *
   * <p>Versions only ever increase over the successive snapshots of a
   * resource type.  The {@linkplain #empty() empty snapshot} has
   * version {@code 0}.</p>
   *
   * @return the version
   */
  public final long getVersion() {
    return this.version;
  }

  public final int size() {
    return this.entries.size();
  }

  public final boolean isEmpty() {
    return this.entries.isEmpty();
  }

  public final boolean contains(final ResourceIdentity identity) {
    return identity != null && this.entries.containsKey(identity);
  }

  /**
   * Returns the {@link Entry} for the supplied {@link
   * ResourceIdentity}, or {@code null} if there is none.
   *
   * @param identity the {@link ResourceIdentity}; may be {@code null}
   *
   * @return an {@link Entry}, or {@code null}
   */
  public final Entry<T> get(final ResourceIdentity identity) {
    return identity == null ? null : this.entries.get(identity);
  }

  /**
   * Returns the resource identified by the supplied {@link
   * ResourceIdentity}, or {@code null} if there is none.
   *
   * @param identity the {@link ResourceIdentity}; may be {@code null}
   *
   * @return a resource, or {@code null}
   */
  public final T getResource(final ResourceIdentity identity) {
    final Entry<T> entry = this.get(identity);
    return entry == null ? null : entry.getResource();
  }

  public final Set<ResourceIdentity> getIdentities() {
    return Collections.unmodifiableSet(this.entries.keySet());
  }

  public final Collection<Entry<T>> getEntries() {
    return Collections.unmodifiableCollection(this.entries.values());
  }

  @Override
  public final String toString() {
    return "ResourceSnapshot[version=" + this.version + ", identities=" + this.entries.keySet() + "]";
  }


  /*
   * Static methods.
   */


  /**
   * Returns an empty {@link ResourceSnapshot} whose {@linkplain
   * #getVersion() version} is {@code 0}.
   *
   * @param <T> the type of Kubernetes resource
   *
   * @return a non-{@code null} empty {@link ResourceSnapshot}
   */
  @SuppressWarnings("unchecked")
  public static final <T extends HasMetadata> ResourceSnapshot<T> empty() {
    return (ResourceSnapshot<T>)EMPTY;
  }


  /*
   * Inner and nested classes.
   */


  /**
   * A resource in a {@link ResourceSnapshot} together with its
   * {@link ResourceIdentity} and opaque version token.
   *
   * @param <T> the type of Kubernetes resource
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  @Immutable
  public static final class Entry<T extends HasMetadata> {

    private final ResourceIdentity identity;

    private final T resource;

    private final Object versionToken;

    private Entry(final ResourceIdentity identity, final T resource, final Object versionToken) {
      super();
      this.identity = identity;
      this.resource = resource;
      this.versionToken = versionToken;
    }

    public final ResourceIdentity getIdentity() {
      return this.identity;
    }

    public final T getResource() {
      return this.resource;
    }

    /**
     * Returns the opaque version token of this {@link Entry}'s
     * resource, or {@code null} if it has none.
     *
     * @return the version token, or {@code null}
     */
    public final Object getVersionToken() {
      return this.versionToken;
    }

    /**
     * Returns {@code true} if this {@link Entry} and the supplied
     * {@link Entry} describe the same state of a resource: their
     * version tokens and their resources are both equal.
     *
     * @param other the other {@link Entry}; may be {@code null}
     *
     * @return {@code true} if nothing differs
     */
    public final boolean isSameStateAs(final Entry<?> other) {
      return other != null &&
        Objects.equals(this.versionToken, other.versionToken) &&
        Objects.equals(this.resource, other.resource);
    }

    @Override
    public final String toString() {
      return this.identity + "@" + this.versionToken;
    }

  }

  /**
   * A single-use builder of {@link ResourceSnapshot}s.
   *
   * <p>Instances of this class are not safe for concurrent use.</p>
   *
   * @param <T> the type of Kubernetes resource
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  public static final class Builder<T extends HasMetadata> {

    private Map<ResourceIdentity, Entry<T>> entries;

    public Builder() {
      super();
      this.entries = new LinkedHashMap<>();
    }

    /**
     * Adds a resource to the snapshot being built, unless a resource
     * with the same {@link ResourceIdentity} has already been added.
     *
     * @param identity the {@link ResourceIdentity}; must not be
     * {@code null}
     *
     * @param resource the resource; must not be {@code null}
     *
     * @param versionToken the opaque version token; may be {@code
     * null}
     *
     * @return {@code true} if the resource was added; {@code false}
     * if its {@link ResourceIdentity} was already present, in which
     * case the snapshot being built is unchanged
     *
     * @exception NullPointerException if {@code identity} or {@code
     * resource} is {@code null}
     *
     * @exception IllegalStateException if {@link #build(long)} has
     * already been called
     */
    public final boolean put(final ResourceIdentity identity, final T resource, final Object versionToken) {
      Objects.requireNonNull(identity, "identity");
      Objects.requireNonNull(resource, "resource");
      if (this.entries == null) {
        throw new IllegalStateException("build() already called");
      }
      if (this.entries.containsKey(identity)) {
        return false;
      }
      this.entries.put(identity, new Entry<>(identity, resource, versionToken));
      return true;
    }

    /**
     * Builds a {@link ResourceSnapshot} with the supplied version.
     *
     * @param version the version; must not be negative
     *
     * @return a new {@link ResourceSnapshot}
     *
     * @exception IllegalArgumentException if {@code version} is
     * negative
     *
     * @exception IllegalStateException if this method has already been
     * called
     */
    public final ResourceSnapshot<T> build(final long version) {
      if (version < 0L) {
        throw new IllegalArgumentException("version < 0: " + version);
      }
      if (this.entries == null) {
        throw new IllegalStateException("build() already called");
      }
      final Map<ResourceIdentity, Entry<T>> entries = Collections.unmodifiableMap(this.entries);
      this.entries = null;
      return new ResourceSnapshot<>(version, entries);
    }

  }

}
