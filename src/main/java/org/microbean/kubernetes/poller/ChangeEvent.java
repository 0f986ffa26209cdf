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

import java.util.EventObject;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

import io.fabric8.kubernetes.client.Watcher;

import net.jcip.annotations.Immutable;

import org.microbean.kubernetes.poller.client.ResourceIdentity;

/**
 * An {@link EventObject} describing one change to one Kubernetes
 * resource between two successive {@linkplain ResourceSnapshot
 * snapshots}.
 *
 * <p>A {@link ChangeEvent} of {@linkplain Type#ADDED type
 * <code>ADDED</code>} has a {@linkplain #getResource() resource} and
 * no {@linkplain #getPriorResource() prior resource}.  One of
 * {@linkplain Type#MODIFIED type <code>MODIFIED</code>} has both.
 * One of {@linkplain Type#DELETED type <code>DELETED</code>} has only
 * a prior resource, which is the last known state of the deleted
 * resource.</p>
 *
 * <p>Every {@link ChangeEvent} produced by one poll cycle carries the
 * same {@linkplain #getVersion() version}, which is the version of
 * the snapshot that the cycle produced.</p>
 *
 * @param <T> the type of Kubernetes resource
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see SnapshotDiffer
 */
@Immutable
public class ChangeEvent<T extends HasMetadata> extends EventObject {


  /*
   * Static fields.
   */


  /**
   * The version of this class for {@linkplain java.io.Serializable
   * serialization purposes}.
   */
  private static final long serialVersionUID = 1L;


  /*
   * Instance fields.
   */


  private final Type type;

  private final ResourceIdentity identity;

  private final T resource;

  private final T priorResource;

  private final long version;


  /*
   * Constructors.
   */


  /**
   * Creates a new {@link ChangeEvent}.
   *
   * @param source the creator of this {@link ChangeEvent}; must not
   * be {@code null}
   *
   * @param type the {@link Type} of this {@link ChangeEvent}; must
   * not be {@code null}
   *
   * @param identity the {@link ResourceIdentity} of the resource that
   * changed; must not be {@code null}
   *
   * @param resource the new state of the resource; must be {@code
   * null} if and only if {@code type} is {@link Type#DELETED}
   *
   * @param priorResource the previous state of the resource; must be
   * {@code null} if and only if {@code type} is {@link Type#ADDED}
   *
   * @param version the version of the snapshot this {@link
   * ChangeEvent} belongs to
   *
   * @exception NullPointerException if {@code type} or {@code
   * identity} is {@code null}
   *
   * @exception IllegalArgumentException if {@code source} is {@code
   * null}, or if {@code resource} or {@code priorResource} is
   * inconsistent with {@code type}
   */
  public ChangeEvent(final Object source,
                     final Type type,
                     final ResourceIdentity identity,
                     final T resource,
                     final T priorResource,
                     final long version) {
    super(source);
    this.type = Objects.requireNonNull(type, "type");
    this.identity = Objects.requireNonNull(identity, "identity");
    switch (type) {
    case ADDED:
      if (resource == null || priorResource != null) {
        throw new IllegalArgumentException("An ADDED event must have a resource and no prior resource");
      }
      break;
    case MODIFIED:
      if (resource == null || priorResource == null) {
        throw new IllegalArgumentException("A MODIFIED event must have a resource and a prior resource");
      }
      break;
    case DELETED:
      if (resource != null || priorResource == null) {
        throw new IllegalArgumentException("A DELETED event must have a prior resource and no resource");
      }
      break;
    default:
      throw new IllegalArgumentException("type: " + type);
    }
    this.resource = resource;
    this.priorResource = priorResource;
    this.version = version;
  }


  /*
   * Instance methods.
   */


  public final Type getType() {
    return this.type;
  }

  /**
   * Returns the {@link Watcher.Action} corresponding to this {@link
   * ChangeEvent}'s {@linkplain #getType() type}.
   *
   * @return a non-{@code null} {@link Watcher.Action}
   */
  public final Watcher.Action getAction() {
    return this.type.getAction();
  }

  public final ResourceIdentity getIdentity() {
    return this.identity;
  }

  /**
   * Returns the new state of the resource, or {@code null} if this
   * {@link ChangeEvent} is of {@linkplain Type#DELETED type
   * <code>DELETED</code>}.
   *
   * @return the resource, or {@code null}
   */
  public final T getResource() {
    return this.resource;
  }

  /**
   * Returns the previous state of the resource, or {@code null} if
   * this {@link ChangeEvent} is of {@linkplain Type#ADDED type
   * <code>ADDED</code>}.
   *
   * @return the prior resource, or {@code null}
   */
  public final T getPriorResource() {
    return this.priorResource;
  }

  /**
   * Returns the most recent known state of the resource: the
   * {@linkplain #getResource() resource} or, for a deletion, the
   * {@linkplain #getPriorResource() prior resource}.
   *
   * @return a non-{@code null} resource
   */
  public final T getLatestResource() {
    return this.resource == null ? this.priorResource : this.resource;
  }

  public final long getVersion() {
    return this.version;
  }

  @Override
  public int hashCode() {
    int hashCode = 37;

    final Object source = this.getSource();
    int c = source == null ? 0 : source.hashCode();
    hashCode = hashCode * 17 + c;

    hashCode = hashCode * 17 + this.type.hashCode();

    hashCode = hashCode * 17 + this.identity.hashCode();

    c = this.resource == null ? 0 : this.resource.hashCode();
    hashCode = hashCode * 17 + c;

    c = this.priorResource == null ? 0 : this.priorResource.hashCode();
    hashCode = hashCode * 17 + c;

    hashCode = hashCode * 17 + Long.hashCode(this.version);

    return hashCode;
  }

  @Override
  public boolean equals(final Object other) {
    if (other == this) {
      return true;
    } else if (other instanceof ChangeEvent) {
      final ChangeEvent<?> her = (ChangeEvent<?>)other;
      return
        Objects.equals(this.getSource(), her.getSource()) &&
        this.type == her.type &&
        this.identity.equals(her.identity) &&
        Objects.equals(this.resource, her.resource) &&
        Objects.equals(this.priorResource, her.priorResource) &&
        this.version == her.version;
    } else {
      return false;
    }
  }

  @Override
  public String toString() {
    return new StringBuilder().append(this.type).append(": ").append(this.identity).append(" (version ").append(this.version).append(")").toString();
  }


  /*
   * Inner and nested classes.
   */


  /**
   * The kind of change a {@link ChangeEvent} describes.
   *
   * @author <a href="https://about.me/lairdnelson"
   * target="_parent">Laird Nelson</a>
   */
  public static enum Type {

    /**
     * A resource appeared.
     */
    ADDED(Watcher.Action.ADDED),

    /**
     * A resource's state changed.
     */
    MODIFIED(Watcher.Action.MODIFIED),

    /**
     * A resource disappeared.
     */
    DELETED(Watcher.Action.DELETED);

    private final Watcher.Action action;

    private Type(final Watcher.Action action) {
      this.action = action;
    }

    public final Watcher.Action getAction() {
      return this.action;
    }

  }

}
