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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.HasMetadata;

import org.microbean.kubernetes.poller.client.ResourceIdentity;

/**
 * Computes the {@link ChangeEvent}s that turn one {@link
 * ResourceSnapshot} into another.
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see #diff(Object, ResourceSnapshot, ResourceSnapshot)
 */
public final class SnapshotDiffer {


  /*
   * Constructors.
   */


  private SnapshotDiffer() {
    super();
  }


  /*
   * Static methods.
   */


  /**
   * Returns the {@link ChangeEvent}s that turn {@code previous} into
   * {@code current}.
   *
   * <p>Walking {@code current} in its iteration order, a resource
   * absent from {@code previous} yields an {@link
   * ChangeEvent.Type#ADDED ADDED} event and one whose version token or
   * value differs from its counterpart in {@code previous} yields a
   * {@link ChangeEvent.Type#MODIFIED MODIFIED} event.  Then, walking
   * {@code previous} in its iteration order, a resource absent from
   * {@code current} yields a {@link ChangeEvent.Type#DELETED DELETED}
   * event carrying its last known state.  Every event carries {@code
   * current}'s {@linkplain ResourceSnapshot#getVersion() version}.</p>
   *
   * <p>This method has no side effects and always returns the same
   * result for the same inputs.</p>
   *
   * @param <T> the type of Kubernetes resource
   *
   * @param source the {@linkplain java.util.EventObject#getSource()
   * source} of every returned {@link ChangeEvent}; must not be {@code
   * null}
   *
   * @param previous the earlier {@link ResourceSnapshot}; may be
   * {@code null} in which case it is treated as {@linkplain
   * ResourceSnapshot#empty() empty}
   *
   * @param current the later {@link ResourceSnapshot}; must not be
   * {@code null}
   *
   * @return a non-{@code null}, unmodifiable {@link List} of {@link
   * ChangeEvent}s, empty if nothing changed
   *
   * @exception NullPointerException if {@code source} or {@code
   * current} is {@code null}
   *
   * @exception IllegalArgumentException if {@code current}'s version
   * is not greater than {@code previous}'s, unless the two are the
   * same object
   */
  public static final <T extends HasMetadata> List<ChangeEvent<T>> diff(final Object source,
                                                                         final ResourceSnapshot<T> previous,
                                                                         final ResourceSnapshot<T> current) {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(current, "current");
    if (previous == current) {
      return Collections.emptyList();
    }
    final ResourceSnapshot<T> prior = previous == null ? ResourceSnapshot.<T>empty() : previous;
    final long version = current.getVersion();
    if (version <= prior.getVersion()) {
      throw new IllegalArgumentException("current.getVersion() <= previous.getVersion(): " + version + " <= " + prior.getVersion());
    }
    final List<ChangeEvent<T>> returnValue = new ArrayList<>();
    for (final ResourceSnapshot.Entry<T> entry : current.getEntries()) {
      final ResourceIdentity identity = entry.getIdentity();
      final ResourceSnapshot.Entry<T> priorEntry = prior.get(identity);
      if (priorEntry == null) {
        returnValue.add(new ChangeEvent<>(source, ChangeEvent.Type.ADDED, identity, entry.getResource(), null, version));
      } else if (!entry.isSameStateAs(priorEntry)) {
        returnValue.add(new ChangeEvent<>(source, ChangeEvent.Type.MODIFIED, identity, entry.getResource(), priorEntry.getResource(), version));
      }
    }
    for (final ResourceSnapshot.Entry<T> priorEntry : prior.getEntries()) {
      final ResourceIdentity identity = priorEntry.getIdentity();
      if (!current.contains(identity)) {
        returnValue.add(new ChangeEvent<>(source, ChangeEvent.Type.DELETED, identity, null, priorEntry.getResource(), version));
      }
    }
    return Collections.unmodifiableList(returnValue);
  }

}
