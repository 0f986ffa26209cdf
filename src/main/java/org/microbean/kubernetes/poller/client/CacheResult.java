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

import net.jcip.annotations.Immutable;

/**
 * The value produced by {@link ResultCache#getOrFetch(Object,
 * BackendCall)}, together with an indication of whether it was served
 * from the cache after a failed fetch.
 *
 * @param <V> the type of the value
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
@Immutable
public final class CacheResult<V> {

  private final V value;

  private final boolean stale;

  CacheResult(final V value, final boolean stale) {
    super();
    this.value = value;
    this.stale = stale;
  }

  public final V getValue() {
    return this.value;
  }

  /**
   * Returns {@code true} if the fetch that produced this {@link
   * CacheResult} failed and its value is a previously cached one.
   *
   * @return {@code true} if the value is stale
   */
  public final boolean isStale() {
    return this.stale;
  }

  @Override
  public final String toString() {
    return (this.stale ? "stale: " : "fresh: ") + this.value;
  }

}
