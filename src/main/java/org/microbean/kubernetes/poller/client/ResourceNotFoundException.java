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

/**
 * A {@link BackendException} indicating that the resource a call
 * concerned does not exist.
 *
 * <p>This is an answer, not a malfunction: it is never counted as a
 * failure by a {@link BackendCircuitBreaker} and is never masked by a
 * stale {@link ResultCache} entry.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
public class ResourceNotFoundException extends BackendException {

  private static final long serialVersionUID = 1L;

  private final ResourceIdentity identity;

  /**
   * Creates a new {@link ResourceNotFoundException}.
   *
   * @param resourceType the name of the type of resource that was not
   * found; may be {@code null}
   *
   * @param identity the {@link ResourceIdentity} that was not found;
   * may be {@code null}
   */
  public ResourceNotFoundException(final String resourceType, final ResourceIdentity identity) {
    super(resourceType + " \"" + identity + "\" not found");
    this.identity = identity;
  }

  /**
   * Returns the {@link ResourceIdentity} that was not found.
   *
   * @return the {@link ResourceIdentity}, or {@code null}
   */
  public final ResourceIdentity getIdentity() {
    return this.identity;
  }

}
