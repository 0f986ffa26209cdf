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

import java.io.IOException;

/**
 * An {@link IOException} indicating that an operation against a
 * configuration backend did not succeed.
 *
 * <p>Subclasses distinguish the reasons a call can fail: it may have
 * been {@linkplain RateLimitExceededException refused admission}, it
 * may have been {@linkplain CircuitOpenException short-circuited}, the
 * resource it concerned may {@linkplain ResourceNotFoundException not
 * exist}, or the remote call itself may have {@linkplain
 * BackendCallFailedException failed}.</p>
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see BackendClient
 */
public class BackendException extends IOException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new {@link BackendException}.
   */
  public BackendException() {
    super();
  }

  /**
   * Creates a new {@link BackendException}.
   *
   * @param message a detail message; may be {@code null}
   */
  public BackendException(final String message) {
    super(message);
  }

  /**
   * Creates a new {@link BackendException}.
   *
   * @param cause the cause; may be {@code null}
   */
  public BackendException(final Throwable cause) {
    super(cause);
  }

  /**
   * Creates a new {@link BackendException}.
   *
   * @param message a detail message; may be {@code null}
   *
   * @param cause the cause; may be {@code null}
   */
  public BackendException(final String message, final Throwable cause) {
    super(message, cause);
  }

}
