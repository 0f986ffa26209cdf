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
 * A {@link BackendException} indicating that a call was skipped
 * because a {@link BackendCircuitBreaker} was not admitting calls.
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 *
 * @see BackendCircuitBreaker#execute(BackendCall)
 */
public class CircuitOpenException extends BackendException {

  private static final long serialVersionUID = 1L;

  public CircuitOpenException(final String message) {
    super(message);
  }

  public CircuitOpenException(final String message, final Throwable cause) {
    super(message, cause);
  }

}
