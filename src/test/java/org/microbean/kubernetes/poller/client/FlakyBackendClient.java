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

import java.util.List;
import java.util.Objects;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link BackendClient} that forwards to another one, counts the
 * calls it forwards, and can be told to fail or to stall.
 */
public class FlakyBackendClient implements BackendClient {

  private final BackendClient delegate;

  private final AtomicInteger getCount;

  private final AtomicInteger listCount;

  private final AtomicInteger writeCount;

  private volatile Exception failure;

  private volatile long delayMillis;

  public FlakyBackendClient(final BackendClient delegate) {
    super();
    this.delegate = Objects.requireNonNull(delegate);
    this.getCount = new AtomicInteger();
    this.listCount = new AtomicInteger();
    this.writeCount = new AtomicInteger();
  }

  public final void failWith(final BackendException failure) {
    this.failure = failure;
  }

  public final void failWith(final RuntimeException failure) {
    this.failure = failure;
  }

  public final void recover() {
    this.failure = null;
  }

  public final void stallFor(final long delayMillis) {
    this.delayMillis = delayMillis;
  }

  public final int getGetCount() {
    return this.getCount.get();
  }

  public final int getListCount() {
    return this.listCount.get();
  }

  public final int getWriteCount() {
    return this.writeCount.get();
  }

  private final void maybeFail() throws BackendException {
    final long delayMillis = this.delayMillis;
    if (delayMillis > 0L) {
      try {
        Thread.sleep(delayMillis);
      } catch (final InterruptedException interruptedException) {
        Thread.currentThread().interrupt();
        throw new BackendException("interrupted", interruptedException);
      }
    }
    final Exception failure = this.failure;
    if (failure instanceof BackendException) {
      throw (BackendException)failure;
    } else if (failure instanceof RuntimeException) {
      throw (RuntimeException)failure;
    }
  }

  @Override
  public <R> R get(final ResourceType<R, ?> type, final ResourceIdentity identity) throws BackendException {
    this.getCount.incrementAndGet();
    this.maybeFail();
    return this.delegate.get(type, identity);
  }

  @Override
  public <R> List<R> list(final ResourceType<R, ?> type, final Scope scope) throws BackendException {
    this.listCount.incrementAndGet();
    this.maybeFail();
    return this.delegate.list(type, scope);
  }

  @Override
  public <R> void create(final ResourceType<R, ?> type, final R resource) throws BackendException {
    this.writeCount.incrementAndGet();
    this.maybeFail();
    this.delegate.create(type, resource);
  }

  @Override
  public <R> void update(final ResourceType<R, ?> type, final R resource) throws BackendException {
    this.writeCount.incrementAndGet();
    this.maybeFail();
    this.delegate.update(type, resource);
  }

  @Override
  public void delete(final ResourceType<?, ?> type, final ResourceIdentity identity) throws BackendException {
    this.writeCount.incrementAndGet();
    this.maybeFail();
    this.delegate.delete(type, identity);
  }

}
