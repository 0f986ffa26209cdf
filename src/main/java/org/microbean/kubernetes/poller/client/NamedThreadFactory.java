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

import java.util.Objects;

import java.util.concurrent.ThreadFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link ThreadFactory} that {@linkplain #newThread(Runnable)
 * produces new <code>Thread</code>s} with sane names.
 *
 * @author <a href="https://about.me/lairdnelson"
 * target="_parent">Laird Nelson</a>
 */
public final class NamedThreadFactory implements ThreadFactory {

  private final ThreadGroup group;

  private final String prefix;

  private final boolean daemon;

  private final AtomicInteger threadNumber = new AtomicInteger(1);

  /**
   * Creates a new {@link NamedThreadFactory}.
   *
   * @param prefix the prefix of every {@link Thread} name, to which a
   * sequence number is appended; must not be {@code null}
   *
   * @param daemon whether produced {@link Thread}s are daemon threads
   *
   * @exception NullPointerException if {@code prefix} is {@code null}
   */
  public NamedThreadFactory(final String prefix, final boolean daemon) {
    super();
    this.prefix = Objects.requireNonNull(prefix, "prefix");
    this.daemon = daemon;
    this.group = Thread.currentThread().getThreadGroup();
  }

  @Override
  public final Thread newThread(final Runnable runnable) {
    final Thread returnValue = new Thread(this.group, runnable, this.prefix + this.threadNumber.getAndIncrement(), 0);
    if (returnValue.isDaemon() != this.daemon) {
      returnValue.setDaemon(this.daemon);
    }
    if (returnValue.getPriority() != Thread.NORM_PRIORITY) {
      returnValue.setPriority(Thread.NORM_PRIORITY);
    }
    return returnValue;
  }

}
