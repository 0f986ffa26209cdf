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

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} whose time only moves when told to.
 */
public final class MutableClock extends Clock {

  private volatile Instant instant;

  public MutableClock() {
    this(Instant.parse("2018-01-01T00:00:00Z"));
  }

  public MutableClock(final Instant instant) {
    super();
    this.instant = instant;
  }

  public final void advance(final Duration duration) {
    this.instant = this.instant.plus(duration);
  }

  @Override
  public final Instant instant() {
    return this.instant;
  }

  @Override
  public final ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public final Clock withZone(final ZoneId zone) {
    return this;
  }

}
