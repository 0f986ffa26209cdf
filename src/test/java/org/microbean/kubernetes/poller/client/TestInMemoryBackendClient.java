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

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class TestInMemoryBackendClient {

  private InMemoryBackendClient client;

  public TestInMemoryBackendClient() {
    super();
  }

  @Before
  public void setUp() {
    this.client = new InMemoryBackendClient();
    this.client.register(Widget.TYPE, Widget::getIdentity);
  }

  @Test
  public void testListHonorsScopeAndCreationOrder() throws Exception {
    this.client.create(Widget.TYPE, new Widget("b", "z", "1", 1L));
    this.client.create(Widget.TYPE, new Widget("a", "y", "2", 1L));
    this.client.create(Widget.TYPE, new Widget("a", "x", "3", 1L));
    List<Widget> widgets = this.client.list(Widget.TYPE, Scope.all());
    assertEquals(3, widgets.size());
    assertEquals("z", widgets.get(0).getName());
    widgets = this.client.list(Widget.TYPE, Scope.namespace("a"));
    assertEquals(2, widgets.size());
    widgets = this.client.list(Widget.TYPE, Scope.of("a", Arrays.asList("x")));
    assertEquals(1, widgets.size());
    assertEquals("3", widgets.get(0).getValue());
  }

  @Test
  public void testCreateUpdateDelete() throws Exception {
    final ResourceIdentity identity = new ResourceIdentity("a", "x");
    this.client.create(Widget.TYPE, new Widget("a", "x", "1", 1L));
    try {
      this.client.create(Widget.TYPE, new Widget("a", "x", "1", 1L));
      fail();
    } catch (final BackendException expected) {
      assertFalse(expected instanceof ResourceNotFoundException);
    }
    this.client.update(Widget.TYPE, new Widget("a", "x", "2", 2L));
    assertEquals("2", this.client.get(Widget.TYPE, identity).getValue());
    this.client.delete(Widget.TYPE, identity);
    try {
      this.client.get(Widget.TYPE, identity);
      fail();
    } catch (final ResourceNotFoundException expected) {

    }
    try {
      this.client.update(Widget.TYPE, new Widget("a", "x", "3", 3L));
      fail();
    } catch (final ResourceNotFoundException expected) {

    }
    assertTrue(this.client.list(Widget.TYPE, null).isEmpty());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnregisteredTypeIsRejected() throws Exception {
    new InMemoryBackendClient().list(Widget.TYPE, Scope.all());
  }

}
