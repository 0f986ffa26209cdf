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

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;

import org.microbean.kubernetes.poller.client.ResourceType;
import org.microbean.kubernetes.poller.client.Widget;

/**
 * Presents {@link Widget}s as {@link ConfigMap}s whose resource
 * version is the widget's revision.
 */
public class WidgetConverter implements Converter<Widget, ConfigMap> {

  public WidgetConverter() {
    super();
  }

  @Override
  public ResourceType<Widget, ConfigMap> getResourceType() {
    return Widget.TYPE;
  }

  @Override
  public ConfigMap convert(final Widget raw) {
    return configMap(raw.getNamespace(), raw.getName(), raw.getValue(), raw.getRevision());
  }

  public static final ConfigMap configMap(final String namespace, final String name, final String value, final long revision) {
    return new ConfigMapBuilder()
      .withNewMetadata()
      .withNamespace(namespace)
      .withName(name)
      .withResourceVersion(Long.toString(revision))
      .endMetadata()
      .addToData("value", value)
      .build();
  }

}
