/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Request-scoped data, such as headers or credentials, that the executor passes unchanged to every
 * {@link ServiceEndpoint#send}.
 */
@ToString
@EqualsAndHashCode
public class RequestContext {

  private static final RequestContext EMPTY = new RequestContext(ImmutableMap.of());

  private final Map<String, Object> attributes;

  public RequestContext(Map<String, Object> attributes) {
    this.attributes = ImmutableMap.copyOf(attributes);
  }

  public static RequestContext empty() {
    return EMPTY;
  }

  public Optional<Object> getAttribute(String name) {
    return Optional.ofNullable(attributes.get(name));
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }
}
