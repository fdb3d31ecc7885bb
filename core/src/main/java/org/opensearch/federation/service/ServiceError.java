/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A field-level error reported by a service next to (possibly partial) data. */
@Getter
@ToString
@EqualsAndHashCode
public class ServiceError {

  private final String message;

  /** Path inside the service's own response, or empty when the service gave none. */
  private final List<Object> path;

  private final Map<String, Object> extensions;

  public ServiceError(String message, List<Object> path, Map<String, Object> extensions) {
    this.message = message;
    // copied, service paths may hold nulls that List.copyOf rejects
    this.path = path == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(path));
    this.extensions = extensions == null ? ImmutableMap.of() : ImmutableMap.copyOf(extensions);
  }

  public ServiceError(String message, List<Object> path) {
    this(message, path, null);
  }
}
