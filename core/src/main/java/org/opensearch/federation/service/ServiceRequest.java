/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A sub-request for one service: an operation document and its variables. */
@Getter
@ToString
@EqualsAndHashCode
public class ServiceRequest {

  /** Variable carrying the entity representations of an {@code _entities} request. */
  public static final String REPRESENTATIONS = "representations";

  private final String operation;

  private final String operationName;

  private final Map<String, Object> variables;

  public ServiceRequest(String operation, String operationName, Map<String, Object> variables) {
    this.operation = operation;
    this.operationName = operationName;
    // variable values may be null, which ImmutableMap rejects
    this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  public ServiceRequest(String operation, Map<String, Object> variables) {
    this(operation, null, variables);
  }

  public ServiceRequest(String operation) {
    this(operation, null, ImmutableMap.of());
  }

  public Optional<String> getOperationName() {
    return Optional.ofNullable(operationName);
  }
}
