/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Outcome of one {@link ServiceEndpoint#send}: data with field-level errors, or a fatal failure of
 * the whole call.
 */
@ToString
@EqualsAndHashCode
public class ServiceResult {

  private final Map<String, Object> data;

  private final List<ServiceError> errors;

  private final String fatal;

  private ServiceResult(Map<String, Object> data, List<ServiceError> errors, String fatal) {
    this.data = data;
    this.errors = ImmutableList.copyOf(errors);
    this.fatal = fatal;
  }

  public static ServiceResult of(Map<String, Object> data) {
    return new ServiceResult(data, List.of(), null);
  }

  public static ServiceResult of(Map<String, Object> data, List<ServiceError> errors) {
    return new ServiceResult(data, errors, null);
  }

  /** The call itself failed, for example on a network error, a timeout or a malformed response. */
  public static ServiceResult fatal(String reason) {
    Preconditions.checkNotNull(reason, "reason");
    return new ServiceResult(null, List.of(), reason);
  }

  public Optional<Map<String, Object>> getData() {
    return Optional.ofNullable(data);
  }

  public List<ServiceError> getErrors() {
    return errors;
  }

  public Optional<String> getFatal() {
    return Optional.ofNullable(fatal);
  }

  public boolean isFatal() {
    return fatal != null;
  }
}
