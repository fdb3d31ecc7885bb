/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.federation.planner.plan.QueryPlan;

/** Merged data and errors of one plan execution. */
@ToString
public class ExecutionResult {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @Getter private final Map<String, Object> data;

  @Getter private final List<ExecutionError> errors;

  private final QueryPlan queryPlan;

  public ExecutionResult(
      Map<String, Object> data, List<ExecutionError> errors, QueryPlan queryPlan) {
    this.data = Collections.unmodifiableMap(data);
    this.errors = ImmutableList.copyOf(errors);
    this.queryPlan = queryPlan;
  }

  /** The executed plan, when the executor is configured to attach it. */
  public Optional<QueryPlan> getQueryPlan() {
    return Optional.ofNullable(queryPlan);
  }

  /** False when no fetch produced any data. */
  public boolean hasData() {
    return !data.isEmpty();
  }

  /**
   * GraphQL-style response. {@code data} is {@code null} when nothing was fetched and there are
   * errors; {@code errors} is left out when there are none.
   */
  public Map<String, Object> toSpecification() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("data", !hasData() && !errors.isEmpty() ? null : data);
    if (!errors.isEmpty()) {
      spec.put(
          "errors",
          errors.stream().map(ExecutionError::toSpecification).collect(Collectors.toList()));
    }
    return spec;
  }

  /** {@link #toSpecification()} as JSON. */
  public String toJson() {
    try {
      return OBJECT_MAPPER.writeValueAsString(toSpecification());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize execution result", e);
    }
  }
}
