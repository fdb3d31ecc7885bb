/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.federation.planner.plan.ResponsePath;

/** An error attached to the final response at a concrete path. */
@Getter
@ToString
@EqualsAndHashCode
public class ExecutionError {

  public static final String CODE = "code";

  public static final String SERVICE_NAME = "serviceName";

  private final ResponsePath path;

  private final String message;

  private final Map<String, Object> extensions;

  public ExecutionError(ResponsePath path, String message, Map<String, Object> extensions) {
    this.path = path;
    this.message = message;
    this.extensions = ImmutableMap.copyOf(extensions);
  }

  public static ExecutionError of(
      ResponsePath path, String message, ErrorCode code, String serviceName) {
    return new ExecutionError(
        path, message, ImmutableMap.of(CODE, code.name(), SERVICE_NAME, serviceName));
  }

  /** The error code, or {@code null} when the service that raised the error supplied none. */
  public String getCode() {
    Object code = extensions.get(CODE);
    return code == null ? null : code.toString();
  }

  /** GraphQL-style error object; the path is left out for errors at the response root. */
  public Map<String, Object> toSpecification() {
    Map<String, Object> spec = new LinkedHashMap<>();
    spec.put("message", message);
    if (!path.isRoot()) {
      spec.put("path", path.toList());
    }
    if (!extensions.isEmpty()) {
      spec.put("extensions", extensions);
    }
    return spec;
  }
}
