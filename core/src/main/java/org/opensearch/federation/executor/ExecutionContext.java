/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.service.RequestContext;
import org.opensearch.federation.service.ServiceRegistry;

/**
 * State shared by all nodes of one execution: request variables, the request context forwarded to
 * services, the registry, the cancellation signal and the error sink.
 */
@Log4j2
public class ExecutionContext {

  @Getter private final Map<String, Object> variables;

  @Getter private final RequestContext requestContext;

  @Getter private final ServiceRegistry serviceRegistry;

  @Getter private final CancellationSignal cancellationSignal;

  private final Logger diagnostics;

  private final List<ExecutionError> errors = new CopyOnWriteArrayList<>();

  public ExecutionContext(
      Map<String, Object> variables,
      RequestContext requestContext,
      ServiceRegistry serviceRegistry,
      CancellationSignal cancellationSignal,
      Logger diagnostics) {
    Preconditions.checkNotNull(serviceRegistry, "serviceRegistry");
    // request variables may hold null values
    this.variables =
        variables == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    this.requestContext = requestContext == null ? RequestContext.empty() : requestContext;
    this.serviceRegistry = serviceRegistry;
    this.cancellationSignal =
        cancellationSignal == null ? new CancellationSignal() : cancellationSignal;
    this.diagnostics = diagnostics == null ? log : diagnostics;
  }

  public void addError(ExecutionError error) {
    errors.add(error);
  }

  /** Errors recorded so far, in the order they were recorded. */
  public List<ExecutionError> getErrors() {
    return ImmutableList.copyOf(errors);
  }

  public boolean isCancelled() {
    return cancellationSignal.isCancelled();
  }

  public void debug(String message, Object... params) {
    diagnose(Level.DEBUG, message, params);
  }

  public void info(String message, Object... params) {
    diagnose(Level.INFO, message, params);
  }

  public void warn(String message, Object... params) {
    diagnose(Level.WARN, message, params);
  }

  /** Writes to the caller's diagnostics logger. A failing logger never fails the execution. */
  private void diagnose(Level level, String message, Object... params) {
    try {
      diagnostics.log(level, message, params);
    } catch (RuntimeException e) {
      log.warn("Diagnostics logger failed, message was: " + message, e);
    }
  }
}
