/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

/**
 * A named data service the executor dispatches fetches to. Implementations own transport, retries
 * and per-call timeouts.
 */
@FunctionalInterface
public interface ServiceEndpoint {

  /**
   * Sends one sub-request. Implementations report transport and internal failures through {@link
   * ServiceResult#fatal(String)} and must return promptly once the calling thread is interrupted.
   *
   * @param request operation and variables
   * @param context request-scoped data forwarded unchanged from the caller
   * @return the service's result
   */
  ServiceResult send(ServiceRequest request, RequestContext context);
}
