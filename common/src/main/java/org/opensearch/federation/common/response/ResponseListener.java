/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.response;

/**
 * Receives the outcome of an asynchronous call. Exactly one of the two methods is called, on the
 * thread that completed the call.
 *
 * @param <Response> response type
 */
public interface ResponseListener<Response> {

  void onResponse(Response response);

  /** Called when the call could not produce a response at all. */
  void onFailure(Exception e);
}
