/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.serde;

/** Thrown when a plan document cannot be read. */
public class QueryPlanParseException extends RuntimeException {

  public QueryPlanParseException(String message) {
    super(message);
  }

  public QueryPlanParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
