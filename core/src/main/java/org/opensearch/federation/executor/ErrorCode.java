/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

/** Category of an {@link ExecutionError}, reported as {@code extensions.code}. */
public enum ErrorCode {
  /** A fetch names a service the registry does not know. */
  CONFIGURATION_ERROR,

  /** A service call failed as a whole. */
  SERVICE_ERROR,

  /** A service reported an error for one of its fields. */
  DOWNSTREAM_SERVICE_ERROR,

  /** An entities request returned a result list that does not line up with its representations. */
  ENTITY_BATCH_MISMATCH,

  /** The execution was cancelled before the fetch completed. */
  CANCELLED,

  /** The executor failed while processing a result. */
  INTERNAL_ERROR
}
