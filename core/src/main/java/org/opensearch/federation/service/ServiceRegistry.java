/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import java.util.Optional;

/** Resolves service names used in fetch nodes to endpoints. */
public interface ServiceRegistry {

  Optional<ServiceEndpoint> lookup(String serviceName);
}
