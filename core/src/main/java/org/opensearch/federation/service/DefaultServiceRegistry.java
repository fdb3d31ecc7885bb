/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Immutable registry built from a fixed set of named endpoints. */
public class DefaultServiceRegistry implements ServiceRegistry {

  private final Map<String, ServiceEndpoint> endpoints;

  public DefaultServiceRegistry(Map<String, ServiceEndpoint> endpoints) {
    Preconditions.checkNotNull(endpoints, "endpoints");
    this.endpoints = ImmutableMap.copyOf(endpoints);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<ServiceEndpoint> lookup(String serviceName) {
    return Optional.ofNullable(endpoints.get(serviceName));
  }

  public Set<String> getServiceNames() {
    return endpoints.keySet();
  }

  public static class Builder {
    private final ImmutableMap.Builder<String, ServiceEndpoint> endpoints = ImmutableMap.builder();

    public Builder register(String serviceName, ServiceEndpoint endpoint) {
      endpoints.put(serviceName, endpoint);
      return this;
    }

    /** Fails on duplicate service names. */
    public DefaultServiceRegistry build() {
      return new DefaultServiceRegistry(endpoints.buildOrThrow());
    }
  }
}
