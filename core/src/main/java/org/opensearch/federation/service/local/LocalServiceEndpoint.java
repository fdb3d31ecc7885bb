/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service.local;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.federation.service.RequestContext;
import org.opensearch.federation.service.ServiceEndpoint;
import org.opensearch.federation.service.ServiceError;
import org.opensearch.federation.service.ServiceRequest;
import org.opensearch.federation.service.ServiceResult;

/**
 * A service running in the same JVM, backed by resolver functions.
 *
 * <p>Requests carrying {@value ServiceRequest#REPRESENTATIONS} are entities requests: each
 * representation is resolved on its own by the resolver registered for its {@code __typename}, so a
 * failing entity only yields a {@code null} entry and an error at {@code _entities.<index>}. Any
 * other request goes to the root resolver.
 */
@Log4j2
public class LocalServiceEndpoint implements ServiceEndpoint {

  /** Resolves a root operation to response data. */
  @FunctionalInterface
  public interface RootResolver {
    Map<String, Object> resolve(ServiceRequest request, RequestContext context);
  }

  /** Resolves one entity representation to the entity's requested fields. */
  @FunctionalInterface
  public interface EntityResolver {
    Map<String, Object> resolve(Map<String, Object> representation, RequestContext context);
  }

  @Getter private final String serviceName;

  private final RootResolver rootResolver;

  private final Map<String, EntityResolver> entityResolvers;

  private LocalServiceEndpoint(
      String serviceName, RootResolver rootResolver, Map<String, EntityResolver> entityResolvers) {
    this.serviceName = serviceName;
    this.rootResolver = rootResolver;
    this.entityResolvers = entityResolvers;
  }

  public static Builder builder(String serviceName) {
    return new Builder(serviceName);
  }

  @Override
  public ServiceResult send(ServiceRequest request, RequestContext context) {
    if (request.getVariables().containsKey(ServiceRequest.REPRESENTATIONS)) {
      return resolveEntities(request.getVariables().get(ServiceRequest.REPRESENTATIONS), context);
    }
    if (rootResolver == null) {
      return ServiceResult.fatal("Service [" + serviceName + "] has no root resolver");
    }
    try {
      return ServiceResult.of(rootResolver.resolve(request, context));
    } catch (RuntimeException e) {
      log.warn("Root resolver of service [{}] failed", serviceName, e);
      return ServiceResult.fatal(String.valueOf(e.getMessage()));
    }
  }

  @SuppressWarnings("unchecked")
  private ServiceResult resolveEntities(Object representations, RequestContext context) {
    if (!(representations instanceof List)) {
      return ServiceResult.fatal(
          "Variable [" + ServiceRequest.REPRESENTATIONS + "] of service [" + serviceName
              + "] must be a list");
    }
    List<?> batch = (List<?>) representations;
    List<Object> entities = new ArrayList<>(batch.size());
    List<ServiceError> errors = new ArrayList<>();
    for (int i = 0; i < batch.size(); i++) {
      Object representation = batch.get(i);
      try {
        Preconditions.checkArgument(
            representation instanceof Map, "Representation must be an object");
        Map<String, Object> fields = (Map<String, Object>) representation;
        Object typename = fields.get("__typename");
        EntityResolver resolver = entityResolvers.get(String.valueOf(typename));
        if (resolver == null) {
          throw new IllegalArgumentException(
              "Service [" + serviceName + "] cannot resolve entities of type " + typename);
        }
        entities.add(resolver.resolve(fields, context));
      } catch (RuntimeException e) {
        entities.add(null);
        errors.add(new ServiceError(String.valueOf(e.getMessage()), List.of("_entities", i)));
      }
    }
    return ServiceResult.of(ImmutableMap.of("_entities", entities), errors);
  }

  public static class Builder {
    private final String serviceName;
    private RootResolver rootResolver;
    private final ImmutableMap.Builder<String, EntityResolver> entityResolvers =
        ImmutableMap.builder();

    private Builder(String serviceName) {
      this.serviceName = serviceName;
    }

    public Builder root(RootResolver resolver) {
      this.rootResolver = resolver;
      return this;
    }

    public Builder entity(String typename, EntityResolver resolver) {
      entityResolvers.put(typename, resolver);
      return this;
    }

    public LocalServiceEndpoint build() {
      return new LocalServiceEndpoint(serviceName, rootResolver, entityResolvers.build());
    }
  }
}
