/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.opensearch.federation.executor.tree.Entity;
import org.opensearch.federation.executor.tree.RepresentationBuilder;
import org.opensearch.federation.executor.tree.ResponseTree;
import org.opensearch.federation.planner.plan.FetchNode;
import org.opensearch.federation.planner.plan.FlattenNode;
import org.opensearch.federation.planner.plan.ParallelNode;
import org.opensearch.federation.planner.plan.PlanNode;
import org.opensearch.federation.planner.plan.PlanNodeVisitor;
import org.opensearch.federation.planner.plan.ResponsePath;
import org.opensearch.federation.planner.plan.SequenceNode;
import org.opensearch.federation.service.ServiceEndpoint;
import org.opensearch.federation.service.ServiceError;
import org.opensearch.federation.service.ServiceRequest;
import org.opensearch.federation.service.ServiceResult;

/**
 * Executes plan nodes against a {@link ResponseTree}. The visitor context is the response path the
 * node is rebased onto: the root for top-level fetches, the accumulated flatten path for entity
 * fetches.
 *
 * <p>The returned futures never complete exceptionally. Every failure ends up as an {@link
 * ExecutionError} in the {@link ExecutionContext}, possibly with {@code null} written over the
 * failing part of the response.
 */
public class NodeExecutor implements PlanNodeVisitor<CompletableFuture<Void>, ResponsePath> {

  /** Response field holding the results of an entities request. */
  public static final String ENTITIES = "_entities";

  private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

  private final ResponseTree tree;

  private final ExecutionContext context;

  private final ExecutorService workers;

  /**
   * @param tree response to merge results into
   * @param context execution state
   * @param workers pool that runs service calls
   */
  public NodeExecutor(ResponseTree tree, ExecutionContext context, ExecutorService workers) {
    this.tree = tree;
    this.context = context;
    this.workers = workers;
  }

  /** Executes {@code node} at the response root. */
  public CompletableFuture<Void> execute(PlanNode node) {
    return execute(node, ResponsePath.root());
  }

  private CompletableFuture<Void> execute(PlanNode node, ResponsePath path) {
    CompletableFuture<Void> future;
    try {
      future = node.accept(this, path);
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return future.exceptionally(
        e -> {
          Throwable cause = e instanceof CompletionException && e.getCause() != null
              ? e.getCause() : e;
          context.warn("Failed to execute plan node at [{}]", path, cause);
          context.addError(
              new ExecutionError(
                  path.concretePrefix(),
                  "Internal error while executing plan: " + cause.getMessage(),
                  ImmutableMap.of(ExecutionError.CODE, ErrorCode.INTERNAL_ERROR.name())));
          return null;
        });
  }

  @Override
  public CompletableFuture<Void> visitSequence(SequenceNode node, ResponsePath path) {
    CompletableFuture<Void> chain = DONE;
    for (PlanNode child : node.getChildren()) {
      chain = chain.thenCompose(ignored -> execute(child, path));
    }
    return chain;
  }

  @Override
  public CompletableFuture<Void> visitParallel(ParallelNode node, ResponsePath path) {
    return CompletableFuture.allOf(
        node.getChildren().stream()
            .map(child -> execute(child, path))
            .toArray(CompletableFuture[]::new));
  }

  @Override
  public CompletableFuture<Void> visitFlatten(FlattenNode node, ResponsePath path) {
    return execute(node.getNode(), path.concat(node.getPath()));
  }

  @Override
  public CompletableFuture<Void> visitFetch(FetchNode node, ResponsePath path) {
    ResponsePath errorPath = path.isRoot() ? rootErrorPath(node) : path.concretePrefix();
    if (context.isCancelled()) {
      recordCancelled(node, errorPath);
      return DONE;
    }
    Optional<ServiceEndpoint> endpoint =
        context.getServiceRegistry().lookup(node.getServiceName());
    return path.isRoot()
        ? fetchRoot(node, endpoint, errorPath)
        : fetchEntities(node, path, endpoint, errorPath);
  }

  private CompletableFuture<Void> fetchRoot(
      FetchNode node, Optional<ServiceEndpoint> endpoint, ResponsePath errorPath) {
    if (endpoint.isEmpty()) {
      failRoot(node, errorPath, unknownService(node), ErrorCode.CONFIGURATION_ERROR);
      return DONE;
    }
    ServiceRequest request =
        new ServiceRequest(
            node.getOperation(), node.getOperationName().orElse(null), resolveVariables(node));
    return call(node, endpoint.get(), request)
        .thenAccept(
            outcome -> {
              if (outcome.isEmpty()) {
                recordCancelled(node, errorPath);
                return;
              }
              ServiceResult result = outcome.get();
              if (result.isFatal()) {
                failRoot(node, errorPath, result.getFatal().get(), ErrorCode.SERVICE_ERROR);
                return;
              }
              result.getData().ifPresent(data -> tree.merge(ResponsePath.root(), data));
              for (ServiceError error : result.getErrors()) {
                context.addError(
                    downstreamError(node, toPath(error.getPath()).orElse(errorPath), error));
              }
            });
  }

  private CompletableFuture<Void> fetchEntities(
      FetchNode node,
      ResponsePath path,
      Optional<ServiceEndpoint> endpoint,
      ResponsePath errorPath) {
    RepresentationBuilder builder =
        new RepresentationBuilder(node.getRequires(), node.getEntityTypes());
    List<Entity> entities = new ArrayList<>();
    List<Object> representations = new ArrayList<>();
    for (Entity entity : tree.collect(path)) {
      builder
          .build(entity)
          .ifPresent(
              representation -> {
                entities.add(entity);
                representations.add(representation);
              });
    }
    if (representations.isEmpty()) {
      context.debug(
          "No entities at [{}] for service [{}], skipping fetch", path, node.getServiceName());
      return DONE;
    }
    if (endpoint.isEmpty()) {
      failEntities(node, entities, errorPath, unknownService(node), ErrorCode.CONFIGURATION_ERROR);
      return DONE;
    }

    Map<String, Object> variables = resolveVariables(node);
    variables.put(ServiceRequest.REPRESENTATIONS, representations);
    ServiceRequest request =
        new ServiceRequest(node.getOperation(), node.getOperationName().orElse(null), variables);
    context.debug(
        "Fetching {} entities at [{}] from service [{}]",
        representations.size(),
        path,
        node.getServiceName());

    return call(node, endpoint.get(), request)
        .thenAccept(
            outcome -> {
              if (outcome.isEmpty()) {
                recordCancelled(node, errorPath);
                return;
              }
              ServiceResult result = outcome.get();
              if (result.isFatal()) {
                failEntities(
                    node, entities, errorPath, result.getFatal().get(), ErrorCode.SERVICE_ERROR);
                return;
              }
              mergeEntities(node, entities, errorPath, result.getData());
              for (ServiceError error : result.getErrors()) {
                context.addError(
                    downstreamError(node, entityErrorPath(error, entities, errorPath), error));
              }
            });
  }

  /**
   * Merges the i-th {@code _entities} result into the i-th entity. A response without a same-length
   * {@code _entities} list fails the whole batch.
   */
  @SuppressWarnings("unchecked")
  private void mergeEntities(
      FetchNode node,
      List<Entity> entities,
      ResponsePath errorPath,
      Optional<Map<String, Object>> data) {
    Object received = data.map(d -> d.get(ENTITIES)).orElse(null);
    if (!(received instanceof List) || ((List<?>) received).size() != entities.size()) {
      failEntities(
          node,
          entities,
          errorPath,
          String.format(
              "Expected %d entities from service [%s], received %s",
              entities.size(),
              node.getServiceName(),
              received instanceof List
                  ? String.valueOf(((List<?>) received).size())
                  : data.isPresent() ? "none" : "no data"),
          ErrorCode.ENTITY_BATCH_MISMATCH);
      return;
    }
    List<?> results = (List<?>) received;
    for (int i = 0; i < results.size(); i++) {
      Object value = results.get(i);
      ResponsePath at = entities.get(i).getPath();
      if (value instanceof Map) {
        tree.merge(at, (Map<String, Object>) value);
        continue;
      }
      tree.setNull(at);
      if (value != null) {
        context.addError(
            ExecutionError.of(
                at,
                String.format(
                    "Service [%s] returned a non-object entity: %s", node.getServiceName(), value),
                ErrorCode.DOWNSTREAM_SERVICE_ERROR,
                node.getServiceName()));
      }
    }
  }

  /**
   * Runs the service call on a worker. The future holds the result, or is empty when the
   * execution was cancelled first, in which case the call is interrupted.
   */
  private CompletableFuture<Optional<ServiceResult>> call(
      FetchNode node, ServiceEndpoint endpoint, ServiceRequest request) {
    CompletableFuture<Optional<ServiceResult>> outcome = new CompletableFuture<>();
    Future<?> task;
    try {
      task = workers.submit(() -> outcome.complete(Optional.of(send(node, endpoint, request))));
    } catch (RejectedExecutionException e) {
      outcome.complete(
          Optional.of(ServiceResult.fatal("Service call rejected by executor: " + e.getMessage())));
      return outcome;
    }
    Runnable deregister =
        context
            .getCancellationSignal()
            .onCancel(
                () -> {
                  task.cancel(true);
                  outcome.complete(Optional.empty());
                });
    outcome.whenComplete((result, error) -> deregister.run());
    return outcome;
  }

  private ServiceResult send(FetchNode node, ServiceEndpoint endpoint, ServiceRequest request) {
    context.debug("Sending request to service [{}]", node.getServiceName());
    try {
      ServiceResult result = endpoint.send(request, context.getRequestContext());
      return result == null
          ? ServiceResult.fatal("Service [" + node.getServiceName() + "] returned no result")
          : result;
    } catch (RuntimeException e) {
      context.warn("Service [{}] threw instead of returning a result", node.getServiceName(), e);
      return ServiceResult.fatal(
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }
  }

  private Map<String, Object> resolveVariables(FetchNode node) {
    Map<String, Object> variables = new LinkedHashMap<>();
    node.getVariableUsages()
        .forEach(
            (name, source) -> {
              if (context.getVariables().containsKey(source)) {
                variables.put(name, context.getVariables().get(source));
              }
            });
    return variables;
  }

  private void failRoot(
      FetchNode node, ResponsePath errorPath, String message, ErrorCode code) {
    for (String field : node.getOwnedFields()) {
      tree.setNull(ResponsePath.root().field(field));
    }
    context.warn("Fetch from service [{}] failed: {}", node.getServiceName(), message);
    context.addError(ExecutionError.of(errorPath, message, code, node.getServiceName()));
  }

  private void failEntities(
      FetchNode node,
      List<Entity> entities,
      ResponsePath errorPath,
      String message,
      ErrorCode code) {
    for (Entity entity : entities) {
      tree.setNull(entity.getPath());
    }
    context.warn(
        "Entity fetch of {} entities from service [{}] failed: {}",
        entities.size(),
        node.getServiceName(),
        message);
    context.addError(ExecutionError.of(errorPath, message, code, node.getServiceName()));
  }

  private void recordCancelled(FetchNode node, ResponsePath errorPath) {
    String reason = context.getCancellationSignal().getReason();
    context.warn("Fetch from service [{}] cancelled: {}", node.getServiceName(), reason);
    context.addError(
        ExecutionError.of(
            errorPath,
            String.format(
                "Execution cancelled before fetch from service [%s] completed: %s",
                node.getServiceName(),
                reason),
            ErrorCode.CANCELLED,
            node.getServiceName()));
  }

  private ExecutionError downstreamError(FetchNode node, ResponsePath path, ServiceError error) {
    Map<String, Object> extensions = new LinkedHashMap<>(error.getExtensions());
    extensions.putIfAbsent(ExecutionError.CODE, ErrorCode.DOWNSTREAM_SERVICE_ERROR.name());
    extensions.put(ExecutionError.SERVICE_NAME, node.getServiceName());
    return new ExecutionError(path, error.getMessage(), extensions);
  }

  /**
   * Errors reported at {@code _entities.i...} belong to the i-th entity. Any other error, and any
   * error whose path cannot be read, is reported at the concrete part of the flatten path.
   */
  private static ResponsePath entityErrorPath(
      ServiceError error, List<Entity> entities, ResponsePath errorPath) {
    List<Object> path = error.getPath();
    if (path.size() >= 2 && ENTITIES.equals(path.get(0)) && path.get(1) instanceof Number) {
      int index = ((Number) path.get(1)).intValue();
      if (index >= 0 && index < entities.size()) {
        return toPath(path.subList(2, path.size()))
            .map(entities.get(index).getPath()::concat)
            .orElse(errorPath);
      }
    }
    return errorPath;
  }

  /** The path a service reported, or empty when it holds elements that are not a path. */
  private static Optional<ResponsePath> toPath(List<Object> elements) {
    try {
      ResponsePath path = ResponsePath.of(elements);
      return path.isConcrete() ? Optional.of(path) : Optional.empty();
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  private static ResponsePath rootErrorPath(FetchNode node) {
    return node.getOwnedFields().size() == 1
        ? ResponsePath.root().field(node.getOwnedFields().get(0))
        : ResponsePath.root();
  }

  private static String unknownService(FetchNode node) {
    return String.format("Couldn't find service with name \"%s\"", node.getServiceName());
  }
}
