/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.Logger;
import org.opensearch.federation.common.response.ResponseListener;
import org.opensearch.federation.common.setting.Settings;
import org.opensearch.federation.executor.tree.ResponseTree;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.serde.QueryPlanPrinter;
import org.opensearch.federation.service.RequestContext;
import org.opensearch.federation.service.ServiceRegistry;

/**
 * Entry point for executing federated query plans.
 *
 * <p><strong>Execution Flow:</strong>
 *
 * <pre>
 * 1. Create an empty response tree and the execution context for the request
 * 2. Execute the root plan node; fetches run on the worker pool
 * 3. Wait for the root node, or for cancellation, timeout or interruption
 * 4. Return the response built so far together with every recorded error
 * </pre>
 *
 * <p>Execution never fails because a service failed: the result always carries whatever data could
 * be fetched. The executor owns its worker pool and must be closed.
 */
@Log4j2
public class QueryPlanExecutor implements AutoCloseable {

  private final ServiceRegistry serviceRegistry;

  private final Settings settings;

  private final ExecutorService workers;

  private final ScheduledExecutorService timer;

  public QueryPlanExecutor(ServiceRegistry serviceRegistry, Settings settings) {
    this(
        serviceRegistry,
        settings,
        Executors.newFixedThreadPool(
            settings.<Integer>getSettingValue(Settings.Key.EXECUTOR_POOL_SIZE),
            new ThreadFactoryBuilder()
                .setNameFormat("federation-executor-%d")
                .setDaemon(true)
                .build()));
  }

  @VisibleForTesting
  QueryPlanExecutor(ServiceRegistry serviceRegistry, Settings settings, ExecutorService workers) {
    Preconditions.checkNotNull(serviceRegistry, "serviceRegistry");
    Preconditions.checkNotNull(settings, "settings");
    this.serviceRegistry = serviceRegistry;
    this.settings = settings;
    this.workers = workers;
    ScheduledThreadPoolExecutor scheduler =
        new ScheduledThreadPoolExecutor(
            1,
            new ThreadFactoryBuilder()
                .setNameFormat("federation-executor-timer-%d")
                .setDaemon(true)
                .build());
    scheduler.setRemoveOnCancelPolicy(true);
    this.timer = scheduler;
  }

  public ExecutionResult run(QueryPlan plan, Map<String, Object> variables) {
    return run(plan, variables, RequestContext.empty(), new CancellationSignal());
  }

  public ExecutionResult run(
      QueryPlan plan,
      Map<String, Object> variables,
      RequestContext requestContext,
      CancellationSignal cancellationSignal) {
    return run(plan, variables, requestContext, cancellationSignal, null);
  }

  /**
   * Executes a plan and waits for it to finish. Interrupting the calling thread cancels the
   * execution; the partial result is still returned and the interrupt flag is restored.
   *
   * @param plan plan to execute
   * @param variables request variables
   * @param requestContext forwarded to every service call
   * @param cancellationSignal cancels the execution when triggered
   * @param diagnostics logger for execution diagnostics, the executor's own when null
   * @return response data and errors
   */
  public ExecutionResult run(
      QueryPlan plan,
      Map<String, Object> variables,
      RequestContext requestContext,
      CancellationSignal cancellationSignal,
      Logger diagnostics) {
    Preconditions.checkNotNull(plan, "plan");
    Execution execution =
        start(plan, variables, requestContext, cancellationSignal, diagnostics);
    try {
      execution.completion.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      execution.context.getCancellationSignal().cancel("caller thread interrupted");
      execution.completion.join();
    } catch (ExecutionException e) {
      throw new IllegalStateException("Plan execution failed unexpectedly", e.getCause());
    }
    return finish(execution);
  }

  /**
   * Executes a plan asynchronously.
   *
   * @param listener receives the result; {@link ResponseListener#onFailure} is only called for an
   *     invalid plan
   * @return signal that cancels the execution
   */
  public CancellationSignal execute(
      QueryPlan plan,
      Map<String, Object> variables,
      RequestContext requestContext,
      ResponseListener<ExecutionResult> listener) {
    CancellationSignal signal = new CancellationSignal();
    if (plan == null) {
      listener.onFailure(new IllegalArgumentException("plan must not be null"));
      return signal;
    }
    Execution execution = start(plan, variables, requestContext, signal, null);
    execution.completion.whenComplete(
        (ignored, error) -> {
          if (error != null) {
            log.error("Plan execution failed unexpectedly", error);
            listener.onFailure(new IllegalStateException("Plan execution failed", error));
          } else {
            listener.onResponse(finish(execution));
          }
        });
    return signal;
  }

  /** Stops the worker pool, interrupting running service calls. */
  @Override
  public void close() {
    workers.shutdownNow();
    timer.shutdownNow();
  }

  private Execution start(
      QueryPlan plan,
      Map<String, Object> variables,
      RequestContext requestContext,
      CancellationSignal cancellationSignal,
      Logger diagnostics) {
    long startNanos = System.nanoTime();
    ExecutionContext context =
        new ExecutionContext(
            variables, requestContext, serviceRegistry, cancellationSignal, diagnostics);
    ResponseTree tree = new ResponseTree();
    context.info("Executing query plan");
    if (log.isDebugEnabled()) {
      log.debug("Query plan:\n{}", QueryPlanPrinter.print(plan));
    }

    CompletableFuture<Void> completion =
        plan.getNode()
            .map(root -> new NodeExecutor(tree, context, workers).execute(root))
            .orElseGet(() -> CompletableFuture.completedFuture(null));

    long timeoutMillis = settings.<Long>getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS);
    if (timeoutMillis > 0 && !completion.isDone()) {
      ScheduledFuture<?> timeout =
          timer.schedule(
              () ->
                  context
                      .getCancellationSignal()
                      .cancel("query timed out after " + timeoutMillis + " ms"),
              timeoutMillis,
              TimeUnit.MILLISECONDS);
      completion.whenComplete((ignored, error) -> timeout.cancel(false));
    }
    return new Execution(plan, tree, context, completion, startNanos);
  }

  private ExecutionResult finish(Execution execution) {
    ExecutionContext context = execution.context;
    ExecutionResult result =
        new ExecutionResult(
            execution.tree.snapshot(),
            context.getErrors(),
            settings.<Boolean>getSettingValue(Settings.Key.INCLUDE_QUERY_PLAN)
                ? execution.plan
                : null);
    context.info(
        "Executed query plan in {} ms with {} errors{}",
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - execution.startNanos),
        result.getErrors().size(),
        context.isCancelled() ? " (cancelled)" : "");
    return result;
  }

  private static final class Execution {
    private final QueryPlan plan;
    private final ResponseTree tree;
    private final ExecutionContext context;
    private final CompletableFuture<Void> completion;
    private final long startNanos;

    private Execution(
        QueryPlan plan,
        ResponseTree tree,
        ExecutionContext context,
        CompletableFuture<Void> completion,
        long startNanos) {
      this.plan = plan;
      this.tree = tree;
      this.context = context;
      this.completion = completion;
      this.startNanos = startNanos;
    }
  }
}
