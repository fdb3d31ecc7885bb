/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

/**
 * The visitor of {@link PlanNode}.
 *
 * @param <R> return type
 * @param <C> context type
 */
public interface PlanNodeVisitor<R, C> {

  R visitSequence(SequenceNode node, C context);

  R visitParallel(ParallelNode node, C context);

  R visitFetch(FetchNode node, C context);

  R visitFlatten(FlattenNode node, C context);
}
