/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import java.util.List;

/**
 * A node of a federated query plan. Plans are immutable trees produced by the query planner and
 * read by the executor.
 */
public abstract class PlanNode {

  /**
   * Accept the {@link PlanNodeVisitor}.
   *
   * @param visitor visitor
   * @param context visitor context
   * @param <R> returned object type
   * @param <C> context type
   * @return returned object
   */
  public abstract <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context);

  /** Direct children of this node, in plan order. */
  public abstract List<PlanNode> getChildren();
}
