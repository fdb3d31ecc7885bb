/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** The plan for one request. A plan without a root node produces an empty response. */
@ToString
@EqualsAndHashCode
public class QueryPlan {

  private final PlanNode node;

  public QueryPlan(PlanNode node) {
    this.node = node;
  }

  public static QueryPlan empty() {
    return new QueryPlan(null);
  }

  public Optional<PlanNode> getNode() {
    return Optional.ofNullable(node);
  }
}
