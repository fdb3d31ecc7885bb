/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Children run concurrently and write disjoint parts of the response. */
@ToString
@EqualsAndHashCode(callSuper = false)
public class ParallelNode extends PlanNode {

  private final List<PlanNode> children;

  public ParallelNode(List<PlanNode> children) {
    this.children = ImmutableList.copyOf(children);
  }

  public static ParallelNode of(PlanNode... children) {
    return new ParallelNode(List.of(children));
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitParallel(this, context);
  }

  @Override
  public List<PlanNode> getChildren() {
    return children;
  }
}
