/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Children run one after another. Each child sees everything its predecessors wrote to the
 * response.
 */
@ToString
@EqualsAndHashCode(callSuper = false)
public class SequenceNode extends PlanNode {

  private final List<PlanNode> children;

  public SequenceNode(List<PlanNode> children) {
    this.children = ImmutableList.copyOf(children);
  }

  public static SequenceNode of(PlanNode... children) {
    return new SequenceNode(List.of(children));
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitSequence(this, context);
  }

  @Override
  public List<PlanNode> getChildren() {
    return children;
  }
}
