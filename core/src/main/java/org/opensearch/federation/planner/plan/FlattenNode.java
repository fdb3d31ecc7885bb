/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Rebases the inner node onto {@link #getPath()}: the inner fetch reads its required fields from,
 * and merges its result into, the entities found at that path.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class FlattenNode extends PlanNode {

  private final ResponsePath path;

  private final PlanNode node;

  public FlattenNode(ResponsePath path, PlanNode node) {
    Preconditions.checkNotNull(path, "path");
    Preconditions.checkNotNull(node, "node");
    Preconditions.checkArgument(!path.isRoot(), "Flatten path must not be empty");
    this.path = path;
    this.node = node;
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFlatten(this, context);
  }

  @Override
  public List<PlanNode> getChildren() {
    return List.of(node);
  }
}
