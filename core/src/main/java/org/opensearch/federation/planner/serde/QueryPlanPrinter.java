/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.serde;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import org.opensearch.federation.planner.plan.FetchNode;
import org.opensearch.federation.planner.plan.FlattenNode;
import org.opensearch.federation.planner.plan.ParallelNode;
import org.opensearch.federation.planner.plan.PlanNode;
import org.opensearch.federation.planner.plan.PlanNodeVisitor;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.plan.ResponsePath;
import org.opensearch.federation.planner.plan.SequenceNode;

/**
 * Renders a plan as an indented tree, for logs and plan assertions in tests.
 *
 * <pre>
 * QueryPlan {
 *   Sequence {
 *     Fetch(service: "products") {
 *       {topProducts{upc}}
 *     },
 *     Flatten(path: "topProducts.@") {
 *       Fetch(service: "reviews") {
 *         {
 *           __typename
 *           upc
 *         } =>
 *         query($representations:[_Any!]!){...}
 *       },
 *     },
 *   },
 * }
 * </pre>
 */
public class QueryPlanPrinter implements PlanNodeVisitor<Void, Integer> {

  private static final int INDENT = 2;

  private final StringBuilder out = new StringBuilder();

  private QueryPlanPrinter() {}

  public static String print(QueryPlan plan) {
    QueryPlanPrinter printer = new QueryPlanPrinter();
    printer.line(0, "QueryPlan {");
    plan.getNode().ifPresent(node -> printer.child(node, 1));
    printer.out.append('}');
    return printer.out.toString();
  }

  @Override
  public Void visitSequence(SequenceNode node, Integer depth) {
    return group("Sequence", node, depth);
  }

  @Override
  public Void visitParallel(ParallelNode node, Integer depth) {
    return group("Parallel", node, depth);
  }

  @Override
  public Void visitFlatten(FlattenNode node, Integer depth) {
    line(depth, "Flatten(path: \"" + node.getPath() + "\") {");
    child(node.getNode(), depth + 1);
    line(depth, "}");
    return null;
  }

  @Override
  public Void visitFetch(FetchNode node, Integer depth) {
    line(depth, "Fetch(service: \"" + node.getServiceName() + "\") {");
    if (!node.getRequires().isEmpty()) {
      line(depth + 1, "{");
      for (ResponsePath required : node.getRequires()) {
        line(depth + 2, required.toString());
      }
      line(depth + 1, "} =>");
    }
    for (String operationLine : Splitter.on('\n').trimResults().omitEmptyStrings()
        .split(node.getOperation())) {
      line(depth + 1, operationLine);
    }
    line(depth, "}");
    return null;
  }

  private Void group(String name, PlanNode node, int depth) {
    line(depth, name + " {");
    for (PlanNode child : node.getChildren()) {
      child(child, depth + 1);
    }
    line(depth, "}");
    return null;
  }

  /** Prints a nested node and terminates its closing line with a comma. */
  private void child(PlanNode node, int depth) {
    node.accept(this, depth);
    out.setLength(out.length() - 1);
    out.append(",\n");
  }

  private void line(int depth, String text) {
    out.append(Strings.repeat(" ", depth * INDENT)).append(text).append('\n');
  }
}
