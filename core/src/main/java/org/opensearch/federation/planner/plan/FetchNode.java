/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One request to one service.
 *
 * <p>At the root of the response the fetch sends {@link #getOperation()} with the variables named
 * by {@link #getVariableUsages()} and merges the result into the response root. Under a {@link
 * FlattenNode} it is an entity fetch: one representation is built per entity from {@link
 * #getRequires()} and all representations are sent in a single {@code _entities} request.
 */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class FetchNode extends PlanNode {

  private final String serviceName;

  private final String operation;

  private final String operationName;

  /** Field paths copied from each entity into its representation. */
  private final List<ResponsePath> requires;

  /** Sub-request variable name to the name of the request variable that supplies it. */
  private final Map<String, String> variableUsages;

  /** Top-level response fields populated by a root fetch. */
  private final List<String> ownedFields;

  /** When not empty, only entities with one of these {@code __typename}s are fetched. */
  private final Set<String> entityTypes;

  @Builder
  private FetchNode(
      String serviceName,
      String operation,
      String operationName,
      List<ResponsePath> requires,
      Map<String, String> variableUsages,
      List<String> ownedFields,
      Set<String> entityTypes) {
    Preconditions.checkArgument(
        !Strings.isNullOrEmpty(serviceName), "Fetch requires a service name");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(operation), "Fetch requires an operation");
    this.serviceName = serviceName;
    this.operation = operation;
    this.operationName = operationName;
    this.requires = requires == null ? ImmutableList.of() : ImmutableList.copyOf(requires);
    this.variableUsages =
        variableUsages == null ? ImmutableMap.of() : ImmutableMap.copyOf(variableUsages);
    this.ownedFields = ownedFields == null ? ImmutableList.of() : ImmutableList.copyOf(ownedFields);
    this.entityTypes = entityTypes == null ? ImmutableSet.of() : ImmutableSet.copyOf(entityTypes);
    for (ResponsePath required : this.requires) {
      Preconditions.checkArgument(
          !required.isRoot() && required.isFieldPath(),
          "Required field [%s] must be a non-empty path of field names",
          required);
    }
  }

  public Optional<String> getOperationName() {
    return Optional.ofNullable(operationName);
  }

  @Override
  public <R, C> R accept(PlanNodeVisitor<R, C> visitor, C context) {
    return visitor.visitFetch(this, context);
  }

  @Override
  public List<PlanNode> getChildren() {
    return List.of();
  }
}
