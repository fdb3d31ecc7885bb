/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PlanNodeTest {

  @Test
  void should_default_fetch_collections_to_empty() {
    FetchNode fetch = FetchNode.builder().serviceName("products").operation("{me{id}}").build();

    assertTrue(fetch.getRequires().isEmpty());
    assertTrue(fetch.getVariableUsages().isEmpty());
    assertTrue(fetch.getOwnedFields().isEmpty());
    assertTrue(fetch.getEntityTypes().isEmpty());
    assertFalse(fetch.getOperationName().isPresent());
  }

  @Test
  void should_require_service_name_and_operation() {
    assertThrows(
        IllegalArgumentException.class,
        () -> FetchNode.builder().operation("{me{id}}").build());
    assertThrows(
        IllegalArgumentException.class,
        () -> FetchNode.builder().serviceName("accounts").operation("").build());
  }

  @Test
  void should_reject_required_paths_that_are_not_field_paths() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            FetchNode.builder()
                .serviceName("reviews")
                .operation("{_entities{id}}")
                .requires(List.of(ResponsePath.parse("reviews.@.id")))
                .build());
  }

  @Test
  void should_copy_fetch_collections() {
    FetchNode fetch =
        FetchNode.builder()
            .serviceName("reviews")
            .operation("{_entities{id}}")
            .operationName("Reviews")
            .requires(List.of(ResponsePath.parse("upc")))
            .variableUsages(Map.of("first", "limit"))
            .entityTypes(Set.of("Product"))
            .build();

    assertEquals("Reviews", fetch.getOperationName().get());
    assertThrows(
        UnsupportedOperationException.class,
        () -> fetch.getRequires().add(ResponsePath.parse("name")));
    assertEquals(Map.of("first", "limit"), fetch.getVariableUsages());
  }

  @Test
  void should_reject_flatten_at_root() {
    FetchNode fetch = FetchNode.builder().serviceName("a").operation("{a}").build();

    assertThrows(
        IllegalArgumentException.class, () -> new FlattenNode(ResponsePath.root(), fetch));
  }

  @Test
  void should_expose_children_in_plan_order() {
    FetchNode first = FetchNode.builder().serviceName("a").operation("{a}").build();
    FetchNode second = FetchNode.builder().serviceName("b").operation("{b}").build();
    FlattenNode flatten = new FlattenNode(ResponsePath.parse("a.@"), second);

    assertEquals(List.of(first, flatten), SequenceNode.of(first, flatten).getChildren());
    assertEquals(List.of(second), flatten.getChildren());
    assertTrue(first.getChildren().isEmpty());
  }

  @Test
  void should_report_missing_root_node_of_empty_plan() {
    assertFalse(QueryPlan.empty().getNode().isPresent());
  }
}
