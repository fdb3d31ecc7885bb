/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.federation.common.setting.PropertiesSettings;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.serde.QueryPlanReader;
import org.opensearch.federation.service.DefaultServiceRegistry;
import org.opensearch.federation.service.local.LocalServiceEndpoint;

/** Runs a products, reviews, inventory and accounts plan against in-process services. */
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class FederatedPlanExecutionTest {

  private QueryPlan plan;

  private QueryPlanExecutor executor;

  @BeforeEach
  void setUp() throws IOException {
    try (InputStream json = getClass().getResourceAsStream("/plans/top-products.json")) {
      plan = new QueryPlanReader().read(json);
    }
  }

  @AfterEach
  void tearDown() {
    if (executor != null) {
      executor.close();
    }
  }

  @Test
  void should_assemble_response_from_all_services() {
    // Given
    executor = new QueryPlanExecutor(ServiceFixtures.registry(), PropertiesSettings.defaults());

    // When
    ExecutionResult result = executor.run(plan, ImmutableMap.of("first", 2));

    // Then
    assertTrue(result.getErrors().isEmpty());
    Map<String, Object> expected =
        ImmutableMap.of(
            "topProducts",
            List.of(
                ImmutableMap.of(
                    "__typename", "Product",
                    "upc", "1",
                    "name", "Table",
                    "reviews",
                        List.of(
                            review("Love it!", "1", "Ada Lovelace"),
                            review("Too expensive.", "2", "Alan Turing")),
                    "inStock", true),
                ImmutableMap.of(
                    "__typename", "Product",
                    "upc", "2",
                    "name", "Couch",
                    "reviews", List.of(review("Could be better.", "1", "Ada Lovelace")),
                    "inStock", false)));
    assertEquals(expected, result.getData());
  }

  @Test
  void should_produce_graphql_response_json() throws IOException {
    executor = new QueryPlanExecutor(ServiceFixtures.registry(), PropertiesSettings.defaults());

    ExecutionResult result = executor.run(plan, ImmutableMap.of("first", 1));

    // field order of the parallel step depends on which branch merges first
    ObjectMapper mapper = new ObjectMapper();
    assertEquals(
        mapper.readTree(
            "{\"data\":{\"topProducts\":[{\"__typename\":\"Product\",\"upc\":\"1\","
                + "\"name\":\"Table\",\"inStock\":true,\"reviews\":["
                + "{\"body\":\"Love it!\",\"author\":"
                + "{\"__typename\":\"User\",\"id\":\"1\",\"name\":\"Ada Lovelace\"}},"
                + "{\"body\":\"Too expensive.\",\"author\":"
                + "{\"__typename\":\"User\",\"id\":\"2\",\"name\":\"Alan Turing\"}}]}]}}"),
        mapper.readTree(result.toJson()));
  }

  @Test
  void should_null_unresolvable_author_and_report_error_at_its_path() {
    // Given: the couch review is written by an unknown user
    DefaultServiceRegistry registry =
        DefaultServiceRegistry.builder()
            .register("products", ServiceFixtures.products())
            .register(
                "reviews",
                LocalServiceEndpoint.builder("reviews")
                    .entity(
                        "Product",
                        (representation, context) ->
                            ImmutableMap.of(
                                "reviews",
                                List.of(
                                    ImmutableMap.of(
                                        "body",
                                        "Nice.",
                                        "author",
                                        ImmutableMap.of(
                                            "__typename",
                                            "User",
                                            "id",
                                            "2".equals(representation.get("upc")) ? "99" : "1")))))
                    .build())
            .register("inventory", ServiceFixtures.inventory())
            .register("accounts", ServiceFixtures.accounts())
            .build();
    executor = new QueryPlanExecutor(registry, PropertiesSettings.defaults());

    // When
    ExecutionResult result = executor.run(plan, ImmutableMap.of("first", 2));

    // Then
    assertEquals("Ada Lovelace", author(result, 0).get("name"));
    assertNull(review(result, 1).get("author"));
    assertEquals(1, result.getErrors().size());
    ExecutionError error = result.getErrors().get(0);
    assertEquals(List.of("topProducts", 1, "reviews", 0, "author"), error.getPath().toList());
    assertEquals("No user 99", error.getMessage());
    assertEquals("accounts", error.getExtensions().get(ExecutionError.SERVICE_NAME));
  }

  @Test
  void should_keep_products_when_entity_services_are_missing() {
    // Given
    executor =
        new QueryPlanExecutor(
            DefaultServiceRegistry.builder()
                .register("products", ServiceFixtures.products())
                .build(),
            PropertiesSettings.defaults());

    // When
    ExecutionResult result = executor.run(plan, ImmutableMap.of("first", 1));

    // Then: the failed reviews fetch nulls the product before inventory looks for it
    assertEquals(ImmutableMap.of("topProducts", Arrays.asList((Object) null)), result.getData());
    assertEquals(1, result.getErrors().size());
    ExecutionError error = result.getErrors().get(0);
    assertEquals(ErrorCode.CONFIGURATION_ERROR.name(), error.getCode());
    assertEquals(List.of("topProducts"), error.getPath().toList());
    assertEquals("Couldn't find service with name \"reviews\"", error.getMessage());
  }

  private static Map<String, Object> review(String body, String authorId, String authorName) {
    return ImmutableMap.of(
        "body",
        body,
        "author",
        ImmutableMap.of("__typename", "User", "id", authorId, "name", authorName));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> review(ExecutionResult result, int product) {
    Map<String, Object> topProduct =
        (Map<String, Object>) ((List<Object>) result.getData().get("topProducts")).get(product);
    return (Map<String, Object>) ((List<Object>) topProduct.get("reviews")).get(0);
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> author(ExecutionResult result, int product) {
    return (Map<String, Object>) review(result, product).get("author");
  }
}
