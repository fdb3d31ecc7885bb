/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.opensearch.federation.planner.plan.FetchNode;
import org.opensearch.federation.planner.plan.FlattenNode;
import org.opensearch.federation.planner.plan.ParallelNode;
import org.opensearch.federation.planner.plan.PlanNode;
import org.opensearch.federation.planner.plan.QueryPlan;
import org.opensearch.federation.planner.plan.ResponsePath;
import org.opensearch.federation.planner.plan.SequenceNode;

/**
 * Reads query plans from JSON.
 *
 * <pre>
 * {"kind": "QueryPlan", "node": {"kind": "Sequence", "nodes": [
 *   {"kind": "Fetch", "serviceName": "products", "operation": "{topProducts{upc}}",
 *    "ownedFields": ["topProducts"]},
 *   {"kind": "Flatten", "path": ["topProducts", "@"], "node":
 *     {"kind": "Fetch", "serviceName": "reviews", "requires": ["__typename", "upc"],
 *      "variableUsages": {"first": "first"}, "operation": "..."}}]}}
 * </pre>
 *
 * <p>{@code requires} entries are dotted field paths. {@code variableUsages} is either an object
 * mapping sub-request variables to request variables, or an array of names used for both.
 */
public class QueryPlanReader {

  private final ObjectMapper objectMapper;

  public QueryPlanReader() {
    this(new ObjectMapper());
  }

  public QueryPlanReader(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public QueryPlan read(String json) {
    try {
      return readPlan(objectMapper.readTree(json));
    } catch (JsonProcessingException e) {
      throw new QueryPlanParseException("Query plan is not valid JSON", e);
    }
  }

  public QueryPlan read(InputStream json) {
    try {
      return readPlan(objectMapper.readTree(json));
    } catch (IOException e) {
      throw new QueryPlanParseException("Failed to read query plan", e);
    }
  }

  private QueryPlan readPlan(JsonNode json) {
    if (json == null || !json.isObject()) {
      throw new QueryPlanParseException("Query plan must be a JSON object");
    }
    String kind = json.path("kind").asText("QueryPlan");
    if (!"QueryPlan".equals(kind)) {
      throw new QueryPlanParseException("Expected kind QueryPlan, got " + kind);
    }
    JsonNode node = json.get("node");
    return node == null || node.isNull() ? QueryPlan.empty() : new QueryPlan(readNode(node));
  }

  private PlanNode readNode(JsonNode json) {
    String kind = requiredText(json, "kind");
    try {
      switch (kind) {
        case "Sequence":
          return new SequenceNode(readNodes(json));
        case "Parallel":
          return new ParallelNode(readNodes(json));
        case "Flatten":
          return new FlattenNode(readPath(json.get("path")), readNode(required(json, "node")));
        case "Fetch":
          return readFetch(json);
        default:
          throw new QueryPlanParseException("Unknown plan node kind " + kind);
      }
    } catch (IllegalArgumentException e) {
      throw new QueryPlanParseException("Invalid " + kind + " node: " + e.getMessage(), e);
    }
  }

  private List<PlanNode> readNodes(JsonNode json) {
    List<PlanNode> nodes = new ArrayList<>();
    for (JsonNode child : required(json, "nodes")) {
      nodes.add(readNode(child));
    }
    return nodes;
  }

  private FetchNode readFetch(JsonNode json) {
    List<ResponsePath> requires = new ArrayList<>();
    for (String field : texts(json.get("requires"))) {
      requires.add(ResponsePath.parse(field));
    }
    Set<String> entityTypes = new LinkedHashSet<>(texts(json.get("entityTypes")));
    return FetchNode.builder()
        .serviceName(requiredText(json, "serviceName"))
        .operation(requiredText(json, "operation"))
        .operationName(json.hasNonNull("operationName") ? json.get("operationName").asText() : null)
        .requires(requires)
        .variableUsages(readVariableUsages(json.get("variableUsages")))
        .ownedFields(texts(json.get("ownedFields")))
        .entityTypes(entityTypes)
        .build();
  }

  private Map<String, String> readVariableUsages(JsonNode json) {
    Map<String, String> usages = new LinkedHashMap<>();
    if (json == null || json.isNull()) {
      return usages;
    }
    if (json.isArray()) {
      for (String name : texts(json)) {
        usages.put(name, name);
      }
    } else if (json.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        usages.put(field.getKey(), field.getValue().asText());
      }
    } else {
      throw new QueryPlanParseException("variableUsages must be an array or an object");
    }
    return usages;
  }

  private ResponsePath readPath(JsonNode json) {
    if (json == null || json.isNull()) {
      throw new QueryPlanParseException("Flatten requires a path");
    }
    if (json.isTextual()) {
      return ResponsePath.parse(json.asText());
    }
    List<Object> elements = new ArrayList<>();
    for (JsonNode element : json) {
      elements.add(element.isInt() ? (Object) element.asInt() : element.asText());
    }
    return ResponsePath.of(elements);
  }

  private static List<String> texts(JsonNode json) {
    List<String> values = new ArrayList<>();
    if (json == null || json.isNull()) {
      return values;
    }
    if (!json.isArray()) {
      throw new QueryPlanParseException("Expected an array, got " + json.getNodeType());
    }
    for (JsonNode element : json) {
      values.add(element.asText());
    }
    return values;
  }

  private static JsonNode required(JsonNode json, String field) {
    JsonNode value = json.get(field);
    if (value == null || value.isNull()) {
      throw new QueryPlanParseException("Missing required field " + field);
    }
    return value;
  }

  private static String requiredText(JsonNode json, String field) {
    return required(json, field).asText();
  }
}
