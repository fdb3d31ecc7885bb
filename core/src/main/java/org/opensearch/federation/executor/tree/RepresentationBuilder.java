/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor.tree;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.opensearch.federation.planner.plan.ResponsePath;

/**
 * Builds entity representations: the subset of an entity's fields a service needs to identify it.
 *
 * <p>Required paths through lists select from every element. A required field whose value is
 * {@code null} is copied as {@code null}; an absent required field means the entity has no
 * representation.
 */
public class RepresentationBuilder {

  static final String TYPENAME = "__typename";

  private static final Object MISSING = new Object();

  private final Map<String, Object> selection;

  private final Set<String> entityTypes;

  /**
   * @param requires field paths to copy
   * @param entityTypes accepted {@code __typename}s, all types when empty
   */
  public RepresentationBuilder(List<ResponsePath> requires, Set<String> entityTypes) {
    this.selection = new LinkedHashMap<>();
    this.entityTypes = ImmutableSet.copyOf(entityTypes);
    for (ResponsePath path : requires) {
      addToSelection(path);
    }
  }

  /** The representation of {@code entity}, or empty when it cannot be built. */
  @SuppressWarnings("unchecked")
  public Optional<Map<String, Object>> build(Entity entity) {
    if (!entityTypes.isEmpty() && !entityTypes.contains(entity.get(TYPENAME))) {
      return Optional.empty();
    }
    Object representation = select(entity.getValue(), selection);
    return representation == MISSING
        ? Optional.empty()
        : Optional.of((Map<String, Object>) representation);
  }

  @SuppressWarnings("unchecked")
  private void addToSelection(ResponsePath path) {
    Map<String, Object> level = selection;
    for (ResponsePath.Segment segment : path.getSegments()) {
      level =
          (Map<String, Object>)
              level.computeIfAbsent(segment.getName(), name -> new LinkedHashMap<String, Object>());
    }
  }

  @SuppressWarnings("unchecked")
  private static Object select(Object value, Map<String, Object> selection) {
    if (selection.isEmpty() || value == null) {
      return ResponseMerger.deepCopy(value);
    }
    if (value instanceof List) {
      List<Object> selected = new ArrayList<>();
      for (Object element : (List<?>) value) {
        Object item = select(element, selection);
        if (item == MISSING) {
          return MISSING;
        }
        selected.add(item);
      }
      return selected;
    }
    if (!(value instanceof Map)) {
      return MISSING;
    }
    Map<?, ?> object = (Map<?, ?>) value;
    Map<String, Object> selected = new LinkedHashMap<>();
    for (Map.Entry<String, Object> field : selection.entrySet()) {
      if (!object.containsKey(field.getKey())) {
        return MISSING;
      }
      Object item = select(object.get(field.getKey()), (Map<String, Object>) field.getValue());
      if (item == MISSING) {
        return MISSING;
      }
      selected.put(field.getKey(), item);
    }
    return selected;
  }
}
