/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor.tree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResponseMergerTest {

  @Test
  void should_union_object_fields_recursively() {
    Map<String, Object> target = mutable(ImmutableMap.of("me", ImmutableMap.of("id", "1")));

    Object merged =
        ResponseMerger.merge(target, ImmutableMap.of("me", ImmutableMap.of("name", "Ada")));

    assertSame(target, merged);
    assertEquals(ImmutableMap.of("me", ImmutableMap.of("id", "1", "name", "Ada")), target);
  }

  @Test
  void should_merge_lists_by_index_and_append_extra_elements() {
    Map<String, Object> target =
        mutable(ImmutableMap.of("items", List.of(ImmutableMap.of("id", 1))));

    ResponseMerger.merge(
        target,
        ImmutableMap.of(
            "items", List.of(ImmutableMap.of("price", 10), ImmutableMap.of("id", 2))));

    assertEquals(
        List.of(ImmutableMap.of("id", 1, "price", 10), ImmutableMap.of("id", 2)),
        target.get("items"));
  }

  @Test
  void should_let_source_win_on_scalar_collision() {
    Map<String, Object> target = mutable(ImmutableMap.of("name", "Ada", "age", 36));

    ResponseMerger.merge(target, ImmutableMap.of("name", "Alan"));

    assertEquals(ImmutableMap.of("name", "Alan", "age", 36), target);
  }

  @Test
  void should_let_source_win_on_shape_mismatch_and_null() {
    Map<String, Object> target =
        mutable(ImmutableMap.of("a", ImmutableMap.of("x", 1), "b", List.of(1, 2)));
    Map<String, Object> source = new LinkedHashMap<>();
    source.put("a", "scalar");
    source.put("b", null);

    ResponseMerger.merge(target, source);

    assertEquals("scalar", target.get("a"));
    assertNull(target.get("b"));
  }

  @Test
  void should_copy_source_values_instead_of_sharing_them() {
    List<Object> reviews = new ArrayList<>(List.of(ImmutableMap.of("id", "r1")));
    Map<String, Object> target = new LinkedHashMap<>();

    ResponseMerger.merge(target, ImmutableMap.of("reviews", reviews));
    reviews.add(ImmutableMap.of("id", "r2"));

    assertNotSame(reviews, target.get("reviews"));
    assertEquals(1, ((List<?>) target.get("reviews")).size());
  }

  @Test
  void should_deep_copy_into_mutable_containers() {
    @SuppressWarnings("unchecked")
    Map<String, Object> copy =
        (Map<String, Object>)
            ResponseMerger.deepCopy(ImmutableMap.of("list", Arrays.asList(1, null)));

    copy.put("extra", true);
    ((List<Object>) copy.get("list")).add(3);

    assertEquals(Arrays.asList(1, null, 3), copy.get("list"));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mutable(Map<String, Object> value) {
    return (Map<String, Object>) ResponseMerger.deepCopy(value);
  }
}
