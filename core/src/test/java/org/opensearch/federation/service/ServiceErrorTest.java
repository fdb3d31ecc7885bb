/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ServiceErrorTest {

  @Test
  void should_not_change_when_reported_path_list_is_reused() {
    // Given
    List<Object> path = new ArrayList<>(List.of("_entities", 0));
    ServiceError error = new ServiceError("not found", path);

    // When
    path.set(1, 7);
    path.add("name");

    // Then
    assertEquals(List.of("_entities", 0), error.getPath());
  }

  @Test
  void should_keep_null_path_elements() {
    ServiceError error = new ServiceError("bad path", Arrays.<Object>asList("_entities", null));

    assertEquals(Arrays.asList("_entities", null), error.getPath());
    assertTrue(error.getExtensions().isEmpty());
  }

  @Test
  void should_default_missing_path_to_empty() {
    assertTrue(new ServiceError("no path", null).getPath().isEmpty());
  }
}
