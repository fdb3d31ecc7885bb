/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor.tree;

import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.opensearch.federation.planner.plan.ResponsePath;

/** An object found in the response tree, with the concrete path it was found at. */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
public class Entity {

  private final ResponsePath path;

  /** A copy of the object; changing it does not change the tree. */
  private final Map<String, Object> value;

  public Object get(String field) {
    return value.get(field);
  }
}
