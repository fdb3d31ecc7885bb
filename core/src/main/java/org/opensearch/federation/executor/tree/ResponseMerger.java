/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;

/**
 * Deep union of response values.
 *
 * <p>Objects merge field by field and lists element by element, extra source elements being
 * appended. Any other pair resolves to the source value: the last write wins, including when the
 * source is {@code null} or of a different shape than the target.
 */
@UtilityClass
public class ResponseMerger {

  /**
   * Merges {@code source} into {@code target}. Target objects and lists are updated in place and
   * must be mutable; source values are copied, never shared.
   *
   * @return the merged value, which is {@code target} itself when both are objects or lists
   */
  @SuppressWarnings("unchecked")
  public static Object merge(Object target, Object source) {
    if (target instanceof Map && source instanceof Map) {
      Map<String, Object> targetMap = (Map<String, Object>) target;
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) source).entrySet()) {
        String key = String.valueOf(entry.getKey());
        Object merged =
            targetMap.containsKey(key)
                ? merge(targetMap.get(key), entry.getValue())
                : deepCopy(entry.getValue());
        targetMap.put(key, merged);
      }
      return targetMap;
    }
    if (target instanceof List && source instanceof List) {
      List<Object> targetList = (List<Object>) target;
      List<?> sourceList = (List<?>) source;
      for (int i = 0; i < sourceList.size(); i++) {
        if (i < targetList.size()) {
          targetList.set(i, merge(targetList.get(i), sourceList.get(i)));
        } else {
          targetList.add(deepCopy(sourceList.get(i)));
        }
      }
      return targetList;
    }
    return deepCopy(source);
  }

  /** Copies objects and lists into mutable, insertion-ordered containers. Scalars are shared. */
  public static Object deepCopy(Object value) {
    if (value instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue()));
      }
      return copy;
    }
    if (value instanceof List) {
      List<Object> copy = new ArrayList<>(((List<?>) value).size());
      for (Object element : (List<?>) value) {
        copy.add(deepCopy(element));
      }
      return copy;
    }
    return value;
  }
}
