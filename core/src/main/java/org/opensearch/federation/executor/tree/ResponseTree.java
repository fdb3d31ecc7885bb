/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.executor.tree;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.opensearch.federation.planner.plan.ResponsePath;
import org.opensearch.federation.planner.plan.ResponsePath.Segment;

/**
 * The response of one execution, assembled from the results of many fetches.
 *
 * <p>Concurrent plan branches own disjoint subtrees, but they may add keys to the same parent
 * object, so every access is serialized on the tree. Values handed out are copies.
 */
public class ResponseTree {

  private final Map<String, Object> root = new LinkedHashMap<>();

  /**
   * Deep-merges {@code partial} into the object at a concrete {@code path}, creating missing
   * objects along field segments.
   *
   * @throws IllegalStateException when the path runs through a value of the wrong shape
   */
  public synchronized void merge(ResponsePath path, Map<String, Object> partial) {
    checkConcrete(path);
    if (path.isRoot()) {
      ResponseMerger.merge(root, partial);
      return;
    }
    Object parent = parentOf(path, true);
    Segment last = path.get(path.size() - 1);
    put(parent, last, ResponseMerger.merge(read(parent, last), partial), path);
  }

  /** Writes {@code null} at a concrete path. Does nothing when the parent does not exist. */
  public synchronized void setNull(ResponsePath path) {
    checkConcrete(path);
    Preconditions.checkArgument(!path.isRoot(), "Cannot null the response root");
    Object parent = parentOf(path, false);
    if (parent != null) {
      put(parent, path.get(path.size() - 1), null, path);
    }
  }

  /** The value at a concrete path, or empty when it is absent. A present {@code null} is empty. */
  public synchronized Optional<Object> get(ResponsePath path) {
    checkConcrete(path);
    Object current = root;
    for (Segment segment : path.getSegments()) {
      current = read(current, segment);
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(ResponseMerger.deepCopy(current));
  }

  /**
   * Finds the objects at {@code pattern} in traversal order. Wildcards expand to every list
   * element; a wildcard over a value that is not a list applies to the value itself. Absent
   * fields, nulls and non-object values produce no entity.
   */
  public synchronized List<Entity> collect(ResponsePath pattern) {
    List<Entity> entities = new ArrayList<>();
    collect(root, pattern, 0, ResponsePath.root(), entities);
    return entities;
  }

  /** A deep copy of the whole response. */
  @SuppressWarnings("unchecked")
  public synchronized Map<String, Object> snapshot() {
    return (Map<String, Object>) ResponseMerger.deepCopy(root);
  }

  @SuppressWarnings("unchecked")
  private void collect(
      Object node, ResponsePath pattern, int depth, ResponsePath at, List<Entity> out) {
    if (node == null) {
      return;
    }
    if (depth == pattern.size()) {
      if (node instanceof Map) {
        out.add(new Entity(at, (Map<String, Object>) ResponseMerger.deepCopy(node)));
      }
      return;
    }
    Segment segment = pattern.get(depth);
    switch (segment.getKind()) {
      case WILDCARD:
        if (node instanceof List) {
          List<?> list = (List<?>) node;
          for (int i = 0; i < list.size(); i++) {
            collect(list.get(i), pattern, depth + 1, at.index(i), out);
          }
        } else {
          collect(node, pattern, depth + 1, at, out);
        }
        break;
      case FIELD:
        if (node instanceof Map) {
          collect(
              ((Map<?, ?>) node).get(segment.getName()),
              pattern,
              depth + 1,
              at.field(segment.getName()),
              out);
        }
        break;
      case INDEX:
        if (node instanceof List && segment.getIndex() < ((List<?>) node).size()) {
          collect(
              ((List<?>) node).get(segment.getIndex()),
              pattern,
              depth + 1,
              at.index(segment.getIndex()),
              out);
        }
        break;
      default:
        throw new IllegalStateException("Unknown segment kind " + segment.getKind());
    }
  }

  private Object parentOf(ResponsePath path, boolean create) {
    Object current = root;
    for (int i = 0; i < path.size() - 1; i++) {
      Segment segment = path.get(i);
      Object next = read(current, segment);
      if (next == null) {
        if (!create || segment.getKind() != Segment.Kind.FIELD) {
          return null;
        }
        next = new LinkedHashMap<String, Object>();
        put(current, segment, next, path);
      }
      current = next;
    }
    return current;
  }

  private static Object read(Object container, Segment segment) {
    if (segment.getKind() == Segment.Kind.FIELD && container instanceof Map) {
      return ((Map<?, ?>) container).get(segment.getName());
    }
    if (segment.getKind() == Segment.Kind.INDEX && container instanceof List) {
      List<?> list = (List<?>) container;
      return segment.getIndex() < list.size() ? list.get(segment.getIndex()) : null;
    }
    return null;
  }

  @SuppressWarnings("unchecked")
  private static void put(Object container, Segment segment, Object value, ResponsePath path) {
    if (segment.getKind() == Segment.Kind.FIELD && container instanceof Map) {
      ((Map<String, Object>) container).put(segment.getName(), value);
    } else if (segment.getKind() == Segment.Kind.INDEX
        && container instanceof List
        && segment.getIndex() < ((List<?>) container).size()) {
      ((List<Object>) container).set(segment.getIndex(), value);
    } else {
      throw new IllegalStateException(
          String.format("Cannot write segment [%s] of path [%s]", segment, path));
    }
  }

  private static void checkConcrete(ResponsePath path) {
    Preconditions.checkArgument(path.isConcrete(), "Path [%s] contains a wildcard", path);
  }
}
