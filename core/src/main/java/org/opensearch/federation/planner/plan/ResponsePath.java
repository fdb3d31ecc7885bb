/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.planner.plan;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A location in the response tree: an ordered sequence of field names, list indexes and list
 * wildcards. Plans use wildcards ({@code topProducts.@.reviews}) to address every element of a
 * list; paths produced during execution, such as error paths, are concrete and only hold field
 * names and indexes.
 */
@EqualsAndHashCode
public final class ResponsePath {

  /** Text form of a wildcard segment. */
  public static final String WILDCARD = "@";

  private static final ResponsePath ROOT = new ResponsePath(ImmutableList.of());

  @Getter private final List<Segment> segments;

  private ResponsePath(List<Segment> segments) {
    this.segments = segments;
  }

  public static ResponsePath root() {
    return ROOT;
  }

  /** Parses a dotted path. {@code @} is a wildcard, a non-negative integer is a list index. */
  public static ResponsePath parse(String path) {
    if (Strings.isNullOrEmpty(path)) {
      return ROOT;
    }
    List<Object> elements = new ArrayList<>();
    for (String part : Splitter.on('.').split(path)) {
      Preconditions.checkArgument(!part.isEmpty(), "Empty segment in path [%s]", path);
      elements.add(isIndex(part) ? Integer.valueOf(part) : part);
    }
    return of(elements);
  }

  /**
   * Builds a path from GraphQL-style path elements: {@code String} field names, the {@code "@"}
   * wildcard and numeric indexes.
   */
  public static ResponsePath of(List<?> elements) {
    ImmutableList.Builder<Segment> builder = ImmutableList.builder();
    for (Object element : elements) {
      builder.add(Segment.of(element));
    }
    return new ResponsePath(builder.build());
  }

  public static ResponsePath of(Object... elements) {
    return of(List.of(elements));
  }

  public ResponsePath field(String name) {
    return append(Segment.field(name));
  }

  public ResponsePath index(int index) {
    return append(Segment.index(index));
  }

  public ResponsePath wildcard() {
    return append(Segment.WILDCARD_SEGMENT);
  }

  public ResponsePath concat(ResponsePath other) {
    if (other.isRoot()) {
      return this;
    }
    return new ResponsePath(
        ImmutableList.<Segment>builder().addAll(segments).addAll(other.segments).build());
  }

  /** The segments before the first wildcard. */
  public ResponsePath concretePrefix() {
    int end = 0;
    while (end < segments.size() && segments.get(end).getKind() != Segment.Kind.WILDCARD) {
      end++;
    }
    return end == segments.size() ? this : new ResponsePath(segments.subList(0, end));
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  public boolean isConcrete() {
    return segments.stream().noneMatch(s -> s.getKind() == Segment.Kind.WILDCARD);
  }

  /** True when every segment is a field name. */
  public boolean isFieldPath() {
    return segments.stream().allMatch(s -> s.getKind() == Segment.Kind.FIELD);
  }

  public int size() {
    return segments.size();
  }

  public Segment get(int i) {
    return segments.get(i);
  }

  /** GraphQL-style path elements, as they appear in an error's {@code path}. */
  public List<Object> toList() {
    return segments.stream().map(Segment::toElement).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return segments.stream().map(Segment::toString).collect(Collectors.joining("."));
  }

  private ResponsePath append(Segment segment) {
    return new ResponsePath(
        ImmutableList.<Segment>builder().addAll(segments).add(segment).build());
  }

  private static boolean isIndex(String part) {
    return part.chars().allMatch(Character::isDigit);
  }

  /** One step of a {@link ResponsePath}. */
  @Getter
  @EqualsAndHashCode
  @RequiredArgsConstructor(access = AccessLevel.PRIVATE)
  public static final class Segment {

    public enum Kind {
      FIELD,
      INDEX,
      WILDCARD
    }

    private static final Segment WILDCARD_SEGMENT = new Segment(Kind.WILDCARD, null, -1);

    private final Kind kind;
    private final String name;
    private final int index;

    public static Segment field(String name) {
      Preconditions.checkArgument(!Strings.isNullOrEmpty(name), "Field name must not be empty");
      Preconditions.checkArgument(!WILDCARD.equals(name), "Use wildcard() for list segments");
      return new Segment(Kind.FIELD, name, -1);
    }

    public static Segment index(int index) {
      Preconditions.checkArgument(index >= 0, "List index must not be negative: %s", index);
      return new Segment(Kind.INDEX, null, index);
    }

    public static Segment wildcard() {
      return WILDCARD_SEGMENT;
    }

    static Segment of(Object element) {
      if (element instanceof Number) {
        return index(((Number) element).intValue());
      }
      Preconditions.checkArgument(
          element instanceof String, "Unsupported path element [%s]", element);
      return WILDCARD.equals(element) ? WILDCARD_SEGMENT : field((String) element);
    }

    Object toElement() {
      switch (kind) {
        case FIELD:
          return name;
        case INDEX:
          return index;
        default:
          return WILDCARD;
      }
    }

    @Override
    public String toString() {
      return String.valueOf(toElement());
    }
  }
}
