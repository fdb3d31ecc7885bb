/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.setting;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Executor settings. */
public abstract class Settings {

  @RequiredArgsConstructor
  public enum Key {

    /** Number of worker threads that run service calls. */
    EXECUTOR_POOL_SIZE("plugins.federation.executor.pool_size"),

    /** Wall-clock limit for one plan execution in milliseconds, 0 disables it. */
    QUERY_TIMEOUT_MILLIS("plugins.federation.executor.query_timeout_millis"),

    /** Whether the executed plan is attached to the execution result. */
    INCLUDE_QUERY_PLAN("plugins.federation.executor.include_query_plan");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      String key = Strings.isNullOrEmpty(keyValue) ? "" : keyValue.toLowerCase();
      return Optional.ofNullable(ALL_KEYS.getOrDefault(key, null));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);

  /** Get Setting Value, converted from its raw form with the given parser. */
  protected static <T> T parse(Key key, Object raw, Function<String, T> parser) {
    try {
      return parser.apply(String.valueOf(raw).trim());
    } catch (RuntimeException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value [%s] for setting [%s]", raw, key.getKeyValue()), e);
    }
  }
}
