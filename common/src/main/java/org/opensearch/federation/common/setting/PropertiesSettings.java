/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.setting;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;

/**
 * {@link Settings} backed by {@link Properties}. Values not present in the properties fall back
 * to {@link #DEFAULTS}. Unknown property names are ignored with a warning.
 */
@Log4j2
public class PropertiesSettings extends Settings {

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE_NAME = "federation-executor.properties";

  @VisibleForTesting
  static final Map<Key, Object> DEFAULTS =
      ImmutableMap.of(
          Key.EXECUTOR_POOL_SIZE, Runtime.getRuntime().availableProcessors() * 2,
          Key.QUERY_TIMEOUT_MILLIS, 0L,
          Key.INCLUDE_QUERY_PLAN, false);

  private final Map<Key, Object> values;

  public PropertiesSettings(Properties properties) {
    this.values = new EnumMap<>(Key.class);
    for (String name : properties.stringPropertyNames()) {
      Key.of(name)
          .ifPresentOrElse(
              key -> values.put(key, convert(key, properties.getProperty(name))),
              () -> log.warn("Ignoring unknown setting [{}]", name));
    }
  }

  /** Settings with every value at its default. */
  public static PropertiesSettings defaults() {
    return new PropertiesSettings(new Properties());
  }

  /**
   * Loads {@value #RESOURCE_NAME} from the classpath, or the defaults when the resource does not
   * exist.
   */
  public static PropertiesSettings load() {
    Properties properties = new Properties();
    try (InputStream in =
        PropertiesSettings.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
      if (in == null) {
        log.info("No {} on classpath, using default settings", RESOURCE_NAME);
      } else {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE_NAME, e);
    }
    return new PropertiesSettings(properties);
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.getOrDefault(key, DEFAULTS.get(key));
  }

  private static Object convert(Key key, String raw) {
    switch (key) {
      case EXECUTOR_POOL_SIZE:
        Integer size = parse(key, raw, Integer::valueOf);
        if (size <= 0) {
          throw new IllegalArgumentException(
              "Setting [" + key.getKeyValue() + "] must be positive, got " + size);
        }
        return size;
      case QUERY_TIMEOUT_MILLIS:
        return parse(key, raw, Long::valueOf);
      case INCLUDE_QUERY_PLAN:
        return parse(key, raw, Boolean::valueOf);
      default:
        throw new IllegalStateException("Unhandled setting " + key);
    }
  }
}
