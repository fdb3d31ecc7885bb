/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.federation.common.setting;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Properties;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class PropertiesSettingsTest {

  @Test
  void should_use_defaults_for_absent_settings() {
    Settings settings = PropertiesSettings.defaults();

    assertEquals(
        Runtime.getRuntime().availableProcessors() * 2,
        settings.<Integer>getSettingValue(Settings.Key.EXECUTOR_POOL_SIZE));
    assertEquals(0L, settings.<Long>getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS));
    assertFalse(settings.<Boolean>getSettingValue(Settings.Key.INCLUDE_QUERY_PLAN));
  }

  @Test
  void should_load_settings_from_classpath_resource() {
    Settings settings = PropertiesSettings.load();

    assertEquals(3, settings.<Integer>getSettingValue(Settings.Key.EXECUTOR_POOL_SIZE));
    assertEquals(5000L, settings.<Long>getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS));
    assertEquals(
        PropertiesSettings.DEFAULTS.get(Settings.Key.INCLUDE_QUERY_PLAN),
        settings.getSettingValue(Settings.Key.INCLUDE_QUERY_PLAN));
  }

  @Test
  void should_convert_property_values() {
    Properties properties = new Properties();
    properties.setProperty("plugins.federation.executor.pool_size", " 8 ");
    properties.setProperty("plugins.federation.executor.query_timeout_millis", "250");
    properties.setProperty("plugins.federation.executor.include_query_plan", "true");

    Settings settings = new PropertiesSettings(properties);

    assertEquals(8, settings.<Integer>getSettingValue(Settings.Key.EXECUTOR_POOL_SIZE));
    assertEquals(250L, settings.<Long>getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS));
    assertTrue(settings.<Boolean>getSettingValue(Settings.Key.INCLUDE_QUERY_PLAN));
  }

  @Test
  void should_match_keys_case_insensitively() {
    assertEquals(
        Settings.Key.QUERY_TIMEOUT_MILLIS,
        Settings.Key.of("Plugins.Federation.Executor.Query_Timeout_Millis").get());
    assertFalse(Settings.Key.of("plugins.federation.unknown").isPresent());
    assertFalse(Settings.Key.of(null).isPresent());
  }

  @Test
  void should_ignore_unknown_settings() {
    Properties properties = new Properties();
    properties.setProperty("plugins.federation.executor.retries", "3");

    Settings settings = new PropertiesSettings(properties);

    assertEquals(0L, settings.<Long>getSettingValue(Settings.Key.QUERY_TIMEOUT_MILLIS));
  }

  @Test
  void should_reject_invalid_values() {
    Properties notANumber = new Properties();
    notANumber.setProperty("plugins.federation.executor.query_timeout_millis", "soon");
    Properties notPositive = new Properties();
    notPositive.setProperty("plugins.federation.executor.pool_size", "0");

    IllegalArgumentException invalid =
        assertThrows(IllegalArgumentException.class, () -> new PropertiesSettings(notANumber));
    IllegalArgumentException zero =
        assertThrows(IllegalArgumentException.class, () -> new PropertiesSettings(notPositive));

    assertEquals(
        "Invalid value [soon] for setting [plugins.federation.executor.query_timeout_millis]",
        invalid.getMessage());
    assertEquals(
        "Setting [plugins.federation.executor.pool_size] must be positive, got 0",
        zero.getMessage());
  }
}
