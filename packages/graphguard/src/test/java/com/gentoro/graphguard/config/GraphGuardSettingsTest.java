package com.gentoro.graphguard.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.graphguard.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphGuardSettingsTest {

  @TempDir Path dir;

  @Test
  void loadsClasspathConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:graphguard-test.yaml").config();
    GraphGuardSettings settings = GraphGuardSettings.fromConfiguration(cfg);

    assertEquals("http://localhost:8000/api/v2/", settings.baseUrl());
    assertEquals("test-key", settings.apiKey());
    assertEquals("test-graph", settings.defaultGraphId());
    assertEquals(25, settings.pageSize());
    assertEquals(4, settings.maxAttempts());
    assertEquals(Duration.ofMillis(10), settings.initialBackoff());
    assertEquals(Duration.ofMillis(40), settings.maxBackoff());
    assertFalse(settings.fileLoggingEnabled());
    // not in the file
    assertEquals(Duration.ofSeconds(10), settings.connectTimeout());
  }

  @Test
  void loadsFileConfiguration() throws Exception {
    Path file = dir.resolve("custom.yaml");
    Files.writeString(file, "graph:\n  defaultGraphId: from-file\n  pageSize: 7\n");

    GraphGuardSettings settings =
        GraphGuardSettings.fromConfiguration(new ConfigurationProvider(file.toString()).config());

    assertEquals("from-file", settings.defaultGraphId());
    assertEquals(7, settings.pageSize());
    assertEquals(GraphGuardSettings.DEFAULT_BASE_URL, settings.baseUrl());
  }

  @Test
  void missingFileIsConfigError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  void emptyConfigurationUsesDefaults() {
    GraphGuardSettings settings = GraphGuardSettings.fromConfiguration(new BaseConfiguration());
    assertEquals(GraphGuardSettings.DEFAULT_GRAPH_ID, settings.defaultGraphId());
    assertEquals(GraphGuardSettings.DEFAULT_PAGE_SIZE, settings.pageSize());
    assertEquals(GraphGuardSettings.DEFAULT_MAX_ATTEMPTS, settings.maxAttempts());
    assertNull(settings.apiKey());
    assertEquals("logs", settings.logsDir());
  }

  @Test
  void unresolvedPlaceholderCountsAsUnset() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("zep.apiKey", "${env:GRAPHGUARD_TEST_UNSET_VARIABLE}");
    assertNull(GraphGuardSettings.fromConfiguration(cfg).apiKey());
  }

  @Test
  void invalidValuesAreRejected() {
    BaseConfiguration pageSize = new BaseConfiguration();
    pageSize.addProperty("graph.pageSize", 0);
    assertThrows(ConfigException.class, () -> GraphGuardSettings.fromConfiguration(pageSize));

    BaseConfiguration notANumber = new BaseConfiguration();
    notANumber.addProperty("retry.maxAttempts", "many");
    assertThrows(ConfigException.class, () -> GraphGuardSettings.fromConfiguration(notANumber));

    assertThrows(
        ConfigException.class,
        () ->
            GraphGuardSettings.builder()
                .initialBackoff(Duration.ofSeconds(5))
                .maxBackoff(Duration.ofSeconds(1))
                .build());
  }

  @Test
  void toStringHidesApiKey() {
    String text = GraphGuardSettings.builder().apiKey("super-secret").build().toString();
    assertFalse(text.contains("super-secret"));
    assertTrue(text.contains("<redacted>"));
  }
}
