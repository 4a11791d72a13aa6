package com.gentoro.graphguard.config;

import com.gentoro.graphguard.exception.ConfigException;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the application
 * classpath), a {@code file:} URI, or an absolute or relative filesystem path. Values may reference
 * environment variables as {@code ${env:NAME}}; variables missing from the process environment are
 * looked up in a {@code .env.local} file in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_LOCATION = "classpath:application.yaml";
  static final Path DEFAULT_ENV_FILE = Path.of(".env.local");

  private static final String CLASSPATH_PREFIX = "classpath:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    this(location, DEFAULT_ENV_FILE);
  }

  ConfigurationProvider(String location, Path envFile) {
    this.configuration = load(location == null ? DEFAULT_LOCATION : location.trim());
    configuration.getInterpolator().registerLookup("env", new EnvLookup(envFile));
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  private static Configuration load(String location) {
    if (location.isEmpty()) {
      return fromClasspath("application.yaml");
    }
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return fromFile(new File(URI.create(location)));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + location, e);
      }
    }
    return fromFile(new File(location));
  }

  /** A missing classpath resource means built-in defaults; a broken one is an error. */
  private static Configuration fromClasspath(String resourceName) {
    URL resource = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resource == null) {
      log.warn("Configuration resource {} not found on classpath; using defaults", resourceName);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    YAMLConfiguration config = new YAMLConfiguration();
    try (Reader reader = new InputStreamReader(resource.openStream(), StandardCharsets.UTF_8)) {
      config.read(reader);
      return config;
    } catch (IOException | ConfigurationException e) {
      throw new ConfigException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration fromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file.getAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.getAbsolutePath());
    try {
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(new Parameters().fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  /** {@code ${env:NAME}}: process environment first, then {@code NAME=value} lines of a file. */
  static final class EnvLookup implements Lookup {
    private final Path envFile;
    private Map<String, String> fileValues;

    EnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return fileValues().get(key);
    }

    private synchronized Map<String, String> fileValues() {
      if (fileValues == null) {
        fileValues = readEnvFile(envFile);
      }
      return fileValues;
    }

    static Map<String, String> readEnvFile(Path path) {
      Map<String, String> values = new HashMap<>();
      if (path == null || !Files.isRegularFile(path)) {
        return values;
      }
      log.info("Reading environment fallback file: {}", path.toAbsolutePath());
      try {
        for (String raw : Files.readAllLines(path, StandardCharsets.UTF_8)) {
          String line = raw.trim();
          int eq = line.indexOf('=');
          if (line.startsWith("#") || eq <= 0) {
            continue;
          }
          values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
        }
      } catch (IOException e) {
        log.warn("Could not read {}: {}", path.toAbsolutePath(), e.getMessage());
      }
      return values;
    }

    private static String unquote(String value) {
      if (value.length() > 1) {
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
          return value.substring(1, value.length() - 1);
        }
      }
      return value;
    }
  }
}
