package com.gentoro.graphguard.config;

import com.gentoro.graphguard.exception.ConfigException;
import java.time.Duration;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable runtime settings resolved once from configuration and passed to constructors.
 *
 * <p>Components never read configuration or process state themselves, so tests can build a
 * settings value directly through {@link #builder()}.
 */
public final class GraphGuardSettings {
  public static final String DEFAULT_BASE_URL = "https://api.getzep.com/api/v2/";
  public static final String DEFAULT_GRAPH_ID = "pet-store-knowledge";
  public static final int DEFAULT_PAGE_SIZE = 100;
  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  private final String baseUrl;
  private final String apiKey;
  private final String healthPath;
  private final String defaultGraphId;
  private final int pageSize;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final Duration callTimeout;
  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final String logsDir;
  private final boolean fileLoggingEnabled;

  private GraphGuardSettings(Builder b) {
    this.baseUrl = b.baseUrl.endsWith("/") ? b.baseUrl : b.baseUrl + "/";
    this.apiKey = b.apiKey;
    this.healthPath = b.healthPath;
    this.defaultGraphId = b.defaultGraphId;
    this.pageSize = b.pageSize;
    this.connectTimeout = b.connectTimeout;
    this.readTimeout = b.readTimeout;
    this.callTimeout = b.callTimeout;
    this.maxAttempts = b.maxAttempts;
    this.initialBackoff = b.initialBackoff;
    this.maxBackoff = b.maxBackoff;
    this.logsDir = b.logsDir;
    this.fileLoggingEnabled = b.fileLoggingEnabled;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolve settings from a loaded configuration. Placeholders that could not be interpolated (for
   * example {@code ${env:ZEP_API_KEY}} with the variable unset) count as absent.
   */
  public static GraphGuardSettings fromConfiguration(Configuration cfg) {
    Builder b = builder();
    String baseUrl = resolved(cfg.getString("zep.baseUrl", null));
    if (baseUrl != null) b.baseUrl(baseUrl);
    b.apiKey(resolved(cfg.getString("zep.apiKey", null)));
    String healthPath = resolved(cfg.getString("zep.healthPath", null));
    if (healthPath != null) b.healthPath(healthPath);
    String graphId = resolved(cfg.getString("graph.defaultGraphId", null));
    if (graphId != null) b.defaultGraphId(graphId);
    try {
      b.pageSize(cfg.getInt("graph.pageSize", DEFAULT_PAGE_SIZE));
      b.connectTimeout(Duration.ofMillis(cfg.getLong("http.connectTimeoutMs", 10_000L)));
      b.readTimeout(Duration.ofMillis(cfg.getLong("http.readTimeoutMs", 20_000L)));
      b.callTimeout(Duration.ofMillis(cfg.getLong("http.callTimeoutMs", 30_000L)));
      b.maxAttempts(cfg.getInt("retry.maxAttempts", DEFAULT_MAX_ATTEMPTS));
      b.initialBackoff(Duration.ofMillis(cfg.getLong("retry.initialDelayMs", 500L)));
      b.maxBackoff(Duration.ofMillis(cfg.getLong("retry.maxDelayMs", 4_000L)));
      b.fileLoggingEnabled(cfg.getBoolean("logging.file.enabled", true));
    } catch (RuntimeException e) {
      throw new ConfigException("Invalid numeric or boolean setting: " + e.getMessage(), e);
    }
    String logsDir = resolved(cfg.getString("logging.dir", null));
    if (logsDir != null) b.logsDir(logsDir);
    return b.build();
  }

  private static String resolved(String value) {
    if (value == null || value.isBlank() || value.contains("${")) {
      return null;
    }
    return value.trim();
  }

  public String baseUrl() {
    return baseUrl;
  }

  /** API key, or {@code null} when none is configured. */
  public String apiKey() {
    return apiKey;
  }

  public String healthPath() {
    return healthPath;
  }

  public String defaultGraphId() {
    return defaultGraphId;
  }

  public int pageSize() {
    return pageSize;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration readTimeout() {
    return readTimeout;
  }

  public Duration callTimeout() {
    return callTimeout;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration initialBackoff() {
    return initialBackoff;
  }

  public Duration maxBackoff() {
    return maxBackoff;
  }

  public String logsDir() {
    return logsDir;
  }

  public boolean fileLoggingEnabled() {
    return fileLoggingEnabled;
  }

  @Override
  public String toString() {
    return "GraphGuardSettings{baseUrl="
        + baseUrl
        + ", apiKey="
        + (apiKey == null ? "<unset>" : "<redacted>")
        + ", defaultGraphId="
        + defaultGraphId
        + ", pageSize="
        + pageSize
        + ", maxAttempts="
        + maxAttempts
        + '}';
  }

  public static final class Builder {
    private String baseUrl = DEFAULT_BASE_URL;
    private String apiKey;
    private String healthPath = "healthz";
    private String defaultGraphId = DEFAULT_GRAPH_ID;
    private int pageSize = DEFAULT_PAGE_SIZE;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(20);
    private Duration callTimeout = Duration.ofSeconds(30);
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration initialBackoff = Duration.ofMillis(500);
    private Duration maxBackoff = Duration.ofSeconds(4);
    private String logsDir = "logs";
    private boolean fileLoggingEnabled = true;

    private Builder() {}

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
      return this;
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder healthPath(String healthPath) {
      this.healthPath = Objects.requireNonNull(healthPath, "healthPath");
      return this;
    }

    public Builder defaultGraphId(String defaultGraphId) {
      this.defaultGraphId = defaultGraphId;
      return this;
    }

    public Builder pageSize(int pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    public Builder connectTimeout(Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
      return this;
    }

    public Builder readTimeout(Duration readTimeout) {
      this.readTimeout = readTimeout;
      return this;
    }

    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder initialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
      return this;
    }

    public Builder maxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
      return this;
    }

    public Builder logsDir(String logsDir) {
      this.logsDir = logsDir;
      return this;
    }

    public Builder fileLoggingEnabled(boolean fileLoggingEnabled) {
      this.fileLoggingEnabled = fileLoggingEnabled;
      return this;
    }

    public GraphGuardSettings build() {
      if (pageSize <= 0) {
        throw new ConfigException("graph.pageSize must be positive, got " + pageSize);
      }
      if (maxAttempts <= 0) {
        throw new ConfigException("retry.maxAttempts must be positive, got " + maxAttempts);
      }
      if (initialBackoff == null || initialBackoff.isNegative()) {
        throw new ConfigException("retry.initialDelayMs must not be negative");
      }
      if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
        throw new ConfigException("retry.maxDelayMs must be at least retry.initialDelayMs");
      }
      return new GraphGuardSettings(this);
    }
  }
}
