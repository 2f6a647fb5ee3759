package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.validation.Net;
import ca.gc.cra.beacon.validation.Numbers;
import ca.gc.cra.beacon.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable runtime configuration of the BEACON service.
 * <p><strong>Why:</strong> Gives the composition root one validated view of the listener, persistence, messaging,
 * logging, and telemetry settings.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable; safe for concurrent reads.</p>
 *
 * @param host interface the listener binds
 * @param port listener port; {@code 0} selects an ephemeral port
 * @param database persistence settings
 * @param messaging messaging transport settings
 * @param logging logging settings
 * @param telemetry metrics exporter settings
 * @since 0.1.0
 */
public record ServiceConfig(
    String host,
    int port,
    DatabaseSettings database,
    MessagingSettings messaging,
    LoggingSettings logging,
    TelemetrySettings telemetry) {

  static final int MAX_PORT = 65_535;
  static final int MAX_POOL_SIZE = 256;
  static final int MIN_MAX_BLOCK_MS = 100;
  static final int MAX_MAX_BLOCK_MS = 300_000;

  public ServiceConfig {
    host = Net.validateHost(host);
    Numbers.requireRange("port", port, 0, MAX_PORT);
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(messaging, "messaging");
    Objects.requireNonNull(logging, "logging");
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Persistence pool settings.
   *
   * @param url JDBC URL
   * @param username database user
   * @param password database password; may be empty
   * @param maxPoolSize maximum pooled connections
   * @param poolName pool name used in thread names and logs
   */
  public record DatabaseSettings(String url, String username, String password, int maxPoolSize, String poolName) {
    public DatabaseSettings {
      url = Strings.requireNonBlank("database.url", url);
      if (!url.startsWith("jdbc:")) {
        throw new IllegalArgumentException("database.url must start with jdbc: (was " + url + ")");
      }
      username = Strings.requireNonBlank("database.username", username);
      password = password == null ? "" : password;
      Numbers.requireRange("database.maxPoolSize", maxPoolSize, 1, MAX_POOL_SIZE);
      poolName = Strings.requirePrintableAscii("database.poolName", poolName, 64);
    }

    @Override
    public String toString() {
      return "DatabaseSettings[url=" + url + ", username=" + username + ", maxPoolSize=" + maxPoolSize
          + ", poolName=" + poolName + "]";
    }
  }

  /**
   * Messaging transport settings.
   *
   * @param enabled whether the transport subsystem is registered
   * @param bootstrap Kafka bootstrap {@code host:port}
   * @param topic outbound topic
   * @param maxBlockMs bound on metadata fetches and blocking sends
   */
  public record MessagingSettings(boolean enabled, String bootstrap, String topic, int maxBlockMs) {
    public MessagingSettings {
      topic = Strings.sanitizeTopic("messaging.topic", topic);
      Numbers.requireRange("messaging.maxBlockMs", maxBlockMs, MIN_MAX_BLOCK_MS, MAX_MAX_BLOCK_MS);
      if (enabled) {
        bootstrap = validateBootstrap(bootstrap);
      } else {
        bootstrap = bootstrap == null ? "" : bootstrap.trim();
      }
    }
  }

  /**
   * Logging settings.
   *
   * @param level root level name
   * @param configFile optional external Logback file
   */
  public record LoggingSettings(String level, Optional<Path> configFile) {
    public LoggingSettings {
      level = Strings.requireNonBlank("logging.level", level).toUpperCase(Locale.ROOT);
      configFile = configFile == null ? Optional.empty() : configFile;
    }
  }

  /**
   * Metrics exporter settings.
   *
   * @param exporter {@code otlp} or {@code none}
   * @param endpoint OTLP endpoint; empty uses the SDK default
   */
  public record TelemetrySettings(String exporter, String endpoint) {
    public TelemetrySettings {
      exporter = Strings.requireNonBlank("metricsExporter", exporter).toLowerCase(Locale.ROOT);
      if (!exporter.equals("otlp") && !exporter.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      endpoint = endpoint == null ? "" : endpoint.trim();
    }
  }

  /**
   * Provides the built-in configuration used when no source overrides a value.
   *
   * @return default configuration
   */
  public static ServiceConfig defaults() {
    return fromMap(ServiceDefaults.asFlatMap());
  }

  /**
   * Builds a configuration from a flattened key/value map (see {@link ServiceDefaults} for the key set).
   *
   * @param kv merged configuration values; missing keys fall back to defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed; the message names the key
   */
  public static ServiceConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    Map<String, String> defaults = ServiceDefaults.asFlatMap();
    String host = value(kv, defaults, "host");
    int port = parseBoundedInt(kv, defaults, "port", 0, MAX_PORT);

    DatabaseSettings database = new DatabaseSettings(
        value(kv, defaults, "database.url"),
        value(kv, defaults, "database.username"),
        kv.getOrDefault("database.password", defaults.get("database.password")),
        parseBoundedInt(kv, defaults, "database.maxPoolSize", 1, MAX_POOL_SIZE),
        value(kv, defaults, "database.poolName"));

    MessagingSettings messaging = new MessagingSettings(
        parseBoolean(kv.get("messaging.enabled"), Boolean.parseBoolean(defaults.get("messaging.enabled"))),
        kv.getOrDefault("messaging.bootstrap", defaults.get("messaging.bootstrap")),
        value(kv, defaults, "messaging.topic"),
        parseBoundedInt(kv, defaults, "messaging.maxBlockMs", MIN_MAX_BLOCK_MS, MAX_MAX_BLOCK_MS));

    String loggingConfig = kv.getOrDefault("logging.config", "");
    LoggingSettings logging = new LoggingSettings(
        value(kv, defaults, "logging.level"),
        loggingConfig == null || loggingConfig.isBlank()
            ? Optional.empty()
            : Optional.of(Path.of(loggingConfig.trim())));

    TelemetrySettings telemetry = new TelemetrySettings(
        value(kv, defaults, "metricsExporter"),
        kv.getOrDefault("otelEndpoint", ""));

    return new ServiceConfig(host, port, database, messaging, logging, telemetry);
  }

  private static String validateBootstrap(String raw) {
    String trimmed = Strings.requireNonBlank("messaging.bootstrap", raw);
    StringBuilder normalized = new StringBuilder(trimmed.length());
    for (String token : trimmed.split(",")) {
      if (token.isBlank()) {
        continue;
      }
      if (normalized.length() > 0) {
        normalized.append(',');
      }
      normalized.append(Net.validateHostPort(token.trim()));
    }
    if (normalized.length() == 0) {
      throw new IllegalArgumentException("messaging.bootstrap must list at least one host:port");
    }
    return normalized.toString();
  }

  private static String value(Map<String, String> kv, Map<String, String> defaults, String key) {
    String raw = kv.get(key);
    return raw == null || raw.isBlank() ? defaults.get(key) : raw.trim();
  }

  private static int parseBoundedInt(
      Map<String, String> kv, Map<String, String> defaults, String key, int min, int max) {
    String raw = value(kv, defaults, key);
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("messaging.enabled must be true or false (was " + value + ")");
    };
  }
}
