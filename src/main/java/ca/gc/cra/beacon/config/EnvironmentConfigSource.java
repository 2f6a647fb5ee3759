package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps process environment variables onto configuration keys.
 */
public final class EnvironmentConfigSource {
  static final Map<String, String> VARIABLES = buildVariables();

  private EnvironmentConfigSource() {}

  /**
   * Extracts the configuration keys present in {@code environment}.
   *
   * @param environment environment snapshot, typically {@link System#getenv()}
   * @return configuration keys with their values; blank variables are ignored
   */
  public static Map<String, String> fromEnvironment(Map<String, String> environment) {
    Map<String, String> result = new LinkedHashMap<>();
    if (environment == null || environment.isEmpty()) {
      return result;
    }
    for (Map.Entry<String, String> entry : VARIABLES.entrySet()) {
      String value = environment.get(entry.getKey());
      if (value != null && !value.isBlank()) {
        result.put(entry.getValue(), value.trim());
      }
    }
    return result;
  }

  private static Map<String, String> buildVariables() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("PORT", "port");
    map.put("HOST", "host");
    map.put("DB_URL", "database.url");
    map.put("DB_USERNAME", "database.username");
    map.put("DB_PASSWORD", "database.password");
    map.put("DB_MAX_POOL_SIZE", "database.maxPoolSize");
    map.put("MESSAGING_ENABLED", "messaging.enabled");
    map.put("KAFKA_BOOTSTRAP", "messaging.bootstrap");
    map.put("KAFKA_TOPIC", "messaging.topic");
    map.put("KAFKA_MAX_BLOCK_MS", "messaging.maxBlockMs");
    map.put("LOG_LEVEL", "logging.level");
    map.put("LOGBACK_CONFIG", "logging.config");
    map.put("OTEL_METRICS_EXPORTER", "metricsExporter");
    map.put("OTEL_EXPORTER_OTLP_ENDPOINT", "otelEndpoint");
    return Map.copyOf(map);
  }
}
