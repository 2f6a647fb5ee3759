package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Supplies the flattened default configuration map for the {@code serve} mode.
 *
 * <p>The defaults remain the single source of truth for the accepted configuration keys.</p>
 */
public final class ServiceDefaults {
  /** YAML section merged over {@code common}. */
  public static final String MODE = "serve";

  private static final Map<String, String> DEFAULTS = buildDefaults();

  private ServiceDefaults() {}

  /**
   * Returns the default key/value pairs.
   *
   * @return unmodifiable map of defaults as strings
   */
  public static Map<String, String> asFlatMap() {
    return DEFAULTS;
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("host", "0.0.0.0");
    map.put("port", "3000");
    map.put("database.url", "jdbc:h2:mem:beacon;DB_CLOSE_DELAY=-1");
    map.put("database.username", "sa");
    map.put("database.password", "");
    map.put("database.maxPoolSize", "10");
    map.put("database.poolName", "beacon-db");
    map.put("messaging.enabled", "true");
    map.put("messaging.bootstrap", "localhost:9092");
    map.put("messaging.topic", "beacon.outbound");
    map.put("messaging.maxBlockMs", "10000");
    map.put("logging.level", "INFO");
    map.put("logging.config", "");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    return Map.copyOf(map);
  }
}
