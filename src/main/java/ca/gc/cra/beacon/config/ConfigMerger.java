package ca.gc.cra.beacon.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, environment, and CLI sources while enforcing precedence.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > environment > YAML > defaults.
   *
   * @param yaml optional YAML-derived settings
   * @param environment configuration keys derived from environment variables (may be empty)
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when an override shadows a lower source or a key is unknown
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> environment,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> envCopy = environment == null ? Map.of() : environment;
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    overlay(merged, yamlCopy, Map.of(), "YAML", defaultsCopy.keySet(), warn);
    overlay(merged, envCopy, yamlCopy, "environment", defaultsCopy.keySet(), warn);
    Map<String, String> lower = new LinkedHashMap<>(yamlCopy);
    lower.putAll(envCopy);
    overlay(merged, cliCopy, lower, "CLI", defaultsCopy.keySet(), warn);

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void overlay(
      Map<String, String> merged,
      Map<String, String> source,
      Map<String, String> shadowed,
      String label,
      Set<String> knownKeys,
      Consumer<String> warn) {
    for (Map.Entry<String, String> entry : source.entrySet()) {
      String key = entry.getKey();
      String value = entry.getValue();
      if (key == null || value == null) {
        continue;
      }
      if (!knownKeys.isEmpty() && !knownKeys.contains(key)) {
        if (warn != null) {
          warn.accept("Ignoring unknown " + label + " key: " + key);
        }
        continue;
      }
      if (warn != null && shadowed.containsKey(key)) {
        warn.accept(label + " overrides lower-precedence value for key: " + key);
      }
      merged.put(key, value);
    }
  }

  private static void validate(Map<String, String> effective) {
    boolean messagingEnabled = parseBoolean(effective.get("messaging.enabled"), true);
    if (messagingEnabled && trim(effective.get("messaging.bootstrap")).isEmpty()) {
      throw new IllegalArgumentException("messaging.bootstrap is required when messaging.enabled=true");
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
