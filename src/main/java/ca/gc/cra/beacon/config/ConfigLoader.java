package ca.gc.cra.beacon.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves the effective {@link ServiceConfig} from every configuration source.
 * <p><strong>Why:</strong> Operators configure the service through CLI arguments, environment variables, or a YAML
 * file; the entry point needs one validated result.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
  /** CLI key naming the YAML file. */
  public static final String CONFIG_KEY = "config";

  private ConfigLoader() {}

  /**
   * Loads configuration with precedence CLI > environment > YAML > defaults.
   *
   * @param cliArgs parsed {@code key=value} arguments; may contain {@code config=PATH}
   * @param environment environment snapshot
   * @return validated configuration
   * @throws IOException if the YAML file exists but cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or any value is invalid
   */
  public static ServiceConfig load(Map<String, String> cliArgs, Map<String, String> environment)
      throws IOException {
    Map<String, String> cli = cliArgs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(cliArgs);
    String configPath = cli.remove(CONFIG_KEY);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null && !configPath.isBlank()) {
      Path path = Path.of(configPath.trim());
      if (!Files.isRegularFile(path)) {
        throw new IllegalArgumentException("config file not found: " + path);
      }
      yaml = YamlConfigLoader.load(path, ServiceDefaults.MODE);
      log.debug("Loaded YAML configuration from {}", path);
    }
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        yaml,
        EnvironmentConfigSource.fromEnvironment(environment),
        cli,
        ServiceDefaults.asFlatMap(),
        log::warn);
    return ServiceConfig.fromMap(effective);
  }
}
