package ca.gc.cra.beacon.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads the optional BEACON YAML file into the flat dotted keys understood by {@link ConfigMerger}.
 *
 * <p>The document root holds named sections. {@value #COMMON_SECTION} applies to every mode and the section named
 * after the mode is layered over it, so {@code serve: {database: {url: ...}}} yields {@code database.url}. Section
 * names match case-insensitively; keys below them are kept verbatim.</p>
 */
public final class YamlConfigLoader {
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Reads {@code path} and layers the mode section over the common section.
   *
   * @param path location of the YAML configuration
   * @param mode section name, e.g. {@code serve}
   * @return flat configuration, empty map for an empty document, or {@link Optional#empty()} when the file is absent
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or not a mapping of scalar leaves
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    Object document = parse(path);
    if (document == null) {
      return Optional.of(Map.of());
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException("YAML config at " + path + " must be a mapping of sections");
    }

    Map<String, String> values = new LinkedHashMap<>();
    for (String sectionName : List.of(COMMON_SECTION, normalize(mode))) {
      Object section = section(root, sectionName);
      if (section == null) {
        continue;
      }
      if (!(section instanceof Map<?, ?> entries)) {
        throw new IllegalArgumentException("YAML section '" + sectionName + "' must be a mapping");
      }
      collect(entries, sectionName, null, values);
    }
    return Optional.of(Map.copyOf(values));
  }

  private static Object parse(Path path) throws IOException {
    Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return yaml.load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  // Scans every root key so a malformed key is reported even after the section was found.
  private static Object section(Map<?, ?> root, String sectionName) {
    Object match = null;
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      String name = keyOf(entry.getKey(), "root");
      if (match == null && normalize(name).equals(sectionName)) {
        match = entry.getValue();
      }
    }
    return match;
  }

  private static void collect(Map<?, ?> node, String sectionName, String prefix, Map<String, String> values) {
    for (Map.Entry<?, ?> entry : node.entrySet()) {
      String key = keyOf(entry.getKey(), prefix == null ? sectionName : sectionName + "." + prefix);
      String dotted = prefix == null ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(nested, sectionName, dotted, values);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + dotted);
      } else {
        values.put(dotted, value == null ? "" : value.toString());
      }
    }
  }

  // SafeConstructor turns `~:` and `null:` into null keys and `1:` into an Integer key.
  private static String keyOf(Object rawKey, String location) {
    if (rawKey == null) {
      throw new IllegalArgumentException("YAML contains a null key under " + location);
    }
    if (!(rawKey instanceof String key)) {
      throw new IllegalArgumentException("YAML contains non-string key '" + rawKey + "' under " + location);
    }
    if (key.isBlank()) {
      throw new IllegalArgumentException("YAML contains a blank key under " + location);
    }
    return key;
  }

  private static String normalize(String name) {
    return name.trim().toLowerCase(Locale.ROOT);
  }
}
