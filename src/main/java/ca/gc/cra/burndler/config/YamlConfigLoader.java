package ca.gc.cra.burndler.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads Burndler configuration from a YAML document with a {@code common} section and one section per
 * subcommand, flattening nested keys with dots.
 *
 * <pre>{@code
 * common:
 *   metricsExporter: none
 * build:
 *   storageRoot: /srv/burndler
 *   catalog: /etc/burndler/catalog.yaml
 * }</pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and overlays the {@code mode} section on the {@code common} section.
   *
   * @param path YAML configuration file
   * @param mode subcommand name
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not valid YAML or contains lists
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }
    Map<String, Object> root = section(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    for (String name : new String[] {"common", mode.trim().toLowerCase(Locale.ROOT)}) {
      Object value = lookup(root, name);
      if (value != null) {
        flatten(section(value, name), "", flattened);
      }
    }
    return Optional.of(Map.copyOf(flattened));
  }

  private static Object lookup(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(e -> e.getKey().trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .findFirst()
        .orElse(null);
  }

  private static Map<String, Object> section(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(context + " section contains a blank or non-string key");
      }
      map.put(name, value);
    });
    return map;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(section(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    });
  }
}
