package ca.gc.cra.burndler.config;

import ca.gc.cra.burndler.application.packaging.InstallerScripts;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each Burndler subcommand.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; every key a subcommand reads appears
 * here.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns common defaults merged with the defaults of one subcommand.
   *
   * @param mode subcommand ({@code merge}, {@code lint}, {@code render}, {@code build})
   * @return unmodifiable flat map
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "merge" -> Map.of("in", "", "out", "", "vars", "");
      case "lint" -> Map.of("in", "", "strict", "true");
      case "render" -> Map.of("in", "", "out", "", "format", "text", "vars", "");
      case "build" -> buildDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("storageRoot", BurndlerConfig.DEFAULT_STORAGE_ROOT);
    map.put("maxArtifactMiB", Integer.toString(BurndlerConfig.DEFAULT_MAX_ARTIFACT_MIB));
    map.put("catalog", "");
    map.put("target", "");
    map.put("buildId", "");
    map.put("runtimeDir", InstallerScripts.DEFAULT_RUNTIME_DIR);
    map.put("graceSeconds", Integer.toString(InstallerScripts.DEFAULT_GRACE_SECONDS));
    map.put("packageVersion", "1.0.0");
    return map;
  }
}
