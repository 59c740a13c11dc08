package ca.gc.cra.burndler.config;

import ca.gc.cra.burndler.application.packaging.InstallerScripts;
import ca.gc.cra.burndler.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.burndler.validation.Numbers;
import ca.gc.cra.burndler.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed service configuration shared by every Burndler subcommand.
 * <p><strong>Why:</strong> Converts the flat effective map produced by {@link ConfigMerger} into validated values
 * before any adapter is created.</p>
 * <p><strong>Role:</strong> Input to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param storageRoot artifact store root directory
 * @param maxArtifactMiB upload cap for the local artifact store
 * @param catalog YAML build catalog, when the subcommand needs one
 * @param runtimeDir directory install.sh prepares for runtime resources
 * @param graceSeconds seconds install.sh waits before verifying the stack
 * @param packageVersion version stamped into package manifests
 * @param telemetry metrics exporter settings
 * @param verbose whether DEBUG logging was requested
 * @since 0.1.0
 */
public record BurndlerConfig(
    Path storageRoot,
    int maxArtifactMiB,
    Optional<Path> catalog,
    String runtimeDir,
    int graceSeconds,
    String packageVersion,
    TelemetrySettings telemetry,
    boolean verbose) {

  public static final String DEFAULT_STORAGE_ROOT = "./burndler-storage";
  public static final int DEFAULT_MAX_ARTIFACT_MIB = 1024;

  public BurndlerConfig {
    Objects.requireNonNull(storageRoot, "storageRoot");
    Numbers.requireRange("maxArtifactMiB", maxArtifactMiB, 1, 65_536);
    catalog = catalog == null ? Optional.empty() : catalog;
    Strings.requireNonBlank("runtimeDir", runtimeDir);
    Numbers.requireRange("graceSeconds", graceSeconds, 0, 3_600);
    packageVersion = Strings.requireNonBlank("packageVersion", packageVersion);
    Objects.requireNonNull(telemetry, "telemetry");
  }

  /**
   * Returns the configuration used when no file or CLI overrides are supplied.
   *
   * @return defaults with metrics export disabled
   */
  public static BurndlerConfig defaults() {
    return new BurndlerConfig(
        Path.of(DEFAULT_STORAGE_ROOT),
        DEFAULT_MAX_ARTIFACT_MIB,
        Optional.empty(),
        InstallerScripts.DEFAULT_RUNTIME_DIR,
        InstallerScripts.DEFAULT_GRACE_SECONDS,
        "1.0.0",
        TelemetrySettings.disabled(),
        false);
  }

  /**
   * Builds a configuration from an effective key/value map; missing keys fall back to {@link #defaults()}.
   *
   * @param args effective configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static BurndlerConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    BurndlerConfig defaults = defaults();
    Path storageRoot = optional(args.get("storageRoot")).map(Path::of).orElse(defaults.storageRoot());
    int maxArtifactMiB = optional(args.get("maxArtifactMiB"))
        .map(v -> Numbers.parseInt("maxArtifactMiB", v, 1, 65_536))
        .orElse(defaults.maxArtifactMiB());
    Optional<Path> catalog = optional(args.get("catalog")).map(Path::of);
    String runtimeDir = optional(args.get("runtimeDir")).orElse(defaults.runtimeDir());
    int graceSeconds = optional(args.get("graceSeconds"))
        .map(v -> Numbers.parseInt("graceSeconds", v, 0, 3_600))
        .orElse(defaults.graceSeconds());
    String version = optional(args.get("packageVersion")).orElse(defaults.packageVersion());
    TelemetrySettings telemetry = new TelemetrySettings(
        args.getOrDefault("metricsExporter", "none"),
        args.get("otelEndpoint"),
        args.get("otelResourceAttributes"));
    boolean verbose = ConfigValues.parseBoolean(args.get("verbose"), false);
    return new BurndlerConfig(storageRoot, maxArtifactMiB, catalog, runtimeDir, graceSeconds, version,
        telemetry, verbose);
  }

  /** Installer script settings derived from this configuration. */
  public InstallerScripts installerScripts() {
    return new InstallerScripts(runtimeDir, graceSeconds);
  }

  private static Optional<String> optional(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }
}
