package ca.gc.cra.burndler.config;

import ca.gc.cra.burndler.application.compose.ComposeLinter;
import ca.gc.cra.burndler.application.compose.ComposeMerger;
import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.packaging.Packager;
import ca.gc.cra.burndler.application.pipeline.BuildOrchestrator;
import ca.gc.cra.burndler.application.pipeline.VariableResolver;
import ca.gc.cra.burndler.application.port.ArtifactStorePort;
import ca.gc.cra.burndler.application.port.BuildRecordPort;
import ca.gc.cra.burndler.application.port.ClockPort;
import ca.gc.cra.burndler.application.port.MetricsPort;
import ca.gc.cra.burndler.application.rules.DependencyChecker;
import ca.gc.cra.burndler.application.rules.DependencyRuleParser;
import ca.gc.cra.burndler.application.template.TemplateEngine;
import ca.gc.cra.burndler.application.template.TemplateFunctions;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.burndler.infrastructure.persistence.YamlBuildCatalog;
import ca.gc.cra.burndler.infrastructure.storage.LocalFsArtifactStore;
import ca.gc.cra.burndler.infrastructure.time.SystemClockAdapter;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Composition root wiring Burndler use cases to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from configuration to object graph in one place.</p>
 * <p><strong>Role:</strong> Called by the CLI entry points after configuration has been merged.</p>
 * <p><strong>Thread-safety:</strong> Factories are not synchronized; the root is built once per process.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter and flushes it on {@link #close()}.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final BurndlerConfig config;
  private final YamlSupport yaml = new YamlSupport();
  private final JsonSupport json = new JsonSupport();
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a root that exports metrics according to {@code config}.
   *
   * @param config typed configuration
   */
  public CompositionRoot(BurndlerConfig config) {
    this(config, new SystemClockAdapter(), config.telemetry().enabled()
        ? new OpenTelemetryMetricsAdapter(config.telemetry())
        : MetricsPort.NO_OP);
  }

  /**
   * Creates a root with explicit clock and metrics collaborators.
   *
   * @param config typed configuration
   * @param clock time source for packaging and template functions
   * @param metrics metrics sink
   */
  public CompositionRoot(BurndlerConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public BurndlerConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ComposeMerger composeMerger() {
    return new ComposeMerger(yaml, metrics);
  }

  public ComposeLinter composeLinter() {
    return new ComposeLinter(yaml, metrics);
  }

  public TemplateEngine templateEngine() {
    return new TemplateEngine(
        TemplateFunctions.standard(clock, new SecureRandom(), System::getenv), yaml, json);
  }

  /** Local filesystem store under {@code storageRoot}; creates the directory when missing. */
  public ArtifactStorePort artifactStore() {
    return new LocalFsArtifactStore(config.storageRoot(), config.maxArtifactMiB());
  }

  /**
   * YAML catalog named by the {@code catalog} key.
   *
   * @throws IllegalArgumentException when no catalog is configured
   */
  public BuildRecordPort buildCatalog() {
    return new YamlBuildCatalog(config.catalog()
        .orElseThrow(() -> new IllegalArgumentException("catalog is required for build")));
  }

  public Packager packager(ArtifactStorePort store) {
    return new Packager(store, yaml, json, config.installerScripts(), clock, metrics,
        () -> UUID.randomUUID().toString(), config.packageVersion());
  }

  /** Fully wired build orchestrator over the configured store and catalog. */
  public BuildOrchestrator buildOrchestrator() {
    ArtifactStorePort store = artifactStore();
    return new BuildOrchestrator(
        buildCatalog(),
        store,
        new VariableResolver(),
        new DependencyRuleParser(json),
        new DependencyChecker(),
        templateEngine(),
        composeMerger(),
        composeLinter(),
        packager(store),
        clock,
        metrics);
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.flush();
      otel.close();
    }
  }
}
