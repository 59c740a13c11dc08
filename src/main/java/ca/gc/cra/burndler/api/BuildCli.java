package ca.gc.cra.burndler.api;

import ca.gc.cra.burndler.application.pipeline.BuildOrchestrator;
import ca.gc.cra.burndler.config.BurndlerConfig;
import ca.gc.cra.burndler.config.CompositionRoot;
import ca.gc.cra.burndler.domain.build.BuildRecord;
import ca.gc.cra.burndler.domain.build.BuildStatus;
import ca.gc.cra.burndler.logging.LoggingConfigurator;
import ca.gc.cra.burndler.validation.Strings;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code burndler build}: runs the full build pipeline for one catalog target and uploads the package.
 *
 * @since 0.1.0
 */
public final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final String SUMMARY_USAGE =
      "usage: build catalog=FILE target=ID [buildId=ID] [storageRoot=DIR] [runtimeDir=DIR] "
          + "[graceSeconds=N] [packageVersion=V] [maxArtifactMiB=N] [config=FILE] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      Burndler build

      Usage:
        build catalog=catalog.yaml target=shop

      Required:
        catalog=FILE             YAML catalog of targets and configurations
        target=ID                Target to build

      Optional:
        buildId=ID               Build identifier (default random UUID)
        storageRoot=DIR          Artifact store root (default ./burndler-storage)
        maxArtifactMiB=N         Largest artifact the store accepts (default 1024)
        runtimeDir=DIR           Directory install.sh prepares (default /var/lib/burndler/resources)
        graceSeconds=N           Seconds install.sh waits before verifying (default 10)
        packageVersion=V         Manifest version (default 1.0.0)
        config=FILE              YAML configuration (common + build sections)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Notes:
        Build status is written to builds/<buildId>.json next to the catalog.
      """;

  private BuildCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("build", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.effective();

    String targetId;
    String buildId;
    BurndlerConfig config;
    try {
      targetId = Strings.requireIdentifier("target", effective.get("target"));
      String requested = effective.getOrDefault("buildId", "");
      buildId = requested.isBlank() ? UUID.randomUUID().toString() : Strings.requireIdentifier("buildId", requested);
      config = BurndlerConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid build arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      BuildOrchestrator orchestrator = root.buildOrchestrator();
      log.info("Starting build {} for target {} (storageRoot={})", buildId, targetId, config.storageRoot());
      BuildRecord record = orchestrator.execute(buildId, targetId);
      CliPrinter.printLines(
          "Build     : " + record.id(),
          "Target    : " + record.targetId(),
          "Status    : " + record.status());
      if (BuildStatus.COMPLETED.equals(record.status())) {
        CliPrinter.println("Package   : " + record.downloadUrl());
        return ExitCode.SUCCESS;
      }
      CliPrinter.println("Error     : " + record.error());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Build configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Build {} could not persist its status", buildId, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in build {}", buildId, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
