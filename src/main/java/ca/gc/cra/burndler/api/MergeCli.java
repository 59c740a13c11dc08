package ca.gc.cra.burndler.api;

import ca.gc.cra.burndler.application.compose.ComposeParseException;
import ca.gc.cra.burndler.application.pipeline.VariableResolver;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.config.BurndlerConfig;
import ca.gc.cra.burndler.config.CompositionRoot;
import ca.gc.cra.burndler.domain.compose.MergeResult;
import ca.gc.cra.burndler.domain.compose.Module;
import ca.gc.cra.burndler.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code burndler merge}: namespaces and merges compose files into one document.
 *
 * @since 0.1.0
 */
public final class MergeCli {
  private static final Logger log = LoggerFactory.getLogger(MergeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: merge in=FILE[,FILE...] [out=FILE] [vars=FILE] [config=FILE] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      Burndler compose merge

      Usage:
        merge in=web.yaml,db.yaml out=merged.yaml

      Required:
        in=FILE[,FILE...]   Compose files; each file is a module named after its base name

      Optional:
        out=FILE            Write the merged document here (default stdout)
        vars=FILE           YAML mapping of global variables substituted into every module
        config=FILE         YAML configuration (common + merge sections)
        --verbose           Enable DEBUG logging
        --help              Show this message

      Notes:
        Services, networks, and volumes are renamed <module>__<name>; port collisions are reported as warnings.
      """;

  private MergeCli() {}

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
    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("merge", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.effective();

    try (CompositionRoot root = new CompositionRoot(BurndlerConfig.fromMap(effective))) {
      List<Module> modules = new ArrayList<>();
      for (String file : effective.get("in").split(",")) {
        if (file.isBlank()) {
          continue;
        }
        Path path = Path.of(file.trim());
        modules.add(new Module(moduleName(path), ConfigCliUtils.readText("in", path)));
      }
      Map<String, String> globals = Map.of();
      String vars = effective.getOrDefault("vars", "");
      if (!vars.isBlank()) {
        globals = VariableResolver.flatten(RenderCli.loadVariables(new YamlSupport(), Path.of(vars.trim())));
      }
      MergeResult result = root.composeMerger().merge(modules, globals);
      result.warnings().forEach(log::warn);
      ConfigCliUtils.writeOutput(effective.get("out"), result.mergedCompose());
      log.info("Merged {} modules with {} warnings", modules.size(), result.warnings().size());
      return ExitCode.SUCCESS;
    } catch (ComposeParseException ex) {
      log.error("Merge failed: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid merge arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Merge I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in merge", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  /** File name without its last extension: {@code compose/web.yaml} is module {@code web}. */
  static String moduleName(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }
}
