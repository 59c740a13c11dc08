package ca.gc.cra.burndler.api;

import ca.gc.cra.burndler.application.compose.ComposeParseException;
import ca.gc.cra.burndler.config.BurndlerConfig;
import ca.gc.cra.burndler.config.CompositionRoot;
import ca.gc.cra.burndler.config.ConfigValues;
import ca.gc.cra.burndler.domain.compose.LintIssue;
import ca.gc.cra.burndler.domain.compose.LintResult;
import ca.gc.cra.burndler.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code burndler lint}: checks a compose document against the offline installer policy.
 *
 * <p>Exits {@link ExitCode#SUCCESS} when the document has no errors and {@link ExitCode#RUNTIME_FAILURE}
 * otherwise; warnings never change the exit code.
 *
 * @since 0.1.0
 */
public final class LintCli {
  private static final Logger log = LoggerFactory.getLogger(LintCli.class);
  private static final String SUMMARY_USAGE = "usage: lint in=FILE [strict=true|false] [config=FILE]";
  private static final String HELP_TEXT = """
      Burndler compose lint

      Usage:
        lint in=merged.yaml

      Required:
        in=FILE             Compose document to check

      Optional:
        strict=true|false   Accepted for compatibility; the rule set is the same (default true)
        config=FILE         YAML configuration (common + lint sections)
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private LintCli() {}

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
    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("lint", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.effective();

    try (CompositionRoot root = new CompositionRoot(BurndlerConfig.fromMap(effective))) {
      boolean strict = ConfigValues.parseBoolean(effective.get("strict"), true);
      String compose = ConfigCliUtils.readText("in", Path.of(effective.get("in").trim()));
      LintResult result = root.composeLinter().lint(compose, strict);
      for (LintIssue error : result.errors()) {
        CliPrinter.println("ERROR   " + error);
      }
      for (LintIssue warning : result.warnings()) {
        CliPrinter.println("WARNING " + warning);
      }
      CliPrinter.println(String.format("%s: %d errors, %d warnings",
          result.valid() ? "valid" : "invalid", result.errors().size(), result.warnings().size()));
      return result.valid() ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
    } catch (ComposeParseException ex) {
      log.error("Lint failed: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid lint arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read compose document", ex);
      return ExitCode.IO_ERROR;
    }
  }
}
