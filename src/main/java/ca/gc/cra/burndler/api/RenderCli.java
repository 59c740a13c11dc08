package ca.gc.cra.burndler.api;

import ca.gc.cra.burndler.application.template.TemplateException;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.config.BurndlerConfig;
import ca.gc.cra.burndler.config.CompositionRoot;
import ca.gc.cra.burndler.logging.LoggingConfigurator;
import ca.gc.cra.burndler.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code burndler render}: renders one template file with variables from a YAML file.
 *
 * @since 0.1.0
 */
public final class RenderCli {
  private static final Logger log = LoggerFactory.getLogger(RenderCli.class);
  private static final String SUMMARY_USAGE =
      "usage: render in=FILE [format=yaml|json|env|text] [vars=FILE] [out=FILE] [config=FILE]";
  private static final String HELP_TEXT = """
      Burndler template render

      Usage:
        render in=app.yaml.tpl format=yaml vars=vars.yaml

      Required:
        in=FILE             Template source

      Optional:
        format=FORMAT       yaml, json, env, or text (default text); yaml/json output is validated and normalized
        vars=FILE           YAML mapping used as the template root
        out=FILE            Write the result here (default stdout)
        config=FILE         YAML configuration (common + render sections)
        --verbose           Enable DEBUG logging
        --help              Show this message
      """;

  private RenderCli() {}

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
    ConfigCliUtils.Resolution resolution = ConfigCliUtils.resolve("render", input, SUMMARY_USAGE, log);
    if (!resolution.ok()) {
      return resolution.failure();
    }
    Map<String, String> effective = resolution.effective();

    try (CompositionRoot root = new CompositionRoot(BurndlerConfig.fromMap(effective))) {
      String template = ConfigCliUtils.readText("in", Path.of(effective.get("in").trim()));
      Map<String, Object> variables = Map.of();
      String vars = effective.getOrDefault("vars", "");
      if (!vars.isBlank()) {
        variables = loadVariables(new YamlSupport(), Path.of(vars.trim()));
      }
      String rendered = root.templateEngine().render(template, effective.get("format"), variables);
      log.debug("Rendered {}", Logs.truncate(rendered, 256));
      ConfigCliUtils.writeOutput(effective.get("out"), rendered);
      return ExitCode.SUCCESS;
    } catch (TemplateException ex) {
      log.error("Render failed: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid render arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Render I/O failure", ex);
      return ExitCode.IO_ERROR;
    }
  }

  /**
   * Loads a YAML mapping of variables; an empty file yields an empty map.
   *
   * @param yaml YAML codec
   * @param path variables file
   * @return variables as plain maps, lists, and scalars
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping
   */
  static Map<String, Object> loadVariables(YamlSupport yaml, Path path) throws IOException {
    String text = ConfigCliUtils.readText("vars", path);
    if (text.isBlank()) {
      return Map.of();
    }
    Map<String, Object> variables = new LinkedHashMap<>();
    yaml.parseMapping(text).entries().forEach((key, value) -> variables.put(key, value.toPlain()));
    return variables;
  }
}
