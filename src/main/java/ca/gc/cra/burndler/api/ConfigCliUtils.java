package ca.gc.cra.burndler.api;

import ca.gc.cra.burndler.config.ConfigMerger;
import ca.gc.cra.burndler.config.DefaultsForMode;
import ca.gc.cra.burndler.config.YamlConfigLoader;
import ca.gc.cra.burndler.logging.Logs;
import ca.gc.cra.burndler.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared configuration flow of the subcommands: CLI arguments, optional {@code config=FILE}, defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI map
   * @return config path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Produces the effective configuration for a subcommand, logging and printing usage on failure.
   *
   * @param mode subcommand name
   * @param input parsed CLI input
   * @param usage one-line usage printed on argument errors
   * @param log caller's logger
   * @return effective configuration or the exit code to return
   */
  static Resolution resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return Resolution.failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return Resolution.failed(ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      TelemetryConfigurator.validate(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return Resolution.failed(ExitCode.INVALID_ARGS);
    }
    if (log.isDebugEnabled()) {
      log.debug("Effective {} configuration: {}", mode, Logs.redact(effective));
    }
    return new Resolution(effective, null);
  }

  /**
   * Reads a UTF-8 text file named by a configuration key.
   *
   * @param name configuration key, used in diagnostics
   * @param path file path
   * @return file content
   * @throws IllegalArgumentException when the file is missing or unreadable
   * @throws IOException when the file cannot be read
   */
  static String readText(String name, Path path) throws IOException {
    return Files.readString(Paths.requireReadableFile(name, path));
  }

  /**
   * Writes {@code content} to {@code out}, or to stdout when {@code out} is blank.
   *
   * @param out output path or blank
   * @param content text to write
   * @throws IOException when the file cannot be written
   */
  static void writeOutput(String out, String content) throws IOException {
    if (out == null || out.isBlank()) {
      CliPrinter.print(content);
      return;
    }
    Path target = Path.of(out.trim());
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(target, content);
  }

  /** Effective configuration, or the exit code when resolution failed. */
  record Resolution(Map<String, String> effective, ExitCode failure) {
    static Resolution failed(ExitCode code) {
      return new Resolution(Map.of(), code);
    }

    boolean ok() {
      return failure == null;
    }
  }
}
