package ca.gc.cra.burndler.api;

import ca.gc.cra.burndler.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point dispatching to the Burndler subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: burndler <merge|lint|render|build> [options]";
  private static final String HELP_TEXT = """
      Burndler offline installer builder

      Usage:
        burndler <command> [key=value ...]

      Commands:
        merge     Namespace and merge compose files (merge --help for details)
        lint      Check a compose document for offline installation
        render    Render a configuration template
        build     Build and package a catalog target

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    String[] raw = args == null ? new String[0] : args;
    int commandIndex = firstCommand(raw);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(raw);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = raw[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(raw, commandIndex + 1, raw.length);
    if (CliInput.parse(Arrays.copyOfRange(raw, 0, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
      delegateArgs = append(delegateArgs, "--verbose");
    }
    return switch (command) {
      case "merge" -> MergeCli.run(delegateArgs);
      case "lint" -> LintCli.run(delegateArgs);
      case "render" -> RenderCli.run(delegateArgs);
      case "build" -> BuildCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  /** Index of the first argument that is neither a flag nor {@code key=value}; -1 when there is none. */
  private static int firstCommand(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }

  private static String[] append(String[] args, String extra) {
    String[] out = Arrays.copyOf(args, args.length + 1);
    out[args.length] = extra;
    return out;
  }
}
