package ca.gc.cra.burndler.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits raw CLI arguments into {@code key=value} pairs and the {@code --help} and {@code --verbose} flags.
 *
 * <p>Any other dash-prefixed argument is kept with the key/value arguments, where the argument parser rejects it.
 *
 * @since 0.1.0
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] keyValueArgs;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments; blank and {@code null} entries are skipped.
   *
   * @param args raw arguments, may be {@code null}
   * @return parsed input
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), help, verbose);
  }

  /** Arguments other than the help and verbose flags, in order. */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }
}
