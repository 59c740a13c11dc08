package ca.gc.cra.burndler.api;

/**
 * Process exit codes shared by all Burndler subcommands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command finished; for {@code lint} the document is valid, for {@code build} the build completed. */
  SUCCESS(0),
  /** Arguments or configuration keys were malformed. */
  INVALID_ARGS(2),
  /** An input could not be read or an output could not be written. */
  IO_ERROR(3),
  /** Input documents were structurally invalid (unparseable compose, catalog, or variables). */
  CONFIG_ERROR(4),
  /** Lint errors, a failed build, or a template that did not render. */
  RUNTIME_FAILURE(5),
  /** The command was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
