package ca.gc.cra.burndler.application.compose;

/**
 * Raised when a compose fragment is not a YAML mapping document.
 *
 * @since 0.1.0
 */
public final class ComposeParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ComposeParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
