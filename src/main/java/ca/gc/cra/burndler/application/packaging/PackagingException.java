package ca.gc.cra.burndler.application.packaging;

/**
 * Raised when an installer package cannot be assembled or uploaded.
 *
 * @since 0.1.0
 */
public final class PackagingException extends Exception {
  private static final long serialVersionUID = 1L;

  public PackagingException(String message, Throwable cause) {
    super(message, cause);
  }
}
