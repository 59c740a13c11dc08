package ca.gc.cra.burndler.application.rules;

/**
 * Raised when a rule condition is malformed or cannot be evaluated against the supplied values.
 *
 * @since 0.1.0
 */
public final class ConditionException extends Exception {
  private static final long serialVersionUID = 1L;

  public ConditionException(String message) {
    super(message);
  }
}
