package ca.gc.cra.burndler.domain.rules;

/**
 * Violation reported by dependency checking.
 *
 * @param field field the violation is attributed to
 * @param message description
 * @param rule rule kind as written in the offending rule
 * @since 0.1.0
 */
public record ValidationError(String field, String message, String rule) {
  @Override
  public String toString() {
    return field + ": " + message + " (" + rule + ")";
  }
}
