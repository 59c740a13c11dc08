package ca.gc.cra.burndler.validation;

/**
 * Numeric range checks for configuration values such as {@code graceSeconds} and {@code maxArtifactMiB}.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name for diagnostics; {@code "value"} when blank
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return the value
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer configuration value and checks its range.
   *
   * @param name parameter name for diagnostics
   * @param raw text value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if the text is not an integer or lies outside the range
   */
  public static int parseInt(String name, String raw, int min, int max) {
    int value;
    try {
      value = Integer.parseInt(raw == null ? "" : raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + raw + "')", ex);
    }
    return (int) requireRange(name, value, min, max);
  }
}
