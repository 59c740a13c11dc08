package ca.gc.cra.burndler.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers for CLI arguments and catalog identifiers.
 * <p><strong>Why:</strong> Target ids and build ids end up in storage keys and file names, so they are
 * restricted before any adapter sees them.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is present, trimmed, and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    // strip() leaves control characters in place for the check below
    String trimmed = raw.strip();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Validates an identifier used in storage keys ({@code target}, {@code buildId}).
   *
   * @param name parameter name for diagnostics
   * @param value candidate identifier
   * @return trimmed identifier
   * @throws IllegalArgumentException if the identifier contains characters other than letters, digits, dot,
   *     underscore, or hyphen
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path segment"));
    }
    return sanitized;
  }

  /**
   * Ensures a value is non-blank printable ASCII no longer than {@code maxLength}.
   *
   * @param name parameter name for diagnostics
   * @param value candidate value
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is too long or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
