package ca.gc.cra.burndler.config;

import java.util.Locale;

/**
 * Parsing helpers for flat configuration values.
 *
 * @since 0.1.0
 */
public final class ConfigValues {
  private ConfigValues() {
    // Utility
  }

  /**
   * Parses {@code true/false/yes/no/1/0}, case-insensitively.
   *
   * @param value raw value; blank yields {@code fallback}
   * @param fallback value used when {@code value} is blank
   * @return parsed flag
   * @throws IllegalArgumentException when the value is not a recognised boolean
   */
  public static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1" -> true;
      case "false", "no", "0" -> false;
      default -> throw new IllegalArgumentException("expected a boolean but got '" + value + "'");
    };
  }

  /**
   * Returns the trimmed value or an empty string.
   *
   * @param value raw value
   * @return trimmed text, never {@code null}
   */
  public static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
