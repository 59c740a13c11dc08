package ca.gc.cra.burndler.logging;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Helpers that keep rendered content and secrets out of log lines.
 * <p><strong>Why:</strong> Rendered templates routinely contain generated passwords and connection strings.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String[] SECRET_MARKERS = {"password", "passwd", "secret", "token", "key"};

  private Logs() {
    // Utility
  }

  /**
   * Truncates a value to at most {@code maxChars} characters, noting the original length.
   *
   * @param value value to log; {@code null} yields {@code <null>}
   * @param maxChars positive limit
   * @return value or truncated prefix
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + value.getBytes(StandardCharsets.UTF_8).length
        + " bytes)";
  }

  /**
   * Returns {@code [REDACTED]} for keys that look like credentials, the value otherwise.
   *
   * @param key configuration or variable name
   * @param value value to log
   * @return loggable value
   */
  public static String redact(String key, String value) {
    if (key == null) {
      return REDACTED_PLACEHOLDER;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    for (String marker : SECRET_MARKERS) {
      if (lower.contains(marker)) {
        return REDACTED_PLACEHOLDER;
      }
    }
    return value;
  }

  /**
   * Applies {@link #redact(String, String)} to every entry; the result is sorted by key.
   *
   * @param values flat key/value map
   * @return loggable copy
   */
  public static Map<String, String> redact(Map<String, String> values) {
    Map<String, String> out = new TreeMap<>();
    values.forEach((k, v) -> out.put(k, redact(k, v)));
    return out;
  }
}
