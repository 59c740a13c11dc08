package ca.gc.cra.burndler.application.packaging;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds {@code env/.env.example} from the {@code ${VAR}} placeholders left in a compose document.
 *
 * <p>Each variable appears once, sorted by name. The value is the {@code ${VAR:-default}} default when any
 * occurrence declares one, otherwise {@value #PLACEHOLDER}.
 *
 * @since 0.1.0
 */
public final class EnvExampleGenerator {
  static final String PLACEHOLDER = "changeme";
  private static final Pattern VARIABLE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)(?::?-([^}]*))?}");
  private static final String HEADER = """
      # Burndler Environment Configuration
      # Copy to .env and update values
      """;

  /**
   * Generates the example file.
   *
   * @param compose compose document text
   * @return file content ending in a newline
   */
  public String generate(String compose) {
    Objects.requireNonNull(compose, "compose");
    Map<String, String> variables = new TreeMap<>();
    Matcher matcher = VARIABLE.matcher(compose);
    while (matcher.find()) {
      String name = matcher.group(1);
      String fallback = matcher.group(2);
      if (fallback != null && !fallback.isEmpty()) {
        variables.merge(name, fallback, (previous, next) -> PLACEHOLDER.equals(previous) ? next : previous);
      } else {
        variables.putIfAbsent(name, PLACEHOLDER);
      }
    }
    StringBuilder out = new StringBuilder(HEADER);
    if (!variables.isEmpty()) {
      out.append('\n');
    }
    variables.forEach((name, value) -> out.append(name).append('=').append(value).append('\n'));
    return out.toString();
  }
}
