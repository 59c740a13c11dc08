package ca.gc.cra.burndler.application.template;

import java.util.Locale;

/**
 * Output formats understood by {@link TemplateEngine}.
 *
 * @since 0.1.0
 */
public enum TemplateFormat {
  /** Rendered output must parse as YAML and is re-serialized canonically. */
  YAML("YAML", true),
  /** Rendered output must parse as JSON and is re-serialized with two-space indentation. */
  JSON("JSON", true),
  /** Rendered output is returned verbatim. */
  ENV("ENV", false),
  /** Rendered output is returned verbatim. */
  TEXT("TEXT", false);

  private final String displayName;
  private final boolean structured;

  TemplateFormat(String displayName, boolean structured) {
    this.displayName = displayName;
    this.structured = structured;
  }

  public String displayName() {
    return displayName;
  }

  /** Whether rendered output is validated and re-serialized. */
  public boolean structured() {
    return structured;
  }

  /**
   * Resolves a format name.
   *
   * @param name {@code yaml}, {@code json}, {@code env}, or {@code text}
   * @return matching format
   * @throws IllegalArgumentException for any other name
   */
  public static TemplateFormat fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("unsupported template format: null");
    }
    return switch (name) {
      case "yaml" -> YAML;
      case "json" -> JSON;
      case "env" -> ENV;
      case "text" -> TEXT;
      default -> throw new IllegalArgumentException("unsupported template format: " + name);
    };
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
