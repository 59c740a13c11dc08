package ca.gc.cra.burndler.application.yaml;

import java.util.regex.Pattern;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Implicit scalar resolution limited to the YAML 1.2 core schema.
 *
 * <p>SnakeYAML's default resolver follows YAML 1.1, which reads {@code 2222:22} as a base-60 integer,
 * {@code 2024-01-15} as a timestamp and {@code yes}/{@code on} as booleans. Compose files are written for
 * YAML 1.2 readers, so those scalars resolve to strings here. Integers with a leading zero also stay strings.
 *
 * @since 0.1.0
 */
final class CoreSchemaResolver extends Resolver {
  static final Pattern CORE_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");
  static final Pattern CORE_INT = Pattern.compile("^[-+]?(?:0|[1-9][0-9]*)$");
  static final Pattern CORE_FLOAT = Pattern.compile(
      "^(?:[-+]?(?:[0-9]+\\.[0-9]*|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?"
          + "|[-+]?[0-9]+[eE][-+]?[0-9]+"
          + "|[-+]?\\.(?:inf|Inf|INF)"
          + "|\\.(?:nan|NaN|NAN))$");

  @Override
  protected void addImplicitResolvers() {
    addImplicitResolver(Tag.BOOL, CORE_BOOL, "tTfF");
    addImplicitResolver(Tag.INT, CORE_INT, "-+0123456789");
    addImplicitResolver(Tag.FLOAT, CORE_FLOAT, "-+0123456789.");
    addImplicitResolver(Tag.MERGE, MERGE, "<");
    addImplicitResolver(Tag.NULL, NULL, "~nN\0");
    addImplicitResolver(Tag.NULL, EMPTY, null);
    addImplicitResolver(Tag.YAML, YAML, "!&*");
  }
}
