package ca.gc.cra.burndler.application.yaml;

import ca.gc.cra.burndler.domain.compose.ComposeNode;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

/**
 * YAML codec for compose documents, backed by SnakeYAML.
 *
 * <p>Loading uses {@link SafeConstructor} so documents cannot instantiate arbitrary types. Plain scalars are
 * resolved with {@link CoreSchemaResolver}, so values such as {@code 2222:22}, {@code 2024-01-15} or {@code on}
 * stay strings. Dumping writes block style with two-space indentation and quotes any string that would
 * otherwise read back as another type.
 *
 * @since 0.1.0
 */
public final class YamlSupport {

  /**
   * Parses YAML text into a node tree.
   *
   * @param text YAML document
   * @return parsed tree; an empty document yields {@link ComposeNode#NULL}
   * @throws IllegalArgumentException when the text is not valid YAML
   */
  public ComposeNode parse(String text) {
    Objects.requireNonNull(text, "text");
    try {
      Object document = loader().load(text);
      return ComposeNode.fromPlain(document);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Invalid YAML: " + ex.getMessage(), ex);
    }
  }

  /**
   * Parses YAML text whose root must be a mapping.
   *
   * @param text YAML document
   * @return root mapping; an empty document yields an empty mapping
   * @throws IllegalArgumentException when the text is not valid YAML or its root is not a mapping
   */
  public ComposeNode.MappingNode parseMapping(String text) {
    ComposeNode root = parse(text);
    if (root instanceof ComposeNode.NullNode) {
      return ComposeNode.MappingNode.empty();
    }
    return root.asMapping()
        .orElseThrow(() -> new IllegalArgumentException("YAML root must be a mapping but was " + root.kind()));
  }

  /**
   * Serializes a node tree.
   *
   * @param node tree to write
   * @return YAML text ending in a newline
   */
  public String dump(ComposeNode node) {
    return dumpPlain(node.toPlain());
  }

  /**
   * Serializes plain maps, lists, and scalars with the compose dump settings.
   *
   * @param value plain value
   * @return YAML text ending in a newline
   */
  public String dumpPlain(Object value) {
    return dumper().dump(value);
  }

  private static Yaml loader() {
    LoaderOptions loading = new LoaderOptions();
    DumperOptions dumping = new DumperOptions();
    return new Yaml(new SafeConstructor(loading), new Representer(dumping), dumping, loading,
        new CoreSchemaResolver());
  }

  private static Yaml dumper() {
    DumperOptions options = new DumperOptions();
    options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    options.setIndent(2);
    options.setPrettyFlow(true);
    options.setSplitLines(false);
    LoaderOptions loading = new LoaderOptions();
    return new Yaml(new SafeConstructor(loading), new Representer(options), options, loading,
        new CoreSchemaResolver());
  }
}
