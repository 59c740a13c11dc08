package ca.gc.cra.burndler.application.template;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Renders configuration templates against a variable tree.
 * <p><strong>Why:</strong> Configuration files ship as templates so one configuration can serve many build
 * targets.</p>
 * <p><strong>Role:</strong> Application service behind the template-render build stage and the {@code render}
 * CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share when the injected {@link TemplateFunctions} is.</p>
 *
 * <p>YAML and JSON output is parsed after rendering and re-serialized with sorted mapping keys. ENV and TEXT
 * output is returned as rendered.
 *
 * @since 0.1.0
 */
public final class TemplateEngine {
  private static final Logger log = LoggerFactory.getLogger(TemplateEngine.class);
  private static final Comparator<Object> KEY_ORDER = Comparator.comparing(String::valueOf);

  private final TemplateFunctions functions;
  private final YamlSupport yaml;
  private final JsonSupport json;

  public TemplateEngine() {
    this(TemplateFunctions.standard(), new YamlSupport(), new JsonSupport());
  }

  public TemplateEngine(TemplateFunctions functions, YamlSupport yaml, JsonSupport json) {
    this.functions = Objects.requireNonNull(functions, "functions");
    this.yaml = Objects.requireNonNull(yaml, "yaml");
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Renders a template.
   *
   * @param content template text
   * @param format format name ({@code yaml}, {@code json}, {@code env}, {@code text})
   * @param variables variable tree; {@code null} is treated as empty
   * @return rendered text
   * @throws IllegalArgumentException when the format name is unknown
   * @throws TemplateException when parsing, execution, or structure validation fails
   */
  public String render(String content, String format, Map<String, Object> variables) throws TemplateException {
    return render(content, TemplateFormat.fromName(format), variables);
  }

  /**
   * Renders a template.
   *
   * @param content template text
   * @param format output format
   * @param variables variable tree; {@code null} is treated as empty
   * @return rendered text
   * @throws TemplateException when parsing, execution, or structure validation fails
   */
  public String render(String content, TemplateFormat format, Map<String, Object> variables)
      throws TemplateException {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(format, "format");
    Map<String, Object> root = variables == null ? Map.of() : variables;

    List<TemplateNode> nodes = new TemplateParser(functions).parse(content);
    String rendered = new TemplateExecutor(functions).execute(nodes, root);
    log.debug("Rendered {} template ({} chars)", format.wireName(), rendered.length());

    return switch (format) {
      case YAML -> normalizeYaml(rendered);
      case JSON -> normalizeJson(rendered);
      case ENV, TEXT -> rendered;
    };
  }

  private String normalizeYaml(String rendered) throws TemplateStructureException {
    Object document;
    try {
      document = yaml.parse(rendered).toPlain();
    } catch (IllegalArgumentException ex) {
      throw new TemplateStructureException(TemplateFormat.YAML, ex.getMessage(), ex);
    }
    if (document == null) {
      return "";
    }
    return yaml.dumpPlain(canonical(document));
  }

  private String normalizeJson(String rendered) throws TemplateStructureException {
    if (rendered.isBlank()) {
      throw new TemplateStructureException(TemplateFormat.JSON, "empty document", null);
    }
    Object document;
    try {
      document = json.parse(rendered);
    } catch (IllegalArgumentException ex) {
      throw new TemplateStructureException(TemplateFormat.JSON, ex.getMessage(), ex);
    }
    return json.writePretty(canonical(document));
  }

  /** Copies a plain tree with every mapping re-keyed in sorted order. */
  private static Object canonical(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> sorted = new TreeMap<>(KEY_ORDER);
      map.forEach((k, v) -> sorted.put(k, canonical(v)));
      return sorted;
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>(list.size());
      list.forEach(item -> copy.add(canonical(item)));
      return copy;
    }
    return value;
  }
}
