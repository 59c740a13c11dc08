package ca.gc.cra.burndler.application.compose;

import ca.gc.cra.burndler.domain.compose.ComposeNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces {@code ${NAME}} placeholders in string scalars.
 *
 * <p>Global variables take precedence over module variables. A placeholder naming neither stays verbatim,
 * including forms with defaults such as {@code ${NAME:-x}}; the linter reports what remains.
 *
 * @since 0.1.0
 */
public final class VariableSubstitutor {
  private final Map<String, String> global;
  private final Map<String, String> module;

  public VariableSubstitutor(Map<String, String> global, Map<String, String> module) {
    this.global = Objects.requireNonNull(global, "global");
    this.module = Objects.requireNonNull(module, "module");
  }

  /**
   * Substitutes placeholders in every string scalar of the tree; keys are left untouched.
   *
   * @param node tree to rewrite
   * @return rewritten tree
   */
  public ComposeNode apply(ComposeNode node) {
    if (node instanceof ComposeNode.StringNode s) {
      return new ComposeNode.StringNode(apply(s.value()));
    }
    if (node instanceof ComposeNode.MappingNode m) {
      Map<String, ComposeNode> out = new LinkedHashMap<>();
      m.entries().forEach((k, v) -> out.put(k, apply(v)));
      return ComposeNode.MappingNode.of(out);
    }
    if (node instanceof ComposeNode.SequenceNode seq) {
      List<ComposeNode> out = new ArrayList<>(seq.items().size());
      seq.items().forEach(item -> out.add(apply(item)));
      return ComposeNode.SequenceNode.of(out);
    }
    return node;
  }

  /**
   * Substitutes placeholders in a single string.
   *
   * @param text input text
   * @return text with every known placeholder replaced
   */
  public String apply(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int cursor = 0;
    while (true) {
      int start = text.indexOf("${", cursor);
      if (start < 0) {
        break;
      }
      int end = text.indexOf('}', start + 2);
      if (end < 0) {
        break;
      }
      String name = text.substring(start + 2, end);
      String replacement = lookup(name);
      out.append(text, cursor, start);
      if (replacement == null) {
        out.append(text, start, end + 1);
      } else {
        out.append(replacement);
      }
      cursor = end + 1;
    }
    out.append(text, cursor, text.length());
    return out.toString();
  }

  private String lookup(String name) {
    String value = global.get(name);
    return value != null ? value : module.get(name);
  }
}
