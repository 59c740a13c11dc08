package ca.gc.cra.burndler.application.rules;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.domain.rules.DependencyRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads dependency rules from their JSON array form:
 * {@code [{"type":"requires","field":"a","condition":"","target":"b","message":""}]}.
 *
 * @since 0.1.0
 */
public final class DependencyRuleParser {
  private final JsonSupport json;

  public DependencyRuleParser(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Parses a rule array.
   *
   * @param text JSON array; {@code null} or blank yields no rules
   * @return rules in declaration order
   * @throws IllegalArgumentException when the text is not a JSON array of objects
   */
  public List<DependencyRule> parse(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    Object parsed = json.parse(text);
    if (!(parsed instanceof List<?> items)) {
      throw new IllegalArgumentException("dependency rules must be a JSON array");
    }
    List<DependencyRule> rules = new ArrayList<>(items.size());
    for (Object item : items) {
      if (!(item instanceof Map<?, ?> map)) {
        throw new IllegalArgumentException("dependency rule must be a JSON object but was " + item);
      }
      rules.add(new DependencyRule(
          text(map, "type"),
          text(map, "field"),
          text(map, "condition"),
          text(map, "target"),
          text(map, "message")));
    }
    return rules;
  }

  private static String text(Map<?, ?> map, String key) {
    Object value = map.get(key);
    return value == null ? null : value.toString();
  }
}
