package ca.gc.cra.burndler.application.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.domain.rules.DependencyRule;
import java.util.List;
import org.junit.jupiter.api.Test;

class DependencyRuleParserTest {
  private final DependencyRuleParser parser = new DependencyRuleParser(new JsonSupport());

  @Test
  void parsesRuleObjects() {
    List<DependencyRule> rules = parser.parse("""
        [{"type": "requires", "field": "tls", "target": "cert", "message": "need a cert"},
         {"type": "conflicts", "field": "a", "condition": "{{.x}} == 1", "target": "b"}]
        """);

    assertEquals(List.of(
        new DependencyRule("requires", "tls", "", "cert", "need a cert"),
        new DependencyRule("conflicts", "a", "{{.x}} == 1", "b", "")), rules);
  }

  @Test
  void blankTextMeansNoRules() {
    assertTrue(parser.parse("").isEmpty());
    assertTrue(parser.parse(null).isEmpty());
  }

  @Test
  void rejectsNonArrayAndMalformedJson() {
    assertThrows(IllegalArgumentException.class, () -> parser.parse("{\"type\": \"requires\"}"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("[1, 2]"));
    assertThrows(IllegalArgumentException.class, () -> parser.parse("[{"));
  }
}
