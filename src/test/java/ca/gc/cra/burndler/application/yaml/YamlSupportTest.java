package ca.gc.cra.burndler.application.yaml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.domain.compose.ComposeNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class YamlSupportTest {
  private final YamlSupport yaml = new YamlSupport();

  @Test
  void plainScalarsResolveWithCoreSchema() {
    Map<?, ?> doc = (Map<?, ?>) yaml.parseMapping("""
        port: 2222:22
        date: 2024-01-15
        switch: on
        answer: yes
        mode: 0755
        count: 3
        ratio: 1.5
        enabled: true
        empty:
        """).toPlain();

    assertEquals("2222:22", doc.get("port"));
    assertEquals("2024-01-15", doc.get("date"));
    assertEquals("on", doc.get("switch"));
    assertEquals("yes", doc.get("answer"));
    assertEquals("0755", doc.get("mode"));
    assertEquals(3L, ((Number) doc.get("count")).longValue());
    assertEquals(1.5, ((Number) doc.get("ratio")).doubleValue());
    assertEquals(Boolean.TRUE, doc.get("enabled"));
    assertNull(doc.get("empty"));
  }

  @Test
  void dumpedStringsReadBackUnchanged() {
    Map<String, Object> plain = Map.of("ports", List.of("2222:22", "true", "12"));

    String text = yaml.dumpPlain(plain);

    assertTrue(text.contains("- 2222:22"));
    assertEquals(plain, yaml.parseMapping(text).toPlain());
  }

  @Test
  void emptyDocumentIsAnEmptyMapping() {
    assertTrue(yaml.parseMapping("").isEmpty());
  }

  @Test
  void nonMappingRootIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> yaml.parseMapping("- a\n- b\n"));
    assertThrows(IllegalArgumentException.class, () -> yaml.parse("key: [unclosed"));
  }

  @Test
  void parseReturnsNullNodeForBlankInput() {
    assertEquals(ComposeNode.NULL, yaml.parse(""));
  }
}
