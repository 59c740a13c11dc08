package ca.gc.cra.burndler.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void parsesIntoMapsListsAndScalars() {
    Object parsed = json.parse("{\"name\": \"shop\", \"replicas\": 3, \"ratio\": 0.5, \"tags\": [\"a\", null],"
        + " \"on\": true}");

    Map<String, Object> expected = new LinkedHashMap<>();
    expected.put("name", "shop");
    expected.put("replicas", 3);
    expected.put("ratio", 0.5);
    expected.put("tags", Arrays.asList("a", null));
    expected.put("on", true);
    assertEquals(expected, parsed);
  }

  @Test
  void emptyDocumentIsEmptyMap() {
    assertEquals(Map.of(), json.parse("   "));
  }

  @Test
  void rejectsMalformedAndTrailingContent() {
    assertThrows(IllegalArgumentException.class, () -> json.parse("{\"a\": "));
    assertThrows(IllegalArgumentException.class, () -> json.parse("{} {}"));
  }

  @Test
  void writesCompactAndPretty() {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("id", "b1");
    doc.put("files", List.of(1, 2));

    assertEquals("{\"id\":\"b1\",\"files\":[1,2]}", json.writeCompact(doc));
    String pretty = json.writePretty(doc);
    assertTrue(pretty.startsWith("{\n  \"id\": \"b1\","), pretty);
    assertEquals(doc, json.parse(pretty));
  }

  @Test
  void rejectsUnsupportedValueTypes() {
    assertThrows(IllegalArgumentException.class, () -> json.writeCompact(Map.of("x", new Object())));
  }
}
