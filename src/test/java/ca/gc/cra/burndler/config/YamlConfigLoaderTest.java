package ca.gc.cra.burndler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void modeSectionOverlaysCommonAndNestedKeysFlatten() throws IOException {
    Path file = tempDir.resolve("burndler.yaml");
    Files.writeString(file, """
        common:
          metricsExporter: otlp
          verbose: true
        build:
          metricsExporter: none
          catalog: /etc/burndler/catalog.yaml
          graceSeconds: 30
          otel:
            endpoint: http://collector:4317
        lint:
          strict: false
        """);

    Map<String, String> config = YamlConfigLoader.load(file, "build").orElseThrow();

    assertEquals("none", config.get("metricsExporter"));
    assertEquals("true", config.get("verbose"));
    assertEquals("/etc/burndler/catalog.yaml", config.get("catalog"));
    assertEquals("30", config.get("graceSeconds"));
    assertEquals("http://collector:4317", config.get("otel.endpoint"));
    assertTrue(!config.containsKey("strict"));
  }

  @Test
  void missingFileYieldsEmpty() throws IOException {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "lint"));
  }

  @Test
  void emptyFileYieldsEmptyMap() throws IOException {
    Path file = Files.writeString(tempDir.resolve("empty.yaml"), "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(file, "merge"));
  }

  @Test
  void listsAreRejected() throws IOException {
    Path file = Files.writeString(tempDir.resolve("list.yaml"), "merge:\n  in: [a.yaml, b.yaml]\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> YamlConfigLoader.load(file, "merge"));
    assertEquals("YAML lists are not supported for key in", ex.getMessage());
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path file = Files.writeString(tempDir.resolve("bad.yaml"), "common: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "merge"));
  }
}
