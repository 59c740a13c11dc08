package ca.gc.cra.burndler.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MergeCliTest {
  @TempDir Path tempDir;

  private final StringWriter buffer = new StringWriter();

  @BeforeEach
  void setUp() {
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void mergesModulesIntoOutputFile() throws IOException {
    Path web = Files.writeString(tempDir.resolve("web.yaml"), """
        services:
          app:
            image: registry.local/web:${WEB_TAG}
            depends_on: [cache]
          cache:
            image: redis:7
        """);
    Path db = Files.writeString(tempDir.resolve("db.yml"), """
        services:
          app:
            image: postgres:16
        """);
    Path vars = Files.writeString(tempDir.resolve("vars.yaml"), "WEB_TAG: \"2.1\"\n");
    Path out = tempDir.resolve("out/merged.yaml");

    ExitCode code = MergeCli.run(new String[] {
        "in=" + web + "," + db,
        "vars=" + vars,
        "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    String merged = Files.readString(out);
    assertTrue(merged.contains("web__app"), merged);
    assertTrue(merged.contains("web__cache"), merged);
    assertTrue(merged.contains("db__app"), merged);
    assertTrue(merged.contains("registry.local/web:2.1"), merged);
    assertFalse(merged.contains("${WEB_TAG}"), merged);
    assertEquals("", buffer.toString());
  }

  @Test
  void writesToStdoutWithoutOutArgument() throws IOException {
    Path web = Files.writeString(tempDir.resolve("web.yaml"), "services:\n  app:\n    image: nginx:1.25\n");

    assertEquals(ExitCode.SUCCESS, MergeCli.run(new String[] {"in=" + web}));
    assertTrue(buffer.toString().contains("web__app"));
  }

  @Test
  void missingInputFileIsAnArgumentError() {
    ExitCode code = MergeCli.run(new String[] {"in=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: merge"));
  }

  @Test
  void moduleNameDropsExtension() {
    assertEquals("web", MergeCli.moduleName(Path.of("compose/web.yaml")));
    assertEquals("db.prod", MergeCli.moduleName(Path.of("db.prod.yml")));
    assertEquals("Makefile", MergeCli.moduleName(Path.of("Makefile")));
  }
}
