package ca.gc.cra.burndler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void buildDefaultsIncludeStorageAndInstallerSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("build");

    assertEquals("./burndler-storage", defaults.get("storageRoot"));
    assertEquals("1024", defaults.get("maxArtifactMiB"));
    assertEquals("/var/lib/burndler/resources", defaults.get("runtimeDir"));
    assertEquals("10", defaults.get("graceSeconds"));
    assertEquals("1.0.0", defaults.get("packageVersion"));
    assertEquals("", defaults.get("catalog"));
  }

  @Test
  void everyModeSharesCommonDefaults() {
    for (String mode : new String[] {"merge", "lint", "render", "BUILD"}) {
      Map<String, String> defaults = DefaultsForMode.asFlatMap(mode);
      assertEquals("none", defaults.get("metricsExporter"), mode);
      assertEquals("false", defaults.get("verbose"), mode);
      assertTrue(defaults.containsKey("otelEndpoint"), mode);
    }
  }

  @Test
  void renderDefaultsToTextFormat() {
    assertEquals("text", DefaultsForMode.asFlatMap("render").get("format"));
    assertEquals("true", DefaultsForMode.asFlatMap("lint").get("strict"));
  }

  @Test
  void unknownModeIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> DefaultsForMode.asFlatMap("deploy"));
    assertEquals("Unsupported mode: deploy", ex.getMessage());
  }
}
