package ca.gc.cra.burndler.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("build");
    Map<String, String> yaml = Map.of("catalog", "/etc/burndler/catalog.yaml", "target", "shop",
        "graceSeconds", "30");
    Map<String, String> cli = Map.of("target", "billing", "buildId", "b-7");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "build",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("billing", merged.get("target"));
    assertEquals("30", merged.get("graceSeconds"));
    assertEquals("b-7", merged.get("buildId"));
    assertEquals("1024", merged.get("maxArtifactMiB"));
    assertEquals(List.of("CLI overrides YAML for key: target"), warnings);
  }

  @Test
  void fileModesRequireInput() {
    for (String mode : List.of("merge", "lint", "render")) {
      IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
          () -> ConfigMerger.buildEffectiveConfig(
              mode, Optional.empty(), Map.of(), DefaultsForMode.asFlatMap(mode), msg -> {}));
      assertEquals("in is required for " + mode, ex.getMessage());
    }
  }

  @Test
  void buildRequiresCatalogAndTarget() {
    IllegalArgumentException missingCatalog = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "build", Optional.empty(), Map.of("target", "shop"), DefaultsForMode.asFlatMap("build"), msg -> {}));
    assertEquals("catalog is required for build", missingCatalog.getMessage());

    IllegalArgumentException missingTarget = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "build", Optional.of(Map.of("catalog", "c.yaml")), Map.of(),
            DefaultsForMode.asFlatMap("build"), msg -> {}));
    assertTrue(missingTarget.getMessage().startsWith("target is required"));
  }

  @Test
  void yamlOverridesDefaultsWithoutWarning() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "lint", Optional.of(Map.of("in", "merged.yaml", "strict", "false")), Map.of(),
        DefaultsForMode.asFlatMap("lint"), warnings::add);

    assertEquals("merged.yaml", merged.get("in"));
    assertEquals("false", merged.get("strict"));
    assertTrue(warnings.isEmpty());
  }
}
