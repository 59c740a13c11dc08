package ca.gc.cra.burndler.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.packaging.InstallerScripts;
import ca.gc.cra.burndler.application.packaging.Packager;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.domain.build.AssetStorage;
import ca.gc.cra.burndler.domain.build.BuildMember;
import ca.gc.cra.burndler.domain.build.BuildRecord;
import ca.gc.cra.burndler.domain.build.BuildStage;
import ca.gc.cra.burndler.domain.build.BuildStatus;
import ca.gc.cra.burndler.domain.build.BuildTarget;
import ca.gc.cra.burndler.domain.build.Configuration;
import ca.gc.cra.burndler.domain.build.ConfigurationAsset;
import ca.gc.cra.burndler.domain.build.ConfigurationFile;
import ca.gc.cra.burndler.domain.build.FileKind;
import ca.gc.cra.burndler.testing.FixedClock;
import ca.gc.cra.burndler.testing.InMemoryArtifactStore;
import ca.gc.cra.burndler.testing.InMemoryBuildRecordStore;
import ca.gc.cra.burndler.testing.RecordingMetricsPort;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BuildOrchestratorTest {
  private static final String WEB_COMPOSE = """
      services:
        web:
          image: ${REGISTRY}/web:${TAG}
          ports:
            - "${PORT}:80"
      """;

  private final InMemoryBuildRecordStore records = new InMemoryBuildRecordStore();
  private final InMemoryArtifactStore store = new InMemoryArtifactStore();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final FixedClock clock = new FixedClock();
  private final JsonSupport json = new JsonSupport();
  private final BuildOrchestrator orchestrator = new BuildOrchestrator(records, store,
      new Packager(store, new YamlSupport(), json, InstallerScripts.defaults(), clock, metrics, () -> "pkg", "1.0.0"),
      clock, metrics);

  private static BuildTarget target(boolean active, List<BuildMember> members) {
    return new BuildTarget("t1", "shop", active, Map.of("REGISTRY", "registry.local"), members);
  }

  private static BuildMember web(String compose) {
    return new BuildMember("web", true, compose, "web-config", Map.of("PORT", 8081));
  }

  private static Configuration webConfig(String rules) {
    return new Configuration("web-config",
        Map.of("TAG", "1.0", "PORT", 8080),
        rules,
        List.of(
            new ConfigurationFile("conf/app.yaml", FileKind.TEMPLATE, "templates/app.yaml", "yaml"),
            new ConfigurationFile("/static/logo.txt", FileKind.STATIC, "static/logo.txt", null)),
        List.of(
            new ConfigurationAsset("data/seed.sql", AssetStorage.EMBEDDED, "assets/seed.sql", "", "", 0, ""),
            new ConfigurationAsset("models/big.bin", AssetStorage.DOWNLOAD, "models/big.bin", "", "sha256:aa", 2048,
                ""),
            new ConfigurationAsset("gpu.bin", AssetStorage.EMBEDDED, "assets/gpu.bin", "", "", 0,
                "{{.gpu}} == true")));
  }

  private void seedStore() {
    store.put("templates/app.yaml", "port: {{ .PORT }}\nname: {{ .SERVICE_NAME }}\n");
    store.put("static/logo.txt", "LOGO");
    store.put("assets/seed.sql", "create table t(id int);");
  }

  @Test
  void completesAllStagesAndRecordsPackage() throws Exception {
    records.add(target(true, List.of(web(WEB_COMPOSE),
        new BuildMember("legacy", false, "services: {old: {build: .}}", null, Map.of()))));
    records.add(webConfig(""));
    seedStore();

    BuildRecord result = orchestrator.execute("b1", "t1");

    assertEquals(BuildStatus.COMPLETED, result.status());
    assertNull(result.error());
    assertEquals("shop", result.name());
    assertEquals("t1", result.targetId());
    assertEquals("mem://shop-b1-pkg.tar.gz", result.downloadUrl());
    assertEquals(FixedClock.DEFAULT, result.createdAt());
    assertEquals(FixedClock.DEFAULT, result.completedAt());
    assertTrue(result.composeYaml().contains("shop_t1__web__web"), result.composeYaml());
    assertTrue(result.composeYaml().contains("registry.local/web:1.0"), result.composeYaml());
    assertTrue(result.composeYaml().contains("8081:80"), result.composeYaml());
    assertTrue(!result.composeYaml().contains("old"), result.composeYaml());
    assertNotNull(store.get("shop-b1-pkg.tar.gz"));

    @SuppressWarnings("unchecked")
    Map<String, Object> manifest = (Map<String, Object>) json.parse(result.manifestJson());
    assertEquals(List.of(
        "resources/shop_t1/web/conf/app.yaml",
        "resources/shop_t1/web/static/logo.txt",
        "resources/shop_t1/web/data/seed.sql"), manifest.get("resources"));
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> downloads = (List<Map<String, Object>>) manifest.get("download_assets");
    assertEquals(1, downloads.size());
    assertEquals("shop_t1/web/models/big.bin", downloads.get(0).get("path"));
    assertEquals("/api/v1/assets/download?path=models/big.bin", downloads.get(0).get("url"));

    assertEquals(1, metrics.count("build.started"));
    assertEquals(1, metrics.count("build.completed"));
    assertEquals(Arrays.stream(BuildStage.values())
        .map(stage -> "build.stage." + stage.id() + ".durationNanos")
        .toList(), metrics.observedKeys().stream().filter(key -> key.startsWith("build.stage.")).toList());
    assertEquals(1, metrics.observed("merge.modules").size());
    assertEquals(1, metrics.observed("package.bytes").size());
  }

  @Test
  void persistsEveryStageTransitionInOrder() throws Exception {
    records.add(target(true, List.of(web(WEB_COMPOSE))));
    records.add(webConfig(""));
    seedStore();

    orchestrator.execute("b1", "t1");

    List<String> statuses = records.saved().stream()
        .map(r -> r.status().value())
        .distinct()
        .toList();
    assertEquals(List.of(
        "queued",
        "building:validation",
        "building:configuration",
        "building:template_render",
        "building:asset_resolution",
        "building:compose_merge",
        "building:linting",
        "building:packaging",
        "completed"), statuses);
  }

  @Test
  void unknownTargetIsRecordedAsFailed() throws Exception {
    BuildRecord result = orchestrator.execute("b1", "missing");

    assertEquals(BuildStatus.FAILED, result.status());
    assertEquals("missing", result.name());
    assertEquals("failed to load target missing: build target not found: missing", result.error());
    assertEquals(List.of(result), records.saved());
    assertEquals(1, metrics.count("build.failed"));
  }

  @Test
  void inactiveTargetFailsValidation() throws Exception {
    records.add(target(false, List.of(web(WEB_COMPOSE))));

    BuildRecord result = orchestrator.execute("b1", "t1");

    assertEquals(BuildStatus.FAILED, result.status());
    assertEquals("service is not active", result.error());
    assertEquals(FixedClock.DEFAULT, result.completedAt());
    assertEquals(3, records.saved().size());
  }

  @Test
  void targetWithoutEnabledMembersFailsValidation() throws Exception {
    records.add(target(true, List.of(new BuildMember("web", false, WEB_COMPOSE, null, Map.of()))));

    assertEquals("service has no enabled containers", orchestrator.execute("b1", "t1").error());
  }

  @Test
  void dependencyViolationsFailConfiguration() throws Exception {
    records.add(new BuildTarget("t1", "shop", true, Map.of("tls", Map.of("enabled", true)),
        List.of(web(WEB_COMPOSE))));
    records.add(webConfig("[{\"type\": \"requires\", \"field\": \"tls.enabled\", \"target\": \"tls.cert\"}]"));
    seedStore();

    BuildRecord result = orchestrator.execute("b1", "t1");

    assertEquals(
        "dependency validation failed for container web: [tls.cert: tls.enabled requires tls.cert to be set"
            + " (requires)]",
        result.error());
    assertNull(result.composeYaml());
  }

  @Test
  void missingTemplateSourceFailsRendering() throws Exception {
    records.add(target(true, List.of(web(WEB_COMPOSE))));
    records.add(webConfig(""));

    BuildRecord result = orchestrator.execute("b1", "t1");

    assertEquals("failed to load template conf/app.yaml: artifact not found: templates/app.yaml", result.error());
  }

  @Test
  void lintErrorsFailTheBuildButKeepMergedCompose() throws Exception {
    String dangling = """
        services:
          web:
            image: nginx:1.25
            depends_on:
              - db
        """;
    records.add(target(true, List.of(new BuildMember("web", true, dangling, null, Map.of()))));

    BuildRecord result = orchestrator.execute("b1", "t1");

    assertEquals(BuildStatus.FAILED, result.status());
    assertEquals("compose validation failed with 1 errors", result.error());
    assertNotNull(result.composeYaml());
    assertNull(result.downloadUrl());
  }

  @Test
  void uploadFailureFailsPackaging() throws Exception {
    records.add(target(true, List.of(new BuildMember("web", true, "services:\n  web:\n    image: nginx:1.25\n",
        null, Map.of()))));
    store.failUploads();

    BuildRecord result = orchestrator.execute("b1", "t1");

    assertEquals("failed to create package: Failed to upload package shop-b1-pkg.tar.gz", result.error());
    assertEquals("building:packaging", records.saved().get(records.saved().size() - 2).status().value());
  }

  @Test
  void missingConfigurationIsSkipped() throws Exception {
    records.add(target(true, List.of(new BuildMember("web", true, "services:\n  web:\n    image: nginx:1.25\n",
        "nowhere", Map.of()))));

    assertEquals(BuildStatus.COMPLETED, orchestrator.execute("b1", "t1").status());
  }

  @Test
  void namespacedPathsDropLeadingSlashesAndDots() {
    BuildTarget target = target(true, List.of());
    BuildMember member = web("");

    assertEquals("shop_t1/web/etc/app.conf", BuildOrchestrator.namespaced(target, member, "/etc/app.conf"));
    assertEquals("shop_t1/web/app.conf", BuildOrchestrator.namespaced(target, member, "./app.conf"));
  }
}
