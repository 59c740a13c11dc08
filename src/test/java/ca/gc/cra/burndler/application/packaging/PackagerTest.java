package ca.gc.cra.burndler.application.packaging;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.domain.build.DownloadAsset;
import ca.gc.cra.burndler.domain.build.ImageInfo;
import ca.gc.cra.burndler.domain.build.ResourceFile;
import ca.gc.cra.burndler.testing.FixedClock;
import ca.gc.cra.burndler.testing.InMemoryArtifactStore;
import ca.gc.cra.burndler.testing.RecordingMetricsPort;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.junit.jupiter.api.Test;

class PackagerTest {
  private static final String COMPOSE = """
      services:
        web:
          image: registry.local/team/web:1.4
          environment:
            DB_PASSWORD: ${DB_PASSWORD}
        worker:
          image: registry.local/team/web:1.4
        cache:
          image: redis@sha256:abc123
      """;

  private final InMemoryArtifactStore store = new InMemoryArtifactStore();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonSupport json = new JsonSupport();
  private final Packager packager = new Packager(store, new YamlSupport(), json,
      new InstallerScripts("/opt/demo/", 3), new FixedClock(), metrics, () -> "0001", "2.0.0");

  private record Entry(int mode, Instant modified, byte[] content) {
    String text() {
      return new String(content, StandardCharsets.UTF_8);
    }
  }

  @Test
  void writesFixedEntriesInOrderWithModes() throws Exception {
    PackageRequest request = new PackageRequest("demo", COMPOSE,
        List.of(new ResourceFile("resources/app/config.yaml", "port: 80\n".getBytes(StandardCharsets.UTF_8))),
        List.of());

    PackageResult result = packager.createPackage(request);

    assertEquals("demo-0001.tar.gz", result.key());
    assertEquals("mem://demo-0001.tar.gz", result.locator());
    Map<String, Entry> entries = read(store.get(result.key()));
    assertEquals(List.of(
        "compose/docker-compose.yaml",
        "env/.env.example",
        "bin/install.sh",
        "bin/verify.sh",
        "resources/app/config.yaml",
        "manifest.json"), List.copyOf(entries.keySet()));
    assertEquals(0755, entries.get("bin/install.sh").mode() & 0777);
    assertEquals(0755, entries.get("bin/verify.sh").mode() & 0777);
    assertEquals(0644, entries.get("manifest.json").mode() & 0777);
    assertEquals(Instant.parse("2024-05-01T12:30:45Z"), entries.get("compose/docker-compose.yaml").modified());
    assertEquals(COMPOSE, entries.get("compose/docker-compose.yaml").text());
    assertTrue(entries.get("env/.env.example").text().contains("DB_PASSWORD=changeme"));
    assertTrue(entries.get("bin/install.sh").text().contains("mkdir -p /opt/demo\n"));
    assertTrue(entries.get("bin/install.sh").text().contains("sleep 3\n"));
    assertEquals(result.size(), store.get(result.key()).length);
    assertEquals(List.of((long) result.size()), metrics.observed("package.bytes"));
  }

  @Test
  void manifestListsImagesResourcesAndChecksums() throws Exception {
    byte[] config = "port: 80\n".getBytes(StandardCharsets.UTF_8);
    DownloadAsset model = new DownloadAsset("models/big.bin", "https://files.local/big.bin", "sha256:ff", 1024);
    PackageRequest request = new PackageRequest("demo", COMPOSE,
        List.of(new ResourceFile("resources/config.yaml", config)), List.of(model));

    PackageResult result = packager.createPackage(request);

    assertEquals(List.of(
        new ImageInfo("registry.local/team/web", "1.4", "", "images/registry.local_team_web_1.4.tar"),
        new ImageInfo("redis", "latest", "sha256:abc123", "images/redis_latest.tar")), result.manifest().images());
    assertEquals("2024-05-01T12:30:45Z", result.manifest().createdAt());
    assertEquals("2.0.0", result.manifest().version());
    assertEquals(List.of("resources/config.yaml"), result.manifest().resources());
    assertEquals(sha256(config), result.manifest().checksums().get("resources/config.yaml"));
    assertEquals(5, result.manifest().checksums().size());

    Map<String, Entry> entries = read(store.get(result.key()));
    assertEquals(result.manifestJson(), entries.get("manifest.json").text());
    @SuppressWarnings("unchecked")
    Map<String, Object> doc = (Map<String, Object>) json.parse(result.manifestJson());
    assertEquals("demo", doc.get("name"));
    @SuppressWarnings("unchecked")
    Map<String, Object> checksums = (Map<String, Object>) doc.get("checksums");
    assertEquals(sha256(entries.get("bin/verify.sh").content()), checksums.get("bin/verify.sh"));
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> downloads = (List<Map<String, Object>>) doc.get("download_assets");
    assertEquals("https://files.local/big.bin", downloads.get(0).get("url"));
    assertEquals(1024L, ((Number) downloads.get(0).get("size")).longValue());
  }

  @Test
  void archiveIsReproducibleForFixedClockAndId() throws Exception {
    PackageRequest request = new PackageRequest("demo", COMPOSE, List.of(), List.of());

    byte[] first = store.get(packager.createPackage(request).key()).clone();
    byte[] second = store.get(packager.createPackage(request).key());

    assertArrayEquals(first, second);
  }

  @Test
  void rejectsUnsafeOrCollidingResourcePaths() {
    byte[] data = new byte[] {1};
    for (String path : List.of("/etc/passwd", "../escape", "a//b", "a\\b", "manifest.json", "bin/install.sh")) {
      PackageRequest request = new PackageRequest("demo", COMPOSE, List.of(new ResourceFile(path, data)), List.of());
      assertThrows(IllegalArgumentException.class, () -> packager.createPackage(request), path);
    }
    PackageRequest duplicate = new PackageRequest("demo", COMPOSE,
        List.of(new ResourceFile("r/a", data), new ResourceFile("r/a", data)), List.of());
    assertThrows(IllegalArgumentException.class, () -> packager.createPackage(duplicate));
    assertTrue(store.objects().isEmpty());
  }

  @Test
  void uploadFailureIsAPackagingError() {
    store.failUploads();

    PackagingException ex = assertThrows(PackagingException.class,
        () -> packager.createPackage(new PackageRequest("demo", COMPOSE, List.of(), List.of())));

    assertEquals("Failed to upload package demo-0001.tar.gz", ex.getMessage());
    assertTrue(metrics.observed("package.bytes").isEmpty());
  }

  @Test
  void imageReferencesSplitIntoNameTagAndDigest() {
    assertEquals(new ImageInfo("localhost:5000/app", "latest", "", "images/localhost:5000_app_latest.tar"),
        Packager.imageInfo("localhost:5000/app"));
    assertEquals(new ImageInfo("nginx", "1.25", "sha256:00", "images/nginx_1.25.tar"),
        Packager.imageInfo("nginx:1.25@sha256:00"));
  }

  private static Map<String, Entry> read(byte[] archive) throws IOException {
    Map<String, Entry> entries = new LinkedHashMap<>();
    try (TarArchiveInputStream tar =
        new TarArchiveInputStream(new GzipCompressorInputStream(new ByteArrayInputStream(archive)))) {
      TarArchiveEntry entry;
      while ((entry = tar.getNextEntry()) != null) {
        entries.put(entry.getName(),
            new Entry(entry.getMode(), entry.getModTime().toInstant(), tar.readAllBytes()));
      }
    }
    return entries;
  }

  private static String sha256(byte[] content) throws Exception {
    return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
  }
}
