package ca.gc.cra.burndler.application.packaging;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.port.ArtifactStorePort;
import ca.gc.cra.burndler.application.port.ClockPort;
import ca.gc.cra.burndler.application.port.MetricsPort;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.domain.build.ImageInfo;
import ca.gc.cra.burndler.domain.build.PackageManifest;
import ca.gc.cra.burndler.domain.build.ResourceFile;
import ca.gc.cra.burndler.domain.compose.ComposeNode;
import ca.gc.cra.burndler.domain.compose.ComposeNode.MappingNode;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assembles the offline installer archive (gzip-compressed tar) and uploads it.
 * <p><strong>Why:</strong> Target hosts have no registry access, so the package carries the compose document,
 * an environment template, installer scripts, resources, and a manifest with checksums.</p>
 * <p><strong>Role:</strong> Application service behind the packaging build stage.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; safe to share.</p>
 * <p><strong>Observability:</strong> Emits {@code package.bytes}; logs the storage key at INFO.</p>
 *
 * <p>Entries are written in a fixed order: {@value #COMPOSE_PATH}, {@value #ENV_PATH}, {@value #INSTALL_PATH},
 * {@value #VERIFY_PATH}, the resources in request order, then {@value #MANIFEST_PATH}. Every entry carries the
 * clock's current time, so output is reproducible for a fixed clock and id.
 *
 * @since 0.1.0
 */
public final class Packager {
  private static final Logger log = LoggerFactory.getLogger(Packager.class);

  public static final String COMPOSE_PATH = "compose/docker-compose.yaml";
  public static final String ENV_PATH = "env/.env.example";
  public static final String INSTALL_PATH = "bin/install.sh";
  public static final String VERIFY_PATH = "bin/verify.sh";
  public static final String MANIFEST_PATH = "manifest.json";
  public static final String DEFAULT_VERSION = "1.0.0";

  private static final Set<String> FIXED_PATHS =
      Set.of(COMPOSE_PATH, ENV_PATH, INSTALL_PATH, VERIFY_PATH, MANIFEST_PATH);
  private static final int EXECUTABLE = 0755;
  private static final int REGULAR = 0644;

  private final ArtifactStorePort store;
  private final YamlSupport yaml;
  private final ManifestWriter manifestWriter;
  private final EnvExampleGenerator envExample;
  private final InstallerScripts scripts;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Supplier<String> ids;
  private final String version;

  public Packager(ArtifactStorePort store, ClockPort clock, MetricsPort metrics) {
    this(store, new YamlSupport(), new JsonSupport(), InstallerScripts.defaults(), clock, metrics,
        () -> UUID.randomUUID().toString(), DEFAULT_VERSION);
  }

  public Packager(
      ArtifactStorePort store,
      YamlSupport yaml,
      JsonSupport json,
      InstallerScripts scripts,
      ClockPort clock,
      MetricsPort metrics,
      Supplier<String> ids,
      String version) {
    this.store = Objects.requireNonNull(store, "store");
    this.yaml = Objects.requireNonNull(yaml, "yaml");
    this.manifestWriter = new ManifestWriter(Objects.requireNonNull(json, "json"));
    this.envExample = new EnvExampleGenerator();
    this.scripts = Objects.requireNonNull(scripts, "scripts");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.version = Objects.requireNonNull(version, "version");
  }

  /**
   * Builds and uploads a package.
   *
   * @param request package contents
   * @return storage key, locator, and manifest
   * @throws IllegalArgumentException when a resource path is absolute, escapes the archive, repeats, or
   *     collides with a fixed entry
   * @throws PackagingException when the archive cannot be assembled or the upload fails
   */
  public PackageResult createPackage(PackageRequest request) throws PackagingException {
    Objects.requireNonNull(request, "request");
    validateResources(request.resources());

    String key = request.name() + "-" + ids.get() + ".tar.gz";
    Instant now = clock.now().truncatedTo(ChronoUnit.SECONDS);

    Map<String, byte[]> entries = new LinkedHashMap<>();
    entries.put(COMPOSE_PATH, utf8(request.compose()));
    entries.put(ENV_PATH, utf8(envExample.generate(request.compose())));
    entries.put(INSTALL_PATH, utf8(scripts.install()));
    entries.put(VERIFY_PATH, utf8(scripts.verify()));
    List<String> resourcePaths = new ArrayList<>();
    for (ResourceFile resource : request.resources()) {
      entries.put(resource.path(), resource.content());
      resourcePaths.add(resource.path());
    }

    Map<String, String> checksums = new LinkedHashMap<>();
    entries.forEach((path, content) -> checksums.put(path, sha256(content)));
    PackageManifest manifest = new PackageManifest(request.name(), version, now.toString(),
        images(request.compose()), resourcePaths, checksums, request.downloadAssets());
    String manifestJson = manifestWriter.write(manifest);
    entries.put(MANIFEST_PATH, utf8(manifestJson));

    byte[] archive;
    try {
      archive = archive(entries, now);
    } catch (IOException ex) {
      throw new PackagingException("Failed to assemble package " + key, ex);
    }

    String locator;
    try {
      locator = store.upload(key, archive);
    } catch (IOException ex) {
      throw new PackagingException("Failed to upload package " + key, ex);
    }
    metrics.observe("package.bytes", archive.length);
    log.info("Uploaded package {} ({} bytes, {} entries)", key, archive.length, entries.size());
    return new PackageResult(key, locator, manifest, manifestJson, archive.length);
  }

  private static void validateResources(List<ResourceFile> resources) {
    Set<String> seen = new HashSet<>();
    for (ResourceFile resource : resources) {
      String path = resource.path();
      if (path.isBlank() || path.startsWith("/") || path.contains("\\")) {
        throw new IllegalArgumentException("Invalid resource path: " + path);
      }
      for (String segment : path.split("/")) {
        if (segment.equals("..") || segment.equals(".") || segment.isEmpty()) {
          throw new IllegalArgumentException("Invalid resource path: " + path);
        }
      }
      if (FIXED_PATHS.contains(path)) {
        throw new IllegalArgumentException("Resource path collides with a fixed package entry: " + path);
      }
      if (!seen.add(path)) {
        throw new IllegalArgumentException("Duplicate resource path: " + path);
      }
    }
  }

  private byte[] archive(Map<String, byte[]> entries, Instant modified) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    GzipParameters gzip = new GzipParameters();
    gzip.setModificationTime(modified.toEpochMilli());
    try (TarArchiveOutputStream tar =
        new TarArchiveOutputStream(new GzipCompressorOutputStream(buffer, gzip), StandardCharsets.UTF_8.name())) {
      tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
      tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
      for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
        TarArchiveEntry header = new TarArchiveEntry(entry.getKey());
        header.setSize(entry.getValue().length);
        header.setMode(executable(entry.getKey()) ? EXECUTABLE : REGULAR);
        header.setModTime(Date.from(modified));
        tar.putArchiveEntry(header);
        tar.write(entry.getValue());
        tar.closeArchiveEntry();
      }
      tar.finish();
    }
    return buffer.toByteArray();
  }

  private static boolean executable(String path) {
    return INSTALL_PATH.equals(path) || VERIFY_PATH.equals(path);
  }

  /** Images referenced by service {@code image} keys, in document order without repeats. */
  private List<ImageInfo> images(String compose) throws PackagingException {
    MappingNode root;
    try {
      root = yaml.parseMapping(compose);
    } catch (IllegalArgumentException ex) {
      throw new PackagingException("Failed to read images from compose document", ex);
    }
    Set<String> refs = new LinkedHashSet<>();
    root.mapping("services").ifPresent(services -> services.entries().values().forEach(service ->
        service.asMapping()
            .flatMap(m -> m.get("image"))
            .flatMap(ComposeNode::scalarText)
            .filter(ref -> !ref.isBlank())
            .ifPresent(refs::add)));
    List<ImageInfo> images = new ArrayList<>();
    for (String ref : refs) {
      images.add(imageInfo(ref));
    }
    return images;
  }

  static ImageInfo imageInfo(String reference) {
    String digest = "";
    String rest = reference;
    int at = rest.indexOf('@');
    if (at >= 0) {
      digest = rest.substring(at + 1);
      rest = rest.substring(0, at);
    }
    String tag = "latest";
    int colon = rest.lastIndexOf(':');
    if (colon > rest.lastIndexOf('/')) {
      tag = rest.substring(colon + 1);
      rest = rest.substring(0, colon);
    }
    String file = "images/" + rest.replace('/', '_') + "_" + tag + ".tar";
    return new ImageInfo(rest, tag, digest, file);
  }

  private static byte[] utf8(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  private static String sha256(byte[] content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available", ex);
    }
  }
}
