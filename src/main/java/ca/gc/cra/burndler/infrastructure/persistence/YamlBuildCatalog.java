package ca.gc.cra.burndler.infrastructure.persistence;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.application.port.BuildRecordPort;
import ca.gc.cra.burndler.domain.build.AssetStorage;
import ca.gc.cra.burndler.domain.build.BuildMember;
import ca.gc.cra.burndler.domain.build.BuildRecord;
import ca.gc.cra.burndler.domain.build.BuildTarget;
import ca.gc.cra.burndler.domain.build.Configuration;
import ca.gc.cra.burndler.domain.build.ConfigurationAsset;
import ca.gc.cra.burndler.domain.build.ConfigurationFile;
import ca.gc.cra.burndler.domain.build.FileKind;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> {@link BuildRecordPort} reading targets and configurations from a single YAML
 * catalog and writing build records as JSON files.
 * <p><strong>Why:</strong> Lets the {@code build} command run without a database on an offline build host.</p>
 * <p><strong>Role:</strong> Infrastructure adapter selected by the {@code catalog} configuration key.</p>
 * <p><strong>Thread-safety:</strong> The catalog is re-read on every lookup; record writes are synchronized and
 * replace the previous file atomically.</p>
 *
 * <p>Catalog layout:
 * <pre>{@code
 * targets:
 *   - id: shop
 *     name: webshop
 *     active: true
 *     variables: {REGION: ca-central}
 *     members:
 *       - name: web
 *         enabled: true
 *         composeFile: compose/web.yaml   # or inline "compose: |"
 *         configuration: web-config
 *         overrides: {replicas: 2}
 * configurations:
 *   - name: web-config
 *     variables: {port: 8080}
 *     dependencyRules: [{type: requires, field: tls, target: cert}]
 *     files: [{path: app.yaml, kind: template, storagePath: templates/app.yaml, format: yaml}]
 *     assets: [{path: model.bin, storage: download, storagePath: assets/model.bin, size: 42}]
 * }</pre>
 * Relative {@code composeFile} paths resolve against the catalog's directory. Build records land in
 * {@code builds/<id>.json} next to the catalog unless another directory is supplied.
 *
 * @since 0.1.0
 */
public final class YamlBuildCatalog implements BuildRecordPort {
  private static final Logger log = LoggerFactory.getLogger(YamlBuildCatalog.class);

  private final Path catalogFile;
  private final Path recordsDir;
  private final JsonSupport json;

  /**
   * Creates a catalog that stores records under {@code builds/} beside the catalog file.
   *
   * @param catalogFile YAML catalog
   */
  public YamlBuildCatalog(Path catalogFile) {
    this(catalogFile, baseDir(catalogFile).resolve("builds"), new JsonSupport());
  }

  /**
   * Creates a catalog with an explicit record directory.
   *
   * @param catalogFile YAML catalog
   * @param recordsDir directory for {@code <id>.json} build records; created on first save
   * @param json JSON codec for records and inline dependency rules
   */
  public YamlBuildCatalog(Path catalogFile, Path recordsDir, JsonSupport json) {
    this.catalogFile = Objects.requireNonNull(catalogFile, "catalogFile").toAbsolutePath().normalize();
    this.recordsDir = Objects.requireNonNull(recordsDir, "recordsDir");
    this.json = Objects.requireNonNull(json, "json");
  }

  @Override
  public BuildTarget loadTarget(String targetId) throws IOException {
    Objects.requireNonNull(targetId, "targetId");
    for (Map<String, Object> target : list(readCatalog(), "targets", "catalog")) {
      if (targetId.equals(text(target.get("id")))) {
        return toTarget(target);
      }
    }
    throw new IOException("build target not found: " + targetId);
  }

  @Override
  public Optional<Configuration> loadConfiguration(String name) throws IOException {
    Objects.requireNonNull(name, "name");
    for (Map<String, Object> configuration : list(readCatalog(), "configurations", "catalog")) {
      if (name.equals(text(configuration.get("name")))) {
        return Optional.of(toConfiguration(configuration));
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized void save(BuildRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("id", record.id());
    doc.put("name", record.name());
    doc.put("target_id", record.targetId());
    doc.put("status", record.status().value());
    doc.put("error", record.error());
    doc.put("compose_yaml", record.composeYaml());
    doc.put("manifest_json", record.manifestJson());
    doc.put("download_url", record.downloadUrl());
    doc.put("created_at", instant(record.createdAt()));
    doc.put("completed_at", instant(record.completedAt()));

    Files.createDirectories(recordsDir);
    Path target = recordsDir.resolve(record.id() + ".json");
    Path tmp = recordsDir.resolve(record.id() + ".json.tmp");
    Files.writeString(tmp, json.writePretty(doc) + "\n", StandardCharsets.UTF_8);
    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    log.debug("Build {} status {}", record.id(), record.status());
  }

  /** Directory build records are written to. */
  public Path recordsDir() {
    return recordsDir;
  }

  private Map<String, Object> readCatalog() throws IOException {
    try (Reader reader = Files.newBufferedReader(catalogFile, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Map.of();
      }
      return map(document, "catalog");
    } catch (YAMLException ex) {
      throw new IOException("failed to parse catalog " + catalogFile + ": " + ex.getMessage(), ex);
    }
  }

  private BuildTarget toTarget(Map<String, Object> raw) throws IOException {
    String id = text(raw.get("id"));
    String context = "target " + id;
    List<BuildMember> members = new ArrayList<>();
    for (Map<String, Object> member : list(raw, "members", context)) {
      members.add(toMember(member, context));
    }
    String name = text(raw.get("name"));
    return new BuildTarget(
        id,
        name == null ? id : name,
        bool(raw.get("active"), true),
        optionalMap(raw.get("variables"), context + " variables"),
        members);
  }

  private BuildMember toMember(Map<String, Object> raw, String parent) throws IOException {
    String name = text(raw.get("name"));
    if (name == null || name.isBlank()) {
      throw new IOException(parent + " has a member without a name");
    }
    String context = parent + " member " + name;
    String compose = text(raw.get("compose"));
    String composeFile = text(raw.get("composeFile"));
    if (composeFile != null && !composeFile.isBlank()) {
      if (compose != null && !compose.isBlank()) {
        throw new IOException(context + " declares both compose and composeFile");
      }
      Path file = baseDir(catalogFile).resolve(composeFile).normalize();
      compose = Files.readString(file, StandardCharsets.UTF_8);
    }
    return new BuildMember(
        name,
        bool(raw.get("enabled"), true),
        compose,
        text(raw.get("configuration")),
        optionalMap(raw.get("overrides"), context + " overrides"));
  }

  private Configuration toConfiguration(Map<String, Object> raw) throws IOException {
    String name = text(raw.get("name"));
    String context = "configuration " + name;
    List<ConfigurationFile> files = new ArrayList<>();
    for (Map<String, Object> file : list(raw, "files", context)) {
      String path = required(file, "path", context + " file");
      String kind = text(file.getOrDefault("kind", "template"));
      files.add(new ConfigurationFile(
          path,
          parseEnum(FileKind.class, kind, context + " file " + path + " kind"),
          required(file, "storagePath", context + " file " + path),
          text(file.get("format"))));
    }
    List<ConfigurationAsset> assets = new ArrayList<>();
    for (Map<String, Object> asset : list(raw, "assets", context)) {
      String path = required(asset, "path", context + " asset");
      String storage = text(asset.getOrDefault("storage", "embedded"));
      assets.add(new ConfigurationAsset(
          path,
          parseEnum(AssetStorage.class, storage, context + " asset " + path + " storage"),
          text(asset.get("storagePath")),
          text(asset.get("downloadUrl")),
          text(asset.get("checksum")),
          size(asset.get("size"), context + " asset " + path),
          text(asset.get("includeCondition"))));
    }
    return new Configuration(
        name,
        optionalMap(raw.get("variables"), context + " variables"),
        dependencyRules(raw.get("dependencyRules")),
        files,
        assets);
  }

  /** Rules are stored as a JSON string; a YAML list is accepted and re-encoded. */
  private String dependencyRules(Object raw) {
    if (raw == null) {
      return "";
    }
    if (raw instanceof String text) {
      return text;
    }
    return json.writeCompact(raw);
  }

  private static Path baseDir(Path catalogFile) {
    Path parent = catalogFile.toAbsolutePath().normalize().getParent();
    return parent == null ? Path.of(".") : parent;
  }

  private static String required(Map<String, Object> raw, String key, String context) throws IOException {
    String value = text(raw.get(key));
    if (value == null || value.isBlank()) {
      throw new IOException(context + " is missing '" + key + "'");
    }
    return value;
  }

  private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String context) throws IOException {
    try {
      return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException | NullPointerException ex) {
      throw new IOException(context + " has unsupported value '" + value + "'", ex);
    }
  }

  private static long size(Object raw, String context) throws IOException {
    if (raw == null) {
      return 0L;
    }
    if (raw instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(raw.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IOException(context + " has a non-numeric size '" + raw + "'", ex);
    }
  }

  private static boolean bool(Object raw, boolean fallback) {
    if (raw == null) {
      return fallback;
    }
    if (raw instanceof Boolean b) {
      return b;
    }
    return Boolean.parseBoolean(raw.toString().trim());
  }

  private static String text(Object raw) {
    return raw == null ? null : raw.toString();
  }

  private static Map<String, Object> optionalMap(Object raw, String context) throws IOException {
    return raw == null ? Map.of() : map(raw, context);
  }

  private static Map<String, Object> map(Object raw, String context) throws IOException {
    if (!(raw instanceof Map<?, ?> source)) {
      throw new IOException(context + " must be a mapping");
    }
    Map<String, Object> out = new LinkedHashMap<>();
    source.forEach((k, v) -> out.put(String.valueOf(k), v));
    return out;
  }

  private static List<Map<String, Object>> list(Map<String, Object> parent, String key, String context)
      throws IOException {
    Object raw = parent.get(key);
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> items)) {
      throw new IOException(context + " '" + key + "' must be a list");
    }
    List<Map<String, Object>> out = new ArrayList<>(items.size());
    for (Object item : items) {
      out.add(map(item, context + " " + key + " entry"));
    }
    return out;
  }

  private static String instant(Instant value) {
    return value == null ? null : value.toString();
  }
}
