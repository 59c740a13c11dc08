package ca.gc.cra.burndler.application.packaging;

import ca.gc.cra.burndler.application.json.JsonSupport;
import ca.gc.cra.burndler.domain.build.DownloadAsset;
import ca.gc.cra.burndler.domain.build.ImageInfo;
import ca.gc.cra.burndler.domain.build.PackageManifest;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes {@link PackageManifest} as the {@code manifest.json} wire document.
 *
 * @since 0.1.0
 */
public final class ManifestWriter {
  private final JsonSupport json;

  public ManifestWriter(JsonSupport json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Writes a manifest with two-space indentation.
   *
   * @param manifest manifest to serialize
   * @return JSON text
   */
  public String write(PackageManifest manifest) {
    Objects.requireNonNull(manifest, "manifest");
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put("name", manifest.name());
    doc.put("version", manifest.version());
    doc.put("created_at", manifest.createdAt());
    List<Object> images = new ArrayList<>();
    for (ImageInfo image : manifest.images()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("name", image.name());
      entry.put("tag", image.tag());
      entry.put("digest", image.digest());
      entry.put("file", image.file());
      images.add(entry);
    }
    doc.put("images", images);
    doc.put("resources", manifest.resources());
    doc.put("checksums", manifest.checksums());
    List<Object> downloads = new ArrayList<>();
    for (DownloadAsset asset : manifest.downloadAssets()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("path", asset.path());
      entry.put("url", asset.url());
      entry.put("checksum", asset.checksum());
      entry.put("size", asset.size());
      downloads.add(entry);
    }
    doc.put("download_assets", downloads);
    return json.writePretty(doc);
  }
}
