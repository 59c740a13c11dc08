package ca.gc.cra.burndler.domain.build;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Contents of {@code manifest.json}.
 *
 * @param name package name
 * @param version package version
 * @param createdAt ISO-8601 creation time
 * @param images images referenced by the compose document
 * @param resources archive paths of packaged resources
 * @param checksums SHA-256 hex digests keyed by archive path, for every entry except the manifest
 * @param downloadAssets assets fetched at install time
 * @since 0.1.0
 */
public record PackageManifest(
    String name,
    String version,
    String createdAt,
    List<ImageInfo> images,
    List<String> resources,
    Map<String, String> checksums,
    List<DownloadAsset> downloadAssets) {

  public PackageManifest {
    images = List.copyOf(images);
    resources = List.copyOf(resources);
    checksums = Collections.unmodifiableMap(new TreeMap<>(checksums));
    downloadAssets = List.copyOf(downloadAssets);
  }
}
