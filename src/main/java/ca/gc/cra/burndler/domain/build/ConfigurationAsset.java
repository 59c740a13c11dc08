package ca.gc.cra.burndler.domain.build;

import java.util.Objects;

/**
 * Binary asset shipped with a configuration.
 *
 * @param path destination path relative to the member's resource directory
 * @param storage embedded or download
 * @param storagePath object store key
 * @param downloadUrl explicit download URL; blank selects the default asset endpoint
 * @param checksum expected checksum, recorded in the manifest for download assets
 * @param size size in bytes
 * @param includeCondition optional condition text; the asset is skipped when it evaluates false
 * @since 0.1.0
 */
public record ConfigurationAsset(
    String path,
    AssetStorage storage,
    String storagePath,
    String downloadUrl,
    String checksum,
    long size,
    String includeCondition) {

  public ConfigurationAsset {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(storage, "storage");
    storagePath = storagePath == null ? "" : storagePath;
    downloadUrl = downloadUrl == null ? "" : downloadUrl;
    checksum = checksum == null ? "" : checksum;
    includeCondition = includeCondition == null ? "" : includeCondition;
  }
}
