package ca.gc.cra.burndler.application.packaging;

import ca.gc.cra.burndler.domain.build.DownloadAsset;
import ca.gc.cra.burndler.domain.build.ResourceFile;
import java.util.List;
import java.util.Objects;

/**
 * Input to {@link Packager#createPackage(PackageRequest)}.
 *
 * @param name package name; prefixes the storage key
 * @param compose merged compose document
 * @param resources extra archive entries at caller-chosen paths
 * @param downloadAssets assets listed in the manifest but not embedded
 * @since 0.1.0
 */
public record PackageRequest(
    String name, String compose, List<ResourceFile> resources, List<DownloadAsset> downloadAssets) {

  public PackageRequest {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(compose, "compose");
    if (name.isBlank()) {
      throw new IllegalArgumentException("package name must not be blank");
    }
    resources = resources == null ? List.of() : List.copyOf(resources);
    downloadAssets = downloadAssets == null ? List.of() : List.copyOf(downloadAssets);
  }
}
