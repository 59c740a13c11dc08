package ca.gc.cra.burndler.domain.build;

/**
 * Asset fetched at install time rather than embedded in the package.
 *
 * @param path destination path inside the resources directory
 * @param url download location
 * @param checksum expected checksum
 * @param size size in bytes
 * @since 0.1.0
 */
public record DownloadAsset(String path, String url, String checksum, long size) {}
