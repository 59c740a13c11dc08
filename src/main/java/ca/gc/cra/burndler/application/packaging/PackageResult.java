package ca.gc.cra.burndler.application.packaging;

import ca.gc.cra.burndler.domain.build.PackageManifest;

/**
 * Outcome of a successful package upload.
 *
 * @param key storage key, {@code <name>-<uuid>.tar.gz}
 * @param locator locator returned by the artifact store
 * @param manifest manifest written into the archive
 * @param manifestJson manifest exactly as archived
 * @param size archive size in bytes
 * @since 0.1.0
 */
public record PackageResult(String key, String locator, PackageManifest manifest, String manifestJson, long size) {}
