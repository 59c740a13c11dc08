package ca.gc.cra.burndler.domain.build;

import java.util.Objects;

/**
 * File shipped with a configuration.
 *
 * @param path destination path relative to the member's resource directory
 * @param kind template or static
 * @param storagePath object store key of the source content
 * @param templateFormat render format for templates ({@code yaml}, {@code json}, {@code env}, {@code text})
 * @since 0.1.0
 */
public record ConfigurationFile(String path, FileKind kind, String storagePath, String templateFormat) {
  public ConfigurationFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(storagePath, "storagePath");
    templateFormat = templateFormat == null || templateFormat.isBlank() ? "text" : templateFormat;
  }
}
