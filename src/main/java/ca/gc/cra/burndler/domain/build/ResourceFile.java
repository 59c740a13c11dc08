package ca.gc.cra.burndler.domain.build;

import java.util.Objects;

/**
 * Byte resource placed into a package at {@code path}.
 *
 * @param path archive path using {@code /} separators
 * @param content file bytes; callers must not mutate the array after handing it over
 * @since 0.1.0
 */
public record ResourceFile(String path, byte[] content) {
  public ResourceFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(content, "content");
  }
}
