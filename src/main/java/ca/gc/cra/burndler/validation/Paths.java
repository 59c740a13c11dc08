package ca.gc.cra.burndler.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the storage root, catalog, and CLI input/output files.
 * <p><strong>Why:</strong> Rejects unusable paths up front so builds fail with a configuration error rather
 * than midway through packaging.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked root is reported as found.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param path candidate directory
   * @param allowedBase optional sandbox; when non-null, {@code path} must reside within it
   * @param createIfMissing whether to create the directory and its parents when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real path of the directory when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path escapes {@code allowedBase}, is not a writable directory, or
   *     cannot be created
   */
  public static Path validateWritableDir(Path path, Path allowedBase, boolean createIfMissing, boolean allowReuse) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (containsControl(path.toString())) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    Path base = allowedBase == null ? null : allowedBase.toAbsolutePath().normalize();
    ensureWithinBase(normalized, base);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      ensureWithinBase(real, base);
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      if (!allowReuse) {
        try (var entries = Files.newDirectoryStream(real)) {
          if (entries.iterator().hasNext()) {
            throw new IllegalArgumentException("directory " + real + " is not empty");
          }
        }
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates that a file exists and is readable.
   *
   * @param name parameter name for diagnostics
   * @param path candidate file
   * @return absolute normalized path
   * @throws IllegalArgumentException if the file is missing, a directory, or unreadable
   */
  public static Path requireReadableFile(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " file not found: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    return normalized;
  }

  private static void ensureWithinBase(Path candidate, Path base) {
    if (base != null && !candidate.startsWith(base)) {
      throw new IllegalArgumentException("path " + candidate + " escapes allowed base " + base);
    }
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
