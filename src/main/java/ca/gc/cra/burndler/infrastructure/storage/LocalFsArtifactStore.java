package ca.gc.cra.burndler.infrastructure.storage;

import ca.gc.cra.burndler.application.port.ArtifactStorePort;
import ca.gc.cra.burndler.validation.Numbers;
import ca.gc.cra.burndler.validation.Paths;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ArtifactStorePort} backed by a directory on the local filesystem.
 * <p><strong>Why:</strong> Air-gapped build hosts keep templates, assets, and finished packages on local disk.</p>
 * <p><strong>Role:</strong> Infrastructure adapter selected by {@code storageRoot}.</p>
 * <p><strong>Thread-safety:</strong> Writes go to a temporary sibling and are moved into place, so concurrent
 * readers never observe partial objects.</p>
 * <p><strong>Security:</strong> Keys are confined to the base directory; empty, {@code .} and {@code ..}
 * segments are dropped before resolution.</p>
 *
 * @since 0.1.0
 */
public final class LocalFsArtifactStore implements ArtifactStorePort {
  private static final Logger log = LoggerFactory.getLogger(LocalFsArtifactStore.class);
  private static final long MIB = 1024L * 1024L;

  private final Path baseDir;
  private final long maxUploadBytes;

  /**
   * Creates a store rooted at {@code baseDir}, creating the directory when missing.
   *
   * @param baseDir storage root
   * @param maxArtifactMiB largest accepted upload in mebibytes
   * @throws IllegalArgumentException if the directory is not writable or the limit is out of range
   */
  public LocalFsArtifactStore(Path baseDir, int maxArtifactMiB) {
    Objects.requireNonNull(baseDir, "baseDir");
    Numbers.requireRange("maxArtifactMiB", maxArtifactMiB, 1, 65_536);
    this.baseDir = Paths.validateWritableDir(baseDir, null, true, true);
    this.maxUploadBytes = maxArtifactMiB * MIB;
  }

  @Override
  public byte[] download(String key) throws IOException {
    Path file = resolve(key);
    try {
      return Files.readAllBytes(file);
    } catch (NoSuchFileException ex) {
      throw new IOException("artifact not found: " + key, ex);
    }
  }

  @Override
  public String upload(String key, byte[] content) throws IOException {
    Objects.requireNonNull(content, "content");
    if (content.length > maxUploadBytes) {
      throw new IOException("artifact " + key + " is " + content.length + " bytes; limit is " + maxUploadBytes);
    }
    Path file = resolve(key);
    Files.createDirectories(file.getParent());
    Path tmp = Files.createTempFile(file.getParent(), ".upload-", ".tmp");
    try {
      Files.write(tmp, content);
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException ex) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
    log.debug("Stored artifact {} ({} bytes)", file, content.length);
    return file.toAbsolutePath().toString();
  }

  /** Returns the root directory objects are stored under. */
  public Path baseDir() {
    return baseDir;
  }

  Path resolve(String key) {
    String normalized = normalizeKey(key);
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("artifact key resolves to an empty path: " + key);
    }
    Path file = baseDir.resolve(normalized).normalize();
    if (!file.startsWith(baseDir)) {
      throw new IllegalArgumentException("artifact key escapes storage root: " + key);
    }
    return file;
  }

  /**
   * Drops empty, {@code .} and {@code ..} segments; backslashes count as separators.
   *
   * @param key raw key
   * @return {@code /}-joined safe key, possibly empty
   */
  static String normalizeKey(String key) {
    Objects.requireNonNull(key, "key");
    List<String> segments = new ArrayList<>();
    for (String segment : key.replace('\\', '/').split("/")) {
      if (segment.isEmpty() || segment.equals(".") || segment.equals("..")) {
        continue;
      }
      segments.add(segment);
    }
    return String.join("/", segments);
  }
}
