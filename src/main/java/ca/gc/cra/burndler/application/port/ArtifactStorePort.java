package ca.gc.cra.burndler.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Object storage port for template sources, assets, and finished packages.
 * <p><strong>Role:</strong> Implemented by {@code LocalFsArtifactStore}; an S3-style backend plugs in here.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent builds reading and writing distinct keys.</p>
 *
 * @since 0.1.0
 */
public interface ArtifactStorePort {
  /**
   * Reads an object.
   *
   * @param key storage key, {@code /}-separated
   * @return object bytes
   * @throws IOException when the object is missing or unreadable
   */
  byte[] download(String key) throws IOException;

  /**
   * Stores an object, replacing any previous content under the same key.
   *
   * @param key storage key, {@code /}-separated
   * @param content object bytes
   * @return locator clients use to fetch the object
   * @throws IOException when the write fails or the object exceeds the store's size limit
   */
  String upload(String key, byte[] content) throws IOException;
}
