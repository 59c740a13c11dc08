package ca.gc.cra.burndler.domain.build;

/** Where an asset lives at install time. */
public enum AssetStorage {
  /** Bytes are copied into the package. */
  EMBEDDED,
  /** Only a download reference is recorded in the manifest. */
  DOWNLOAD
}
