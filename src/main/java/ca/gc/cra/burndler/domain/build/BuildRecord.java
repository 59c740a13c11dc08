package ca.gc.cra.burndler.domain.build;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted state of one build.
 *
 * @param id build identifier
 * @param name build display name
 * @param targetId build target the build packages
 * @param status coarse status
 * @param error failure message when {@code status} is {@code failed}, otherwise {@code null}
 * @param composeYaml merged compose document once the merge stage ran
 * @param manifestJson package manifest once packaging ran
 * @param downloadUrl locator of the uploaded package
 * @param createdAt creation time
 * @param completedAt time the build reached a terminal status
 * @since 0.1.0
 */
public record BuildRecord(
    String id,
    String name,
    String targetId,
    BuildStatus status,
    String error,
    String composeYaml,
    String manifestJson,
    String downloadUrl,
    Instant createdAt,
    Instant completedAt) {

  public BuildRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public static BuildRecord queued(String id, String name, String targetId, Instant createdAt) {
    return new BuildRecord(id, name, targetId, BuildStatus.QUEUED, null, null, null, null, createdAt, null);
  }

  public BuildRecord withStatus(BuildStatus next) {
    return new BuildRecord(id, name, targetId, next, error, composeYaml, manifestJson, downloadUrl,
        createdAt, completedAt);
  }

  public BuildRecord withCompose(String merged) {
    return new BuildRecord(id, name, targetId, status, error, merged, manifestJson, downloadUrl,
        createdAt, completedAt);
  }

  public BuildRecord withPackage(String manifest, String url) {
    return new BuildRecord(id, name, targetId, status, error, composeYaml, manifest, url,
        createdAt, completedAt);
  }

  public BuildRecord failed(String message, Instant at) {
    return new BuildRecord(id, name, targetId, BuildStatus.FAILED, message, composeYaml, manifestJson,
        downloadUrl, createdAt, at);
  }

  public BuildRecord completed(Instant at) {
    return new BuildRecord(id, name, targetId, BuildStatus.COMPLETED, null, composeYaml, manifestJson,
        downloadUrl, createdAt, at);
  }
}
