package ca.gc.cra.burndler.domain.build;

import java.util.Objects;

/**
 * Coarse build status persisted with a {@link BuildRecord}: {@code queued}, {@code building:<stage>},
 * {@code failed}, or {@code completed}.
 *
 * @param value status string
 * @since 0.1.0
 */
public record BuildStatus(String value) {
  public static final BuildStatus QUEUED = new BuildStatus("queued");
  public static final BuildStatus FAILED = new BuildStatus("failed");
  public static final BuildStatus COMPLETED = new BuildStatus("completed");

  private static final String BUILDING_PREFIX = "building:";

  public BuildStatus {
    Objects.requireNonNull(value, "value");
  }

  public static BuildStatus building(BuildStage stage) {
    return new BuildStatus(BUILDING_PREFIX + stage.id());
  }

  public boolean terminal() {
    return equals(FAILED) || equals(COMPLETED);
  }

  @Override
  public String toString() {
    return value;
  }
}
