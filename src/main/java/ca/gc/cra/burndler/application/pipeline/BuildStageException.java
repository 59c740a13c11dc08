package ca.gc.cra.burndler.application.pipeline;

import ca.gc.cra.burndler.domain.build.BuildStage;
import java.util.Objects;

/**
 * Failure of one build stage. The message is recorded verbatim on the build record.
 *
 * @since 0.1.0
 */
public final class BuildStageException extends Exception {
  private static final long serialVersionUID = 1L;

  private final BuildStage stage;

  public BuildStageException(BuildStage stage, String message) {
    this(stage, message, null);
  }

  public BuildStageException(BuildStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public BuildStage stage() {
    return stage;
  }
}
