package ca.gc.cra.burndler.domain.compose;

/**
 * Rule identifiers reported with each lint finding.
 *
 * @since 0.1.0
 */
public enum LintRule {
  NO_BUILD_DIRECTIVE("no-build-directive"),
  MISSING_IMAGE("missing-image"),
  IMAGE_DIGEST("image-digest"),
  INVALID_DEPENDS_ON("invalid-depends-on"),
  INVALID_NETWORK("invalid-network"),
  INVALID_VOLUME("invalid-volume"),
  PRIVILEGED_CONTAINER("privileged-container"),
  CAPABILITY_ADD("capability-add"),
  PORT_COLLISION("port-collision"),
  UNRESOLVED_VARIABLE("unresolved-variable");

  private final String id;

  LintRule(String id) {
    this.id = id;
  }

  /** Returns the stable rule id, for example {@code no-build-directive}. */
  public String id() {
    return id;
  }
}
