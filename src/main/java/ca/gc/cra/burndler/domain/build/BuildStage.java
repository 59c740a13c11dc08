package ca.gc.cra.burndler.domain.build;

import java.util.Locale;

/**
 * Build pipeline stages in execution order.
 *
 * @since 0.1.0
 */
public enum BuildStage {
  VALIDATION,
  CONFIGURATION,
  TEMPLATE_RENDER,
  ASSET_RESOLUTION,
  COMPOSE_MERGE,
  LINTING,
  PACKAGING;

  /** Lower-case name used in status strings, metric names, and logs. */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
