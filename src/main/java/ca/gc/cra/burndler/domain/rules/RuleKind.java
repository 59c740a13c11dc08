package ca.gc.cra.burndler.domain.rules;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported dependency rule kinds.
 *
 * @since 0.1.0
 */
public enum RuleKind {
  /** The target field must be set when the source field is set. */
  REQUIRES,
  /** Source and target must not both be set. */
  CONFLICTS,
  /** Accepted and ignored. */
  CASCADES;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<RuleKind> fromWire(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    for (RuleKind kind : values()) {
      if (kind.wireName().equals(raw)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
