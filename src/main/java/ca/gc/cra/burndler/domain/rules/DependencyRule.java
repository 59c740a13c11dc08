package ca.gc.cra.burndler.domain.rules;

import java.util.Optional;

/**
 * Dependency rule as declared by a configuration.
 *
 * @param type rule kind as written; unknown kinds are kept so they can be reported
 * @param field source field path
 * @param condition optional condition text; blank means the rule always applies
 * @param target target field path
 * @param message optional custom error message
 * @since 0.1.0
 */
public record DependencyRule(String type, String field, String condition, String target, String message) {
  public DependencyRule {
    type = type == null ? "" : type;
    field = field == null ? "" : field;
    condition = condition == null ? "" : condition;
    target = target == null ? "" : target;
    message = message == null ? "" : message;
  }

  public Optional<RuleKind> kind() {
    return RuleKind.fromWire(type);
  }

  public boolean hasCustomMessage() {
    return !message.isEmpty();
  }
}
