package ca.gc.cra.burndler.application.rules;

import ca.gc.cra.burndler.domain.rules.Condition;
import ca.gc.cra.burndler.domain.rules.DependencyRule;
import ca.gc.cra.burndler.domain.rules.RuleKind;
import ca.gc.cra.burndler.domain.rules.ValidationError;
import ca.gc.cra.burndler.domain.rules.Value;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Checks configuration values against declarative dependency rules.
 * <p><strong>Why:</strong> Catches incomplete or contradictory configurations before templates render.</p>
 * <p><strong>Role:</strong> Application service used by the configuration stage of the build pipeline.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 * <p><strong>Observability:</strong> Logs violation counts at DEBUG.</p>
 *
 * <p>Once a rule's condition holds, {@code requires} demands a non-empty target and {@code conflicts} demands an
 * empty one; the source field only names the rule in messages. Violations are reported on the target field.
 *
 * <p>Problems never escape as exceptions: malformed conditions, comparison failures, and unknown rule kinds
 * are reported as {@link ValidationError}s alongside ordinary violations.
 *
 * @since 0.1.0
 */
public final class DependencyChecker {
  private static final Logger log = LoggerFactory.getLogger(DependencyChecker.class);

  private final ConditionParser parser;
  private final ConditionEvaluator evaluator;

  public DependencyChecker() {
    this(new ConditionParser(), new ConditionEvaluator());
  }

  public DependencyChecker(ConditionParser parser, ConditionEvaluator evaluator) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
  }

  /**
   * Evaluates every rule against the values.
   *
   * @param rules rules in declaration order
   * @param values configuration values; nested maps are addressed with dot paths
   * @return violations in rule order; empty when the configuration satisfies all rules
   */
  public List<ValidationError> check(List<DependencyRule> rules, Map<String, Object> values) {
    Objects.requireNonNull(rules, "rules");
    Value.MapValue root = (Value.MapValue) Value.of(values == null ? Map.of() : values);
    List<ValidationError> errors = new ArrayList<>();
    for (DependencyRule rule : rules) {
      check(rule, root).ifPresent(errors::add);
    }
    if (!errors.isEmpty()) {
      log.debug("Dependency check found {} violation(s) across {} rule(s)", errors.size(), rules.size());
    }
    return errors;
  }

  /**
   * Evaluates a standalone condition, as used for asset inclusion.
   *
   * @param condition condition text; blank means always
   * @param values values addressed by the condition
   * @return whether the condition holds
   * @throws ConditionException when the condition is malformed or cannot be compared
   */
  public boolean evaluateCondition(String condition, Map<String, Object> values) throws ConditionException {
    Value.MapValue root = (Value.MapValue) Value.of(values == null ? Map.of() : values);
    return evaluator.evaluate(parser.parse(condition), root);
  }

  private Optional<ValidationError> check(DependencyRule rule, Value.MapValue values) {
    Optional<RuleKind> kind = rule.kind();
    if (kind.isEmpty()) {
      return Optional.of(new ValidationError(rule.field(), "Unknown rule type: " + rule.type(), rule.type()));
    }
    try {
      Condition condition = parser.parse(rule.condition());
      if (!evaluator.evaluate(condition, values)) {
        return Optional.empty();
      }
    } catch (ConditionException ex) {
      return Optional.of(new ValidationError(
          rule.field(), "Failed to evaluate condition: " + ex.getMessage(), rule.type()));
    }
    Value target = values.lookup(rule.target());
    return switch (kind.get()) {
      case REQUIRES -> {
        if (target.isEmpty()) {
          String message = rule.hasCustomMessage()
              ? rule.message()
              : rule.field() + " requires " + rule.target() + " to be set";
          yield Optional.of(new ValidationError(rule.target(), message, rule.type()));
        }
        yield Optional.empty();
      }
      case CONFLICTS -> {
        if (!target.isEmpty()) {
          String message = rule.hasCustomMessage()
              ? rule.message()
              : rule.field() + " conflicts with " + rule.target();
          yield Optional.of(new ValidationError(rule.target(), message, rule.type()));
        }
        yield Optional.empty();
      }
      case CASCADES -> Optional.empty();
    };
  }
}
