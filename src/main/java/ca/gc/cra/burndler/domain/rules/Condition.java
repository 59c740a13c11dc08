package ca.gc.cra.burndler.domain.rules;

import java.util.Objects;

/**
 * Compiled rule condition of the form {@code {{.path}} <op> literal}.
 *
 * @param fieldPath dot path into the configuration values, without the leading dot
 * @param operator comparison operator
 * @param literal right-hand operand
 * @since 0.1.0
 */
public record Condition(String fieldPath, ComparisonOperator operator, Value literal) {

  /** Condition that always holds; used for rules without a condition. */
  public static final Condition ALWAYS = new Condition("", ComparisonOperator.EQ, Value.NULL);

  public Condition {
    Objects.requireNonNull(fieldPath, "fieldPath");
    Objects.requireNonNull(operator, "operator");
    Objects.requireNonNull(literal, "literal");
  }

  public boolean always() {
    return this == ALWAYS;
  }
}
