package ca.gc.cra.burndler.application.rules;

import ca.gc.cra.burndler.domain.rules.ComparisonOperator;
import ca.gc.cra.burndler.domain.rules.Condition;
import ca.gc.cra.burndler.domain.rules.Value;

/**
 * Evaluates compiled conditions against configuration values.
 *
 * <p>Null handling: two nulls satisfy {@code ==}, {@code <=} and {@code >=}; a null against a non-null value
 * satisfies only {@code !=}. Numbers compare numerically; strings and booleans compare by equality only.
 *
 * @since 0.1.0
 */
public final class ConditionEvaluator {

  /**
   * Evaluates a condition.
   *
   * @param condition compiled condition
   * @param values configuration values
   * @return whether the condition holds
   * @throws ConditionException when a relational operator meets non-numeric operands
   */
  public boolean evaluate(Condition condition, Value.MapValue values) throws ConditionException {
    if (condition.always()) {
      return true;
    }
    Value left = values.lookup(condition.fieldPath());
    return compare(left, condition.operator(), condition.literal());
  }

  /**
   * Compares two values.
   *
   * @param left left operand
   * @param op operator
   * @param right right operand
   * @return comparison outcome
   * @throws ConditionException when {@code op} is relational and either operand is not numeric
   */
  public boolean compare(Value left, ComparisonOperator op, Value right) throws ConditionException {
    boolean leftNull = left instanceof Value.NullValue;
    boolean rightNull = right instanceof Value.NullValue;
    if (leftNull && rightNull) {
      return op == ComparisonOperator.EQ || op == ComparisonOperator.LE || op == ComparisonOperator.GE;
    }
    if (leftNull || rightNull) {
      return op == ComparisonOperator.NE;
    }
    if (op == ComparisonOperator.EQ) {
      return equal(left, right);
    }
    if (op == ComparisonOperator.NE) {
      return !equal(left, right);
    }
    if (!(left instanceof Value.NumberValue l) || !(right instanceof Value.NumberValue r)) {
      throw new ConditionException("non-numeric values cannot be compared with " + op.symbol());
    }
    return switch (op) {
      case GT -> l.value() > r.value();
      case LT -> l.value() < r.value();
      case GE -> l.value() >= r.value();
      case LE -> l.value() <= r.value();
      default -> throw new IllegalStateException("Unexpected operator " + op);
    };
  }

  private static boolean equal(Value left, Value right) {
    if (left instanceof Value.NumberValue l && right instanceof Value.NumberValue r) {
      return l.value() == r.value();
    }
    if (left instanceof Value.StringValue l && right instanceof Value.StringValue r) {
      return l.value().equals(r.value());
    }
    if (left instanceof Value.BoolValue l && right instanceof Value.BoolValue r) {
      return l.value() == r.value();
    }
    if (left.getClass() == right.getClass()) {
      return left.equals(right);
    }
    return false;
  }
}
