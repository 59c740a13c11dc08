package ca.gc.cra.burndler.application.rules;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.burndler.domain.rules.ComparisonOperator;
import ca.gc.cra.burndler.domain.rules.Value;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {
  private final ConditionEvaluator evaluator = new ConditionEvaluator();

  @Test
  void numbersCompareByValueRegardlessOfIntegerOrDecimalSource() throws ConditionException {
    assertTrue(evaluator.compare(Value.of(8080), ComparisonOperator.EQ, new Value.NumberValue(8080.0)));
    assertTrue(evaluator.compare(Value.of(3), ComparisonOperator.LT, Value.of(3.5)));
    assertFalse(evaluator.compare(Value.of(3), ComparisonOperator.GT, Value.of(3)));
  }

  @Test
  void differentKindsAreNeverEqual() throws ConditionException {
    assertFalse(evaluator.compare(Value.of("1"), ComparisonOperator.EQ, Value.of(1)));
    assertTrue(evaluator.compare(Value.of("1"), ComparisonOperator.NE, Value.of(1)));
  }

  @Test
  void missingValuesOnlySatisfyNotEqual() throws ConditionException {
    assertTrue(evaluator.compare(Value.NULL, ComparisonOperator.NE, Value.of("x")));
    assertFalse(evaluator.compare(Value.NULL, ComparisonOperator.EQ, Value.of("x")));
    assertFalse(evaluator.compare(Value.NULL, ComparisonOperator.GT, Value.of(1)));
    assertTrue(evaluator.compare(Value.NULL, ComparisonOperator.EQ, Value.NULL));
  }

  @Test
  void orderingNonNumbersIsAnError() {
    assertThrows(ConditionException.class,
        () -> evaluator.compare(Value.of("b"), ComparisonOperator.GT, Value.of("a")));
  }
}
