package ca.gc.cra.burndler.domain.rules;

import java.util.List;

/**
 * Operators accepted in rule conditions.
 *
 * @since 0.1.0
 */
public enum ComparisonOperator {
  EQ("=="),
  NE("!="),
  GE(">="),
  LE("<="),
  GT(">"),
  LT("<");

  /** Probe order when splitting a condition; two-character operators come before their prefixes. */
  public static final List<ComparisonOperator> PARSE_ORDER = List.of(EQ, NE, GE, LE, GT, LT);

  private final String symbol;

  ComparisonOperator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }

  /** Whether the operator only applies to numeric operands. */
  public boolean relational() {
    return this == GE || this == LE || this == GT || this == LT;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
