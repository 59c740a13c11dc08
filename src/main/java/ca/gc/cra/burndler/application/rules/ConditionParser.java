package ca.gc.cra.burndler.application.rules;

import ca.gc.cra.burndler.domain.rules.ComparisonOperator;
import ca.gc.cra.burndler.domain.rules.Condition;
import ca.gc.cra.burndler.domain.rules.Value;
import java.util.regex.Pattern;

/**
 * Compiles condition text such as {@code {{.database.port}} >= 1024} into a {@link Condition}.
 *
 * <p>The left side must be a single field reference; the right side is a literal parsed as boolean, number,
 * quoted string, or bare string, in that order.
 *
 * @since 0.1.0
 */
public final class ConditionParser {
  private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
  private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

  /**
   * Parses a condition. The field reference is located first, so operator characters inside the literal are
   * kept as part of it.
   *
   * @param text condition text; {@code null} or blank yields {@link Condition#ALWAYS}
   * @return compiled condition
   * @throws ConditionException when the text does not start with a field reference or no operator follows it
   */
  public Condition parse(String text) throws ConditionException {
    if (text == null || text.isBlank()) {
      return Condition.ALWAYS;
    }
    String trimmed = text.trim();
    int end = trimmed.indexOf("}}");
    if (!trimmed.startsWith("{{") || end < 0) {
      throw new ConditionException("invalid condition format: " + trimmed);
    }
    String field = fieldPath(trimmed.substring(0, end + 2), trimmed);
    String rest = trimmed.substring(end + 2).trim();
    for (ComparisonOperator op : ComparisonOperator.PARSE_ORDER) {
      if (rest.startsWith(op.symbol())) {
        return new Condition(field, op, parseLiteral(rest.substring(op.symbol().length()).trim()));
      }
    }
    throw new ConditionException("no valid operator found in condition: " + trimmed);
  }

  /**
   * Parses the right-hand operand of a condition.
   *
   * @param raw literal text, already trimmed
   * @return typed literal
   */
  public Value parseLiteral(String raw) {
    if ("true".equals(raw)) {
      return new Value.BoolValue(true);
    }
    if ("false".equals(raw)) {
      return new Value.BoolValue(false);
    }
    if (INTEGER.matcher(raw).matches()) {
      try {
        return new Value.NumberValue(Long.parseLong(raw));
      } catch (NumberFormatException ex) {
        return new Value.NumberValue(Double.parseDouble(raw));
      }
    }
    if (DECIMAL.matcher(raw).matches()) {
      return new Value.NumberValue(Double.parseDouble(raw));
    }
    if (raw.length() >= 2) {
      char first = raw.charAt(0);
      char last = raw.charAt(raw.length() - 1);
      if ((first == '"' || first == '\'') && first == last) {
        return new Value.StringValue(raw.substring(1, raw.length() - 1));
      }
    }
    return new Value.StringValue(raw);
  }

  private static String fieldPath(String left, String condition) throws ConditionException {
    if (!left.startsWith("{{") || !left.endsWith("}}") || left.length() < 4) {
      throw new ConditionException("invalid condition format: " + condition);
    }
    String inner = left.substring(2, left.length() - 2).trim();
    if (inner.startsWith(".")) {
      inner = inner.substring(1);
    }
    if (inner.isEmpty()) {
      throw new ConditionException("empty field reference in condition: " + condition);
    }
    return inner;
  }
}
