package ca.gc.cra.burndler.application.template;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * Conversions shared by the template executor and the function table: truthiness, printing, and integer
 * coercion.
 *
 * @since 0.1.0
 */
final class TemplateValues {
  private TemplateValues() {
    // Utility
  }

  /**
   * Truthiness used by {@code if}, {@code with}, {@code not}, {@code and}, and {@code or}.
   *
   * @param value candidate
   * @return {@code false} for null, {@code false}, zero, the empty string, and empty collections
   */
  static boolean truthy(Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof Number n) {
      return n.doubleValue() != 0d;
    }
    if (value instanceof CharSequence s) {
      return s.length() > 0;
    }
    if (value instanceof Collection<?> c) {
      return !c.isEmpty();
    }
    if (value instanceof Map<?, ?> m) {
      return !m.isEmpty();
    }
    return true;
  }

  /**
   * Prints a value the way it appears in rendered output.
   *
   * @param value value to print
   * @return empty string for null; lists as {@code [a b]}; maps as {@code map[k:v]} with sorted keys
   */
  static String print(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof String s) {
      return s;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Double.toString(d);
      }
      return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
    if (value instanceof Collection<?> items) {
      StringBuilder out = new StringBuilder("[");
      Iterator<?> it = items.iterator();
      while (it.hasNext()) {
        out.append(print(it.next()));
        if (it.hasNext()) {
          out.append(' ');
        }
      }
      return out.append(']').toString();
    }
    if (value instanceof Map<?, ?> map) {
      StringBuilder out = new StringBuilder("map[");
      Map<String, Object> sorted = new TreeMap<>();
      map.forEach((k, v) -> sorted.put(String.valueOf(k), v));
      Iterator<Map.Entry<String, Object>> it = sorted.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<String, Object> entry = it.next();
        out.append(entry.getKey()).append(':').append(print(entry.getValue()));
        if (it.hasNext()) {
          out.append(' ');
        }
      }
      return out.append(']').toString();
    }
    return String.valueOf(value);
  }

  /**
   * Coerces an argument to a long.
   *
   * @param value integral number, or a floating point number without fraction
   * @return long value
   * @throws IllegalArgumentException for anything else
   */
  static long toLong(Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      return big.longValueExact();
    }
    if (value instanceof Number n) {
      double d = n.doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d)) {
        return (long) d;
      }
    }
    throw new IllegalArgumentException("expected integer but got " + describe(value));
  }

  /**
   * Requires a string argument.
   *
   * @param value argument
   * @return the string
   * @throws IllegalArgumentException when {@code value} is not a string
   */
  static String toText(Object value) {
    if (value instanceof CharSequence s) {
      return s.toString();
    }
    throw new IllegalArgumentException("expected string but got " + describe(value));
  }

  /**
   * Compares two values for {@code eq}/{@code ne}: numbers by numeric value, everything else by equality.
   */
  static boolean same(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      if (integral(x) && integral(y)) {
        return x.longValue() == y.longValue();
      }
      return x.doubleValue() == y.doubleValue();
    }
    return a == null ? b == null : a.equals(b);
  }

  private static boolean integral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
  }

  static String describe(Object value) {
    if (value == null) {
      return "nil";
    }
    if (value instanceof Map<?, ?>) {
      return "map";
    }
    if (value instanceof Collection<?>) {
      return "list";
    }
    if (value instanceof CharSequence) {
      return "string";
    }
    if (value instanceof Boolean) {
      return "bool";
    }
    if (value instanceof Number) {
      return "number";
    }
    return value.getClass().getSimpleName();
  }
}
