package ca.gc.cra.burndler.domain.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed configuration value inspected by dependency rules.
 * <p><strong>Why:</strong> Comparisons and emptiness checks dispatch on an explicit kind rather than on
 * runtime class inspection of loosely typed maps.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public interface Value {

  NullValue NULL = new NullValue();

  /**
   * Returns whether the value counts as "not set" for {@code requires} and {@code conflicts} rules.
   *
   * @return {@code true} for null, {@code false}, zero, the empty string, and empty collections
   */
  boolean isEmpty();

  /**
   * Wraps a plain Java value as produced by JSON or YAML parsing.
   *
   * @param raw map, list, string, number, boolean, or {@code null}
   * @return typed value; unknown types are carried as their string form
   */
  static Value of(Object raw) {
    if (raw == null) {
      return NULL;
    }
    if (raw instanceof Value v) {
      return v;
    }
    if (raw instanceof Boolean b) {
      return new BoolValue(b);
    }
    if (raw instanceof Number n) {
      return new NumberValue(n.doubleValue());
    }
    if (raw instanceof CharSequence s) {
      return new StringValue(s.toString());
    }
    if (raw instanceof Map<?, ?> map) {
      Map<String, Value> entries = new LinkedHashMap<>();
      map.forEach((k, v) -> entries.put(String.valueOf(k), of(v)));
      return new MapValue(entries);
    }
    if (raw instanceof Iterable<?> iterable) {
      List<Value> items = new ArrayList<>();
      iterable.forEach(item -> items.add(of(item)));
      return new ListValue(items);
    }
    return new StringValue(raw.toString());
  }

  record NullValue() implements Value {
    @Override
    public boolean isEmpty() {
      return true;
    }

    @Override
    public String toString() {
      return "nil";
    }
  }

  record BoolValue(boolean value) implements Value {
    @Override
    public boolean isEmpty() {
      return !value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  record NumberValue(double value) implements Value {
    @Override
    public boolean isEmpty() {
      return value == 0d;
    }

    @Override
    public String toString() {
      if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
        return Long.toString((long) value);
      }
      return Double.toString(value);
    }
  }

  record StringValue(String value) implements Value {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isEmpty() {
      return value.isEmpty();
    }

    @Override
    public String toString() {
      return value;
    }
  }

  record ListValue(List<Value> items) implements Value {
    public ListValue {
      items = List.copyOf(items);
    }

    @Override
    public boolean isEmpty() {
      return items.isEmpty();
    }
  }

  record MapValue(Map<String, Value> entries) implements Value {
    public MapValue {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public boolean isEmpty() {
      return entries.isEmpty();
    }

    /**
     * Resolves a dot-separated path through nested maps.
     *
     * @param path field path such as {@code database.enabled}
     * @return value at the path, or {@link Value#NULL} when any segment is missing or not a map
     */
    public Value lookup(String path) {
      Value current = this;
      for (String segment : path.split("\\.", -1)) {
        if (!(current instanceof MapValue map)) {
          return NULL;
        }
        Value next = map.entries().get(segment);
        if (next == null) {
          return NULL;
        }
        current = next;
      }
      return current;
    }
  }
}
