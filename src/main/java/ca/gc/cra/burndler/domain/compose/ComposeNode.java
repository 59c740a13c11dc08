package ca.gc.cra.burndler.domain.compose;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Tagged tree node for a parsed compose document.
 * <p><strong>Why:</strong> Merge and lint walk the document through explicit node kinds instead of untyped maps.</p>
 * <p><strong>Role:</strong> Domain value shared by the merger, linter, and packager.</p>
 * <p><strong>Thread-safety:</strong> All node kinds are immutable; mapping and sequence views are unmodifiable.</p>
 *
 * @since 0.1.0
 */
public interface ComposeNode {

  /** Node discriminator. */
  enum Kind {
    NULL,
    BOOLEAN,
    NUMBER,
    STRING,
    SEQUENCE,
    MAPPING
  }

  /** Shared null node. */
  NullNode NULL = new NullNode();

  Kind kind();

  /**
   * Converts the node back into plain Java collections and scalars.
   *
   * @return {@link LinkedHashMap}, {@link ArrayList}, {@link String}, {@link Number}, {@link Boolean} or {@code null}
   */
  Object toPlain();

  default Optional<MappingNode> asMapping() {
    return Optional.empty();
  }

  default Optional<SequenceNode> asSequence() {
    return Optional.empty();
  }

  /**
   * Returns the text of a scalar node.
   *
   * @return string form for string, number, and boolean nodes; empty for null and collection nodes
   */
  default Optional<String> scalarText() {
    return Optional.empty();
  }

  /**
   * Builds a node tree from plain Java values as produced by YAML or JSON parsers.
   *
   * @param value map, list, scalar, or {@code null}
   * @return equivalent node tree
   */
  static ComposeNode fromPlain(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof ComposeNode node) {
      return node;
    }
    if (value instanceof Boolean b) {
      return new BooleanNode(b);
    }
    if (value instanceof Number n) {
      return new NumberNode(n);
    }
    if (value instanceof CharSequence s) {
      return new StringNode(s.toString());
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, ComposeNode> entries = new LinkedHashMap<>();
      map.forEach((k, v) -> entries.put(String.valueOf(k), fromPlain(v)));
      return MappingNode.of(entries);
    }
    if (value instanceof Iterable<?> iterable) {
      List<ComposeNode> items = new ArrayList<>();
      iterable.forEach(item -> items.add(fromPlain(item)));
      return SequenceNode.of(items);
    }
    return new StringNode(String.valueOf(value));
  }

  /** Explicit YAML null. */
  record NullNode() implements ComposeNode {
    @Override
    public Kind kind() {
      return Kind.NULL;
    }

    @Override
    public Object toPlain() {
      return null;
    }
  }

  /** Boolean scalar. */
  record BooleanNode(boolean value) implements ComposeNode {
    @Override
    public Kind kind() {
      return Kind.BOOLEAN;
    }

    @Override
    public Object toPlain() {
      return value;
    }

    @Override
    public Optional<String> scalarText() {
      return Optional.of(Boolean.toString(value));
    }
  }

  /** Numeric scalar as loaded (integer, long, big integer, or double). */
  record NumberNode(Number value) implements ComposeNode {
    public NumberNode {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.NUMBER;
    }

    @Override
    public Object toPlain() {
      return value;
    }

    @Override
    public Optional<String> scalarText() {
      return Optional.of(value.toString());
    }
  }

  /** String scalar. */
  record StringNode(String value) implements ComposeNode {
    public StringNode {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }

    @Override
    public Object toPlain() {
      return value;
    }

    @Override
    public Optional<String> scalarText() {
      return Optional.of(value);
    }
  }

  /** Ordered sequence of nodes. */
  record SequenceNode(List<ComposeNode> items) implements ComposeNode {
    public SequenceNode {
      items = List.copyOf(items);
    }

    public static SequenceNode of(List<ComposeNode> items) {
      return new SequenceNode(items);
    }

    @Override
    public Kind kind() {
      return Kind.SEQUENCE;
    }

    @Override
    public Object toPlain() {
      List<Object> out = new ArrayList<>(items.size());
      for (ComposeNode item : items) {
        out.add(item.toPlain());
      }
      return out;
    }

    @Override
    public Optional<SequenceNode> asSequence() {
      return Optional.of(this);
    }
  }

  /** Insertion-ordered mapping with string keys. */
  record MappingNode(Map<String, ComposeNode> entries) implements ComposeNode {
    public MappingNode {
      entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static MappingNode of(Map<String, ComposeNode> entries) {
      return new MappingNode(entries);
    }

    public static MappingNode empty() {
      return new MappingNode(Map.of());
    }

    @Override
    public Kind kind() {
      return Kind.MAPPING;
    }

    @Override
    public Object toPlain() {
      Map<String, Object> out = new LinkedHashMap<>();
      entries.forEach((k, v) -> out.put(k, v.toPlain()));
      return out;
    }

    @Override
    public Optional<MappingNode> asMapping() {
      return Optional.of(this);
    }

    public Optional<ComposeNode> get(String key) {
      return Optional.ofNullable(entries.get(key));
    }

    /**
     * Looks up a child mapping; a missing key or a non-mapping child yields an empty result.
     *
     * @param key entry key
     * @return child mapping when present
     */
    public Optional<MappingNode> mapping(String key) {
      return get(key).flatMap(ComposeNode::asMapping);
    }

    /**
     * Returns a copy with {@code key} set to {@code value}, preserving the original key position.
     *
     * @param key entry key
     * @param value replacement value
     * @return updated mapping
     */
    public MappingNode with(String key, ComposeNode value) {
      Map<String, ComposeNode> copy = new LinkedHashMap<>(entries);
      copy.put(key, value);
      return new MappingNode(copy);
    }

    public boolean isEmpty() {
      return entries.isEmpty();
    }
  }
}
