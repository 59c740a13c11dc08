package ca.gc.cra.burndler.application.pipeline;

import ca.gc.cra.burndler.domain.build.BuildMember;
import ca.gc.cra.burndler.domain.build.BuildTarget;
import ca.gc.cra.burndler.domain.build.Configuration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the effective variables of one build member.
 *
 * <p>Layers, lowest first: built-ins ({@value #SERVICE_NAME}, {@value #SERVICE_ID}), target variables,
 * configuration variables, member overrides. Nested maps merge key by key so an override of
 * {@code SSL.Enabled} keeps a configured {@code SSL.Certificate}; any other value replaces the lower layer.
 *
 * @since 0.1.0
 */
public final class VariableResolver {
  public static final String SERVICE_NAME = "SERVICE_NAME";
  public static final String SERVICE_ID = "SERVICE_ID";

  /**
   * Resolves variables for a member.
   *
   * @param target build target
   * @param configuration member configuration, or {@code null} when the member has none
   * @param member build member
   * @return mutable resolved variable tree
   */
  public Map<String, Object> resolve(BuildTarget target, Configuration configuration, BuildMember member) {
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(member, "member");
    Map<String, Object> resolved = new LinkedHashMap<>();
    resolved.put(SERVICE_NAME, target.name());
    resolved.put(SERVICE_ID, target.id());
    overlay(resolved, target.variables());
    if (configuration != null) {
      overlay(resolved, configuration.variables());
    }
    overlay(resolved, member.overrides());
    return resolved;
  }

  /**
   * Flattens a variable tree into strings for {@code ${VAR}} substitution. Nested maps contribute dotted keys.
   *
   * @param variables variable tree
   * @return flat string map in insertion order
   */
  public static Map<String, String> flatten(Map<String, Object> variables) {
    Map<String, String> flat = new LinkedHashMap<>();
    flatten("", variables == null ? Map.of() : variables, flat);
    return flat;
  }

  private static void flatten(String prefix, Map<?, ?> source, Map<String, String> out) {
    source.forEach((key, value) -> {
      String name = prefix + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(name + ".", nested, out);
      } else {
        out.put(name, text(value));
      }
    });
  }

  static String text(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
        return Long.toString((long) d);
      }
    }
    if (value instanceof List<?> list) {
      StringBuilder out = new StringBuilder("[");
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          out.append(' ');
        }
        out.append(text(list.get(i)));
      }
      return out.append(']').toString();
    }
    return String.valueOf(value);
  }

  private static void overlay(Map<String, Object> base, Map<?, ?> layer) {
    layer.forEach((k, value) -> {
      String key = String.valueOf(k);
      Object existing = base.get(key);
      if (value instanceof Map<?, ?> incoming) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (existing instanceof Map<?, ?> current) {
          overlay(merged, current);
        }
        overlay(merged, incoming);
        base.put(key, merged);
      } else {
        base.put(key, value);
      }
    });
  }
}
