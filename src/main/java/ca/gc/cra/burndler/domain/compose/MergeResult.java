package ca.gc.cra.burndler.domain.compose;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of merging compose modules.
 *
 * @param mergedCompose serialized merged document
 * @param document merged document tree
 * @param mappings per module, original entity name to namespaced name
 * @param warnings non-fatal findings such as host port collisions, in discovery order
 * @since 0.1.0
 */
public record MergeResult(
    String mergedCompose,
    ComposeNode.MappingNode document,
    Map<String, Map<String, String>> mappings,
    List<String> warnings) {

  public MergeResult {
    Map<String, Map<String, String>> copy = new LinkedHashMap<>();
    mappings.forEach((module, names) -> copy.put(module, Map.copyOf(names)));
    mappings = Collections.unmodifiableMap(copy);
    warnings = List.copyOf(warnings);
  }

  /**
   * Returns the namespaced name for an entity of a module.
   *
   * @param module module name
   * @param original name as declared in the module
   * @return namespaced name or {@code null} when the module did not declare {@code original}
   */
  public String mappedName(String module, String original) {
    Map<String, String> names = mappings.get(module);
    return names == null ? null : names.get(original);
  }
}
