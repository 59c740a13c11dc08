package ca.gc.cra.burndler.domain.build;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named configuration version attached to build members.
 *
 * @param name configuration name
 * @param variables configuration-level variables
 * @param dependencyRules dependency rules as a JSON array; blank when the configuration declares none
 * @param files files to render or copy
 * @param assets binary assets
 * @since 0.1.0
 */
public record Configuration(
    String name,
    Map<String, Object> variables,
    String dependencyRules,
    List<ConfigurationFile> files,
    List<ConfigurationAsset> assets) {

  public Configuration {
    Objects.requireNonNull(name, "name");
    variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    dependencyRules = dependencyRules == null ? "" : dependencyRules;
    files = files == null ? List.of() : List.copyOf(files);
    assets = assets == null ? List.of() : List.copyOf(assets);
  }
}
