package ca.gc.cra.burndler.domain.build;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Container included in a build target.
 *
 * @param name member name, unique within the target
 * @param enabled disabled members are skipped by every stage
 * @param compose compose fragment of the selected container version
 * @param configurationName optional named configuration; {@code null} when none applies
 * @param overrides per-member variable overrides, the highest precedence layer
 * @since 0.1.0
 */
public record BuildMember(
    String name,
    boolean enabled,
    String compose,
    String configurationName,
    Map<String, Object> overrides) {

  public BuildMember {
    Objects.requireNonNull(name, "name");
    compose = compose == null ? "" : compose;
    overrides = overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
  }

  public boolean hasConfiguration() {
    return configurationName != null && !configurationName.isBlank();
  }
}
