package ca.gc.cra.burndler.domain.compose;

import java.util.Map;
import java.util.Objects;

/**
 * One compose fragment contributed to a merge.
 *
 * @param name namespace for every service, network, and volume the fragment declares
 * @param compose raw compose YAML text
 * @param variables module-level variable defaults used for {@code ${VAR}} substitution
 * @since 0.1.0
 */
public record Module(String name, String compose, Map<String, String> variables) {
  public Module {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("module name must not be blank");
    }
    compose = compose == null ? "" : compose;
    variables = variables == null ? Map.of() : Map.copyOf(variables);
  }

  public Module(String name, String compose) {
    this(name, compose, Map.of());
  }
}
