package ca.gc.cra.burndler.domain.build;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, versioned set of containers packaged together.
 *
 * @param id target identifier
 * @param name target name; used in namespaces and package names
 * @param active inactive targets fail validation
 * @param variables target-level variables
 * @param members member containers in declaration order
 * @since 0.1.0
 */
public record BuildTarget(
    String id,
    String name,
    boolean active,
    Map<String, Object> variables,
    List<BuildMember> members) {

  public BuildTarget {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    members = members == null ? List.of() : List.copyOf(members);
  }

  public List<BuildMember> enabledMembers() {
    return members.stream().filter(BuildMember::enabled).toList();
  }

  /** Namespace prefix shared by every member: {@code <name>_<id>}. */
  public String namespace() {
    return name + "_" + id;
  }
}
