package ca.gc.cra.burndler.application.compose;

import ca.gc.cra.burndler.application.port.MetricsPort;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.domain.compose.ComposeNode;
import ca.gc.cra.burndler.domain.compose.ComposeNode.MappingNode;
import ca.gc.cra.burndler.domain.compose.ComposeNode.SequenceNode;
import ca.gc.cra.burndler.domain.compose.LintIssue;
import ca.gc.cra.burndler.domain.compose.LintResult;
import ca.gc.cra.burndler.domain.compose.LintRule;
import ca.gc.cra.burndler.domain.compose.LintSeverity;
import ca.gc.cra.burndler.domain.compose.PortBinding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Static policy checks over a merged compose document.
 * <p><strong>Why:</strong> Offline installers can only ship prebuilt images and must start without dangling
 * references, so such documents are rejected before packaging.</p>
 * <p><strong>Role:</strong> Application service behind the linting build stage and the {@code lint} CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics port; safe to share.</p>
 * <p><strong>Observability:</strong> Emits {@code lint.errors} and {@code lint.warnings}; logs findings at DEBUG.</p>
 *
 * <p>The rule set is fixed. Errors: {@code no-build-directive}, {@code missing-image},
 * {@code invalid-depends-on}, {@code invalid-network}, {@code invalid-volume}, {@code port-collision}.
 * Warnings: {@code image-digest}, {@code privileged-container}, {@code capability-add},
 * {@code unresolved-variable}.
 *
 * @since 0.1.0
 */
public final class ComposeLinter {
  private static final Logger log = LoggerFactory.getLogger(ComposeLinter.class);

  private final YamlSupport yaml;
  private final MetricsPort metrics;

  public ComposeLinter(YamlSupport yaml, MetricsPort metrics) {
    this.yaml = Objects.requireNonNull(yaml, "yaml");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Lints compose text.
   *
   * @param compose compose YAML
   * @param strict strict mode flag; the build always lints strictly and the rule table is the same either way
   * @return findings; {@link LintResult#valid()} is {@code true} exactly when there are no errors
   * @throws ComposeParseException when the text is not a YAML mapping
   */
  public LintResult lint(String compose, boolean strict) {
    Objects.requireNonNull(compose, "compose");
    MappingNode root;
    try {
      root = yaml.parseMapping(compose);
    } catch (IllegalArgumentException ex) {
      throw new ComposeParseException("failed to parse compose", ex);
    }

    List<LintIssue> issues = new ArrayList<>();
    Map<String, ComposeNode> services = root.mapping("services").map(MappingNode::entries).orElse(Map.of());
    Set<String> networks = root.mapping("networks").map(m -> m.entries().keySet()).orElse(Set.of());
    Set<String> volumes = root.mapping("volumes").map(m -> m.entries().keySet()).orElse(Set.of());

    services.forEach((name, config) -> config.asMapping().ifPresent(service -> {
      if (service.get("build").isPresent()) {
        issues.add(LintIssue.error(LintRule.NO_BUILD_DIRECTIVE, String.format(
            "Service '%s' contains forbidden 'build:' directive. Use prebuilt images only.", name)));
      }
    }));
    services.forEach((name, config) -> config.asMapping().ifPresent(service -> {
      checkDependsOn(name, service, services.keySet(), issues);
      checkNetworks(name, service, networks, issues);
      checkVolumes(name, service, volumes, issues);
      checkSecurity(name, service, issues);
      checkImage(name, service, issues);
    }));
    checkUnresolvedVariables(compose, issues);
    checkPortCollisions(services, issues);

    List<LintIssue> errors = issues.stream().filter(i -> i.severity() == LintSeverity.ERROR).toList();
    List<LintIssue> warnings = issues.stream().filter(i -> i.severity() == LintSeverity.WARNING).toList();
    metrics.observe("lint.errors", errors.size());
    metrics.observe("lint.warnings", warnings.size());
    if (log.isDebugEnabled()) {
      issues.forEach(issue -> log.debug("Lint {} {}", issue.severity(), issue));
    }
    return new LintResult(errors, warnings);
  }

  private static void checkDependsOn(String name, MappingNode service, Set<String> declared, List<LintIssue> issues) {
    for (String dependency : referencedNames(service.get("depends_on"))) {
      if (!declared.contains(dependency)) {
        issues.add(LintIssue.error(LintRule.INVALID_DEPENDS_ON, String.format(
            "Service '%s' depends on non-existent service '%s'", name, dependency)));
      }
    }
  }

  private static void checkNetworks(String name, MappingNode service, Set<String> declared, List<LintIssue> issues) {
    for (String network : referencedNames(service.get("networks"))) {
      if (!"default".equals(network) && !declared.contains(network)) {
        issues.add(LintIssue.error(LintRule.INVALID_NETWORK, String.format(
            "Service '%s' references non-existent network '%s'", name, network)));
      }
    }
  }

  private static void checkVolumes(String name, MappingNode service, Set<String> declared, List<LintIssue> issues) {
    Optional<SequenceNode> mounts = service.get("volumes").flatMap(ComposeNode::asSequence);
    if (mounts.isEmpty()) {
      return;
    }
    for (ComposeNode mount : mounts.get().items()) {
      Optional<String> volume = namedVolume(mount);
      if (volume.isPresent() && !declared.contains(volume.get())) {
        issues.add(LintIssue.error(LintRule.INVALID_VOLUME, String.format(
            "Service '%s' references non-existent volume '%s'", name, volume.get())));
      }
    }
  }

  private static void checkSecurity(String name, MappingNode service, List<LintIssue> issues) {
    if (service.get("privileged").filter(n -> n instanceof ComposeNode.BooleanNode b && b.value()).isPresent()) {
      issues.add(LintIssue.warning(LintRule.PRIVILEGED_CONTAINER,
          String.format("Service '%s' runs in privileged mode", name)));
    }
    if (service.get("cap_add").isPresent()) {
      issues.add(LintIssue.warning(LintRule.CAPABILITY_ADD,
          String.format("Service '%s' adds Linux capabilities", name)));
    }
  }

  private static void checkImage(String name, MappingNode service, List<LintIssue> issues) {
    Optional<ComposeNode> image = service.get("image").filter(n -> n instanceof ComposeNode.StringNode);
    if (image.isEmpty()) {
      issues.add(LintIssue.error(LintRule.MISSING_IMAGE,
          String.format("Service '%s' missing image specification", name)));
      return;
    }
    String ref = ((ComposeNode.StringNode) image.get()).value();
    if (!ref.contains("@sha256:")) {
      issues.add(LintIssue.warning(LintRule.IMAGE_DIGEST,
          String.format("Service '%s' image '%s' doesn't use SHA256 digest", name, ref)));
    }
  }

  private static void checkUnresolvedVariables(String compose, List<LintIssue> issues) {
    String[] lines = compose.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i];
      int cursor = 0;
      while (true) {
        int start = line.indexOf("${", cursor);
        if (start < 0) {
          break;
        }
        int end = line.indexOf('}', start + 2);
        if (end < 0) {
          break;
        }
        String name = line.substring(start + 2, end);
        if (!name.contains(":-") && !name.contains("-")) {
          issues.add(new LintIssue(LintRule.UNRESOLVED_VARIABLE, LintSeverity.WARNING,
              "Possible unresolved variable: ${" + name + "}", i + 1));
        }
        cursor = end + 1;
      }
    }
  }

  private static void checkPortCollisions(Map<String, ComposeNode> services, List<LintIssue> issues) {
    Map<String, Set<String>> used = new LinkedHashMap<>();
    services.forEach((name, config) -> config.asMapping()
        .flatMap(m -> m.get("ports"))
        .flatMap(ComposeNode::asSequence)
        .ifPresent(ports -> {
          for (ComposeNode port : ports.items()) {
            PortBinding.fromNode(port)
                .ifPresent(b -> used.computeIfAbsent(b.key(), k -> new LinkedHashSet<>()).add(name));
          }
        }));
    used.forEach((port, owners) -> {
      if (owners.size() > 1) {
        issues.add(LintIssue.error(LintRule.PORT_COLLISION, String.format(
            "Port %s used by multiple services: %s", port, String.join(", ", owners))));
      }
    });
  }

  /** Names referenced by a list of strings or by the keys of a mapping. */
  private static List<String> referencedNames(Optional<ComposeNode> node) {
    if (node.isEmpty()) {
      return List.of();
    }
    if (node.get() instanceof SequenceNode seq) {
      return seq.items().stream()
          .filter(n -> n instanceof ComposeNode.StringNode)
          .map(n -> ((ComposeNode.StringNode) n).value())
          .toList();
    }
    if (node.get() instanceof MappingNode map) {
      return List.copyOf(map.entries().keySet());
    }
    return List.of();
  }

  /**
   * Returns the named volume a mount refers to; bind mounts, anonymous volumes, and variable sources yield empty.
   */
  private static Optional<String> namedVolume(ComposeNode mount) {
    String source;
    if (mount instanceof ComposeNode.StringNode s) {
      String value = s.value();
      int colon = value.indexOf(':');
      source = colon < 0 ? value : value.substring(0, colon);
    } else if (mount instanceof MappingNode m) {
      String type = m.get("type").flatMap(ComposeNode::scalarText).orElse("volume");
      if (!"volume".equals(type)) {
        return Optional.empty();
      }
      source = m.get("source").flatMap(ComposeNode::scalarText).orElse("");
    } else {
      return Optional.empty();
    }
    if (source.isEmpty() || source.contains("/") || source.startsWith(".") || source.startsWith("~")
        || source.contains("$")) {
      return Optional.empty();
    }
    return Optional.of(source);
  }
}
