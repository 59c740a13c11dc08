package ca.gc.cra.burndler.application.compose;

import ca.gc.cra.burndler.application.port.MetricsPort;
import ca.gc.cra.burndler.application.yaml.YamlSupport;
import ca.gc.cra.burndler.domain.compose.ComposeNode;
import ca.gc.cra.burndler.domain.compose.ComposeNode.MappingNode;
import ca.gc.cra.burndler.domain.compose.ComposeNode.SequenceNode;
import ca.gc.cra.burndler.domain.compose.ComposeNode.StringNode;
import ca.gc.cra.burndler.domain.compose.MergeResult;
import ca.gc.cra.burndler.domain.compose.Module;
import ca.gc.cra.burndler.domain.compose.PortBinding;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Combines compose fragments from several modules into one namespaced document.
 * <p><strong>Why:</strong> Independent containers declare services such as {@code web} or {@code db} freely;
 * prefixing each with {@code <module>__} lets them coexist in a single installation.</p>
 * <p><strong>Role:</strong> Application service behind the compose_merge build stage and the {@code merge} CLI.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Prefix every service, network, and volume with its module name.</li>
 *   <li>Rewrite same-module {@code depends_on}, network, and named volume references to the prefixed names.</li>
 *   <li>Substitute {@code ${VAR}} placeholders in service definitions.</li>
 *   <li>Warn about host ports published by more than one service.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics port; safe to share.</p>
 * <p><strong>Observability:</strong> Emits {@code merge.modules} and {@code merge.warnings}; logs warnings at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ComposeMerger {
  private static final Logger log = LoggerFactory.getLogger(ComposeMerger.class);

  /** Compose file format version stamped on every merged document. */
  public static final String COMPOSE_VERSION = "3.9";

  private static final String SEPARATOR = "__";

  private final YamlSupport yaml;
  private final MetricsPort metrics;

  public ComposeMerger(YamlSupport yaml, MetricsPort metrics) {
    this.yaml = Objects.requireNonNull(yaml, "yaml");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Merges modules in the given order.
   *
   * @param modules compose fragments; later modules win if two produce the same prefixed name
   * @param globalVariables variables that override every module's own defaults
   * @return merged document, name mappings, and warnings
   * @throws ComposeParseException when a module's compose text is not a YAML mapping
   */
  public MergeResult merge(List<Module> modules, Map<String, String> globalVariables) {
    Objects.requireNonNull(modules, "modules");
    Map<String, String> global = globalVariables == null ? Map.of() : globalVariables;

    Map<String, ComposeNode> services = new LinkedHashMap<>();
    Map<String, ComposeNode> networks = new LinkedHashMap<>();
    Map<String, ComposeNode> volumes = new LinkedHashMap<>();
    Map<String, Map<String, String>> mappings = new LinkedHashMap<>();

    for (Module module : modules) {
      MappingNode compose = parse(module);
      Map<String, ComposeNode> moduleServices = section(compose, "services");
      Map<String, ComposeNode> moduleNetworks = section(compose, "networks");
      Map<String, ComposeNode> moduleVolumes = section(compose, "volumes");

      Map<String, String> names = mappings.computeIfAbsent(module.name(), k -> new LinkedHashMap<>());
      Scope scope = new Scope(module.name(), moduleServices.keySet(), moduleNetworks.keySet(),
          moduleVolumes.keySet());
      VariableSubstitutor substitutor = new VariableSubstitutor(global, module.variables());

      moduleServices.forEach((name, config) -> {
        String prefixed = scope.prefix(name);
        names.put(name, prefixed);
        ComposeNode rewritten = config;
        if (config instanceof MappingNode service) {
          rewritten = substitutor.apply(rewriteReferences(service, scope));
        }
        putUnique(services, prefixed, rewritten, "service");
      });
      moduleNetworks.forEach((name, config) -> {
        String prefixed = scope.prefix(name);
        names.put(name, prefixed);
        putUnique(networks, prefixed, config, "network");
      });
      moduleVolumes.forEach((name, config) -> {
        String prefixed = scope.prefix(name);
        names.put(name, prefixed);
        putUnique(volumes, prefixed, config, "volume");
      });
    }

    List<String> warnings = portCollisions(services);

    Map<String, ComposeNode> root = new LinkedHashMap<>();
    root.put("version", new StringNode(COMPOSE_VERSION));
    if (!services.isEmpty()) {
      root.put("services", MappingNode.of(services));
    }
    if (!networks.isEmpty()) {
      root.put("networks", MappingNode.of(networks));
    }
    if (!volumes.isEmpty()) {
      root.put("volumes", MappingNode.of(volumes));
    }
    MappingNode document = MappingNode.of(root);

    metrics.observe("merge.modules", modules.size());
    metrics.observe("merge.warnings", warnings.size());
    warnings.forEach(w -> log.warn("Merge warning: {}", w));
    log.debug("Merged {} module(s) into {} service(s)", modules.size(), services.size());
    return new MergeResult(yaml.dump(document), document, mappings, warnings);
  }

  private MappingNode parse(Module module) {
    try {
      return yaml.parseMapping(module.compose());
    } catch (IllegalArgumentException ex) {
      throw new ComposeParseException("failed to parse compose for module " + module.name(), ex);
    }
  }

  private static Map<String, ComposeNode> section(MappingNode compose, String key) {
    return compose.mapping(key).map(MappingNode::entries).orElse(Map.of());
  }

  private static void putUnique(Map<String, ComposeNode> target, String name, ComposeNode value, String kind) {
    if (target.put(name, value) != null) {
      log.warn("Merged {} {} declared twice; the later declaration replaces the earlier one", kind, name);
    }
  }

  private static MappingNode rewriteReferences(MappingNode service, Scope scope) {
    MappingNode out = service;
    Optional<ComposeNode> dependsOn = service.get("depends_on");
    if (dependsOn.isPresent()) {
      out = out.with("depends_on", renameEntries(dependsOn.get(), scope.services(), scope));
    }
    Optional<ComposeNode> serviceNetworks = service.get("networks");
    if (serviceNetworks.isPresent()) {
      out = out.with("networks", renameEntries(serviceNetworks.get(), scope.networks(), scope));
    }
    Optional<ComposeNode> serviceVolumes = service.get("volumes");
    if (serviceVolumes.isPresent() && serviceVolumes.get() instanceof SequenceNode seq) {
      List<ComposeNode> items = new ArrayList<>(seq.items().size());
      for (ComposeNode item : seq.items()) {
        items.add(renameVolumeMount(item, scope));
      }
      out = out.with("volumes", SequenceNode.of(items));
    }
    return out;
  }

  /** Renames list items or mapping keys that name an entity declared in the same module. */
  private static ComposeNode renameEntries(ComposeNode node, Set<String> declared, Scope scope) {
    if (node instanceof SequenceNode seq) {
      List<ComposeNode> items = new ArrayList<>(seq.items().size());
      for (ComposeNode item : seq.items()) {
        if (item instanceof StringNode s && declared.contains(s.value())) {
          items.add(new StringNode(scope.prefix(s.value())));
        } else {
          items.add(item);
        }
      }
      return SequenceNode.of(items);
    }
    if (node instanceof MappingNode map) {
      Map<String, ComposeNode> entries = new LinkedHashMap<>();
      map.entries().forEach((k, v) -> entries.put(declared.contains(k) ? scope.prefix(k) : k, v));
      return MappingNode.of(entries);
    }
    return node;
  }

  private static ComposeNode renameVolumeMount(ComposeNode mount, Scope scope) {
    if (mount instanceof StringNode s) {
      String value = s.value();
      int colon = value.indexOf(':');
      String source = colon < 0 ? value : value.substring(0, colon);
      if (colon > 0 && scope.volumes().contains(source)) {
        return new StringNode(scope.prefix(source) + value.substring(colon));
      }
      return mount;
    }
    if (mount instanceof MappingNode m) {
      Optional<String> source = m.get("source").flatMap(ComposeNode::scalarText);
      if (source.isPresent() && scope.volumes().contains(source.get())) {
        return m.with("source", new StringNode(scope.prefix(source.get())));
      }
    }
    return mount;
  }

  private static List<String> portCollisions(Map<String, ComposeNode> services) {
    Map<String, String> used = new LinkedHashMap<>();
    List<String> warnings = new ArrayList<>();
    services.forEach((name, config) -> {
      Optional<SequenceNode> ports = config.asMapping().flatMap(m -> m.get("ports")).flatMap(ComposeNode::asSequence);
      if (ports.isEmpty()) {
        return;
      }
      for (ComposeNode port : ports.get().items()) {
        Optional<PortBinding> binding = PortBinding.fromNode(port);
        if (binding.isEmpty()) {
          continue;
        }
        String key = binding.get().key();
        String existing = used.putIfAbsent(key, name);
        if (existing != null && !existing.equals(name)) {
          warnings.add(String.format("Port collision: %s used by both %s and %s", key, existing, name));
        }
      }
    });
    return warnings;
  }

  private record Scope(String module, Set<String> services, Set<String> networks, Set<String> volumes) {
    String prefix(String name) {
      return module + SEPARATOR + name;
    }
  }
}
