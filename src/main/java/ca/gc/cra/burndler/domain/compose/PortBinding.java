package ca.gc.cra.burndler.domain.compose;

import java.util.Optional;

/**
 * Host side of a compose port mapping.
 *
 * <p>Short syntax forms: {@code "80"} (container only), {@code "8080:80"}, {@code "127.0.0.1:8080:80"},
 * optionally suffixed with {@code /tcp} or {@code /udp}. Two bindings collide when their {@link #key()}
 * values are equal.
 *
 * @param hostIp bind address, or {@code null} when none was given
 * @param hostPort published host port literal
 * @since 0.1.0
 */
public record PortBinding(String hostIp, String hostPort) {

  /**
   * Extracts the host binding from a short-syntax port string.
   *
   * @param spec port entry as written in the document
   * @return host binding, or empty when the entry publishes no host port
   */
  public static Optional<PortBinding> parse(String spec) {
    if (spec == null) {
      return Optional.empty();
    }
    String value = spec.trim();
    int slash = value.indexOf('/');
    if (slash >= 0) {
      value = value.substring(0, slash);
    }
    String[] parts = value.split(":", -1);
    if (parts.length == 2 && !parts[0].isEmpty()) {
      return Optional.of(new PortBinding(null, parts[0]));
    }
    if (parts.length == 3 && !parts[1].isEmpty()) {
      return Optional.of(new PortBinding(parts[0].isEmpty() ? null : parts[0], parts[1]));
    }
    return Optional.empty();
  }

  /**
   * Extracts the host binding from any port entry node: short-syntax strings or long-syntax mappings
   * carrying {@code published}.
   *
   * @param node port entry
   * @return host binding when one is published
   */
  public static Optional<PortBinding> fromNode(ComposeNode node) {
    if (node instanceof ComposeNode.StringNode s) {
      return parse(s.value());
    }
    if (node instanceof ComposeNode.MappingNode m) {
      Optional<String> published = m.get("published").flatMap(ComposeNode::scalarText);
      if (published.isEmpty() || published.get().isBlank()) {
        return Optional.empty();
      }
      String ip = m.get("host_ip").flatMap(ComposeNode::scalarText).orElse(null);
      return Optional.of(new PortBinding(ip, published.get()));
    }
    return Optional.empty();
  }

  /** Collision key: the host port, prefixed by the bind address when one is set. */
  public String key() {
    return hostIp == null ? hostPort : hostIp + ":" + hostPort;
  }
}
