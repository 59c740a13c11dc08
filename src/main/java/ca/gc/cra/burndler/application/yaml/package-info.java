/**
 * <strong>Purpose:</strong> YAML reading and writing over compose node trees, backed by SnakeYAML.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.burndler.application.yaml.YamlSupport} is safe to share.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.yaml;
