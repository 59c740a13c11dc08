/**
 * <strong>Purpose:</strong> Compose document handling: YAML codec, namespaced merge, variable substitution,
 * and policy linting.
 * <p><strong>Pipeline role:</strong> compose_merge and linting stages; also backs the {@code merge} and
 * {@code lint} subcommands.
 * <p><strong>Concurrency:</strong> Services are stateless and safe to share; SnakeYAML instances are created
 * per call.
 * <p><strong>Security:</strong> Documents load through SnakeYAML's safe constructor.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.compose;
