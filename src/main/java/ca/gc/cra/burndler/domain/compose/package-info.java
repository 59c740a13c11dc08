/**
 * <strong>Purpose:</strong> Compose document model: the tagged {@link ca.gc.cra.burndler.domain.compose.ComposeNode}
 * tree, merge inputs and results, and lint findings.
 * <p><strong>Pipeline role:</strong> Shared by the compose_merge, linting, and packaging stages.
 * <p><strong>Concurrency:</strong> Immutable value types.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.domain.compose;
