/**
 * <strong>Purpose:</strong> Build model: targets, members, configurations, build records, and package manifests.
 * <p><strong>Pipeline role:</strong> Inputs and outputs of {@code BuildOrchestrator}; {@link
 * ca.gc.cra.burndler.domain.build.BuildContext} carries intermediate results between stages.
 * <p><strong>Concurrency:</strong> Records are immutable; {@code BuildContext} is confined to one build thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.domain.build;
