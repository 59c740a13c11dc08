/**
 * Build pipeline orchestration.
 *
 * <p><strong>Purpose:</strong> Runs the fixed stage list (validation, configuration, template render, asset
 * resolution, compose merge, linting, packaging) over one {@link ca.gc.cra.burndler.domain.build.BuildContext}.</p>
 * <p><strong>Pipeline role:</strong> Top-level use case; composes the rules, template, compose, and packaging
 * services.</p>
 * <p><strong>Concurrency:</strong> Stages of one build run sequentially on the calling thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.pipeline;
