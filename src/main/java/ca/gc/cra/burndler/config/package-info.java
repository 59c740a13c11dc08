/**
 * <strong>Purpose:</strong> Configuration loading, precedence, and wiring for the Burndler CLI.
 * <p><strong>Pipeline role:</strong> Runs before any build; defaults, YAML, and CLI values are merged into a
 * {@link ca.gc.cra.burndler.config.BurndlerConfig} and handed to the
 * {@link ca.gc.cra.burndler.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Loaders and mergers are stateless.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.config;
