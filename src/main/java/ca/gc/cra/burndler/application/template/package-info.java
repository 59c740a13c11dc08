/**
 * Template rendering for configuration files.
 *
 * <p><strong>Purpose:</strong> Parses the action language ({@code {{ .field }}}, pipelines, {@code if},
 * {@code range}, {@code with}) and executes it against nested variable maps, with a fixed table of helper
 * functions.</p>
 * <p><strong>Pipeline role:</strong> Used by the template-render build stage and by the {@code render} CLI.</p>
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.burndler.application.template.TemplateEngine} is stateless;
 * parser and executor instances are created per call.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.template;
