/**
 * <strong>Purpose:</strong> Dependency rule model: rules, compiled conditions, typed values, and violations.
 * <p><strong>Pipeline role:</strong> Consumed by the configuration stage before templates render.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.domain.rules;
