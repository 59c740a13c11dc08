/**
 * <strong>Purpose:</strong> Input validation for configuration and CLI values.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 * <p><strong>Security:</strong> Identifiers reaching storage keys are restricted to a safe character set.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.validation;
