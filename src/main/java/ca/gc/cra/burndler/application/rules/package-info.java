/**
 * <strong>Purpose:</strong> Dependency rule checking: condition parsing, typed comparison, and rule evaluation.
 * <p><strong>Pipeline role:</strong> Runs in the configuration stage and for asset include conditions.
 * <p><strong>Concurrency:</strong> Stateless services safe for concurrent use.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.rules;
