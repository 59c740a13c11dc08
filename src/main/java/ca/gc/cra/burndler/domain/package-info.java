/**
 * <strong>Purpose:</strong> Burndler domain model shared by the compose, rules, template, and packaging use cases.
 * <p><strong>Concurrency:</strong> Value types are immutable unless documented otherwise.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.domain;
