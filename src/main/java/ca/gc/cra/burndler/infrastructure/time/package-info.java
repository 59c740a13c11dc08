/**
 * Time adapters implementing {@link ca.gc.cra.burndler.application.port.ClockPort}.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.infrastructure.time;
