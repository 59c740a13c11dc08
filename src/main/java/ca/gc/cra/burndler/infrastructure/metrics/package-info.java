/**
 * OpenTelemetry implementation of {@link ca.gc.cra.burndler.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for parallel builds.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code build.*}, {@code merge.*}, {@code lint.*}, and
 * {@code package.*} namespaces.</p>
 * <p><strong>Security:</strong> Only metric keys and counts are exported, never rendered content.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.infrastructure.metrics;
