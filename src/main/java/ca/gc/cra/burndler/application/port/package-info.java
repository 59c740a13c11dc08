/**
 * <strong>Purpose:</strong> Ports the build pipeline depends on: artifact storage, build persistence, metrics,
 * and time.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Storage keys arrive unsanitized; adapters confine them to their own root.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.application.port;
