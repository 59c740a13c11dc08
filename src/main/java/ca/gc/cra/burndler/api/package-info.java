/**
 * <strong>Purpose:</strong> Command-line entry points: {@code merge}, {@code lint}, {@code render}, and
 * {@code build}.
 * <p><strong>Pipeline role:</strong> Outermost adapter; parses {@code key=value} arguments, resolves
 * configuration, invokes the application services, and maps failures to {@link ca.gc.cra.burndler.api.ExitCode}
 * values.</p>
 * <p><strong>Concurrency:</strong> Each invocation runs on the calling thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.api;
