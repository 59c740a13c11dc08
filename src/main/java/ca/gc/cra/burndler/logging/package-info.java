/**
 * Logging setup and log-safe formatting helpers. SLF4J is the API; Logback is the binding.
 *
 * @since 0.1.0
 */
package ca.gc.cra.burndler.logging;
