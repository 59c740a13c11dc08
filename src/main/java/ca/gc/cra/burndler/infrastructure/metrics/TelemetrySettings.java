package ca.gc.cra.burndler.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Metrics exporter settings resolved from configuration.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP endpoint; blank falls back to {@code OTEL_EXPORTER_OTLP_ENDPOINT} or the local collector
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "otlp" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    endpoint = endpoint == null ? "" : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /** Settings that disable export entirely. */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", "", "");
  }

  public boolean enabled() {
    return Objects.equals(exporter, "otlp");
  }
}
