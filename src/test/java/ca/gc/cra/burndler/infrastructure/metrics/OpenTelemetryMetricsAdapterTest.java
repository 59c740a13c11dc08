package ca.gc.cra.burndler.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("burndler.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttributeAndResource() {
    adapter.increment("build.completed");
    adapter.increment("build.completed");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "build.completed").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("build.completed", point.getAttributes().get(METRIC_KEY));
    assertEquals("burndler", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("build.stage.compose_merge.durationNanos", 1_500L);
    adapter.observe("build.stage.compose_merge.durationNanos", 500L);
    adapter.flush();

    MetricData histogram = find(reader.collectAllMetrics(), "build.stage.compose_merge.durationnanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(2_000d, point.getSum());
    assertEquals("build.stage.compose_merge.durationNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void instrumentNamesAreLowerCasedAndStartWithLetter() {
    assertEquals("package.bytes", OpenTelemetryMetricsAdapter.instrumentName("package.bytes"));
    assertEquals("merge_warnings_", OpenTelemetryMetricsAdapter.instrumentName("Merge Warnings!"));
    assertEquals("m7zip", OpenTelemetryMetricsAdapter.instrumentName("7zip"));
    assertEquals("burndler.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  @Test
  void disabledSettingsFallBackToNoop() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize(TelemetrySettings.disabled());
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(result)) {
      noop.increment("build.started");
      noop.observe("package.bytes", 10);
      noop.flush();
    }
  }

  @Test
  void resourceAttributesIgnoreMalformedEntries() {
    var attributes = OpenTelemetryBootstrap.parseResourceAttributes("env=prod, broken, =x, site = hq");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
    assertEquals("hq", attributes.get(AttributeKey.stringKey("site")));
  }

  private static Optional<MetricData> find(Collection<MetricData> metrics, String name) {
    return metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
  }
}
