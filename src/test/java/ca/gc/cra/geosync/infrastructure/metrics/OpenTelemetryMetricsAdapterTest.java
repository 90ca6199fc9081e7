package ca.gc.cra.geosync.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
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
    adapter.increment("sync.commit.success");
    adapter.increment("sync.commit.success");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "sync.commit.success");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("sync.commit.success", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
    assertEquals("geosync", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    assertEquals(OpenTelemetryBootstrap.INSTRUMENTATION_SCOPE, counter.getInstrumentationScopeInfo().getName());
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("sync.run.durationMs", 40L);
    adapter.observe("sync.run.durationMs", 60L);
    adapter.forceFlush();

    MetricData histogram = metric(reader.collectAllMetrics(), "sync.run.durationms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum());
    assertEquals("sync.run.durationMs", point.getAttributes().get(OpenTelemetryMetricsAdapter.METRIC_KEY_ATTRIBUTE));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("sync.records.inserted", OpenTelemetryMetricsAdapter.sanitizeName("sync.records.inserted"));
    assertEquals("m2023_01.units", OpenTelemetryMetricsAdapter.sanitizeName("2023/01.units"));
    assertEquals("geosync.metric", OpenTelemetryMetricsAdapter.sanitizeName("  "));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name + " in " + metrics));
  }
}
