package ca.gc.cra.geosync.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    assertNull(OpenTelemetryBootstrap.initialize());
    OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter();
    assertTrue(adapter.isNoop(), "Expected noop adapter when exporter=none");
    adapter.increment("sync.unit.succeeded");
    adapter.observe("sync.run.durationMs", 5L);
    adapter.close();
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=test, broken, =x, team = gis ");

    assertEquals(2, attributes.size());
    assertEquals("test", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("gis", attributes.get(AttributeKey.stringKey("team")));
  }
}
