package ca.gc.cra.geosync.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};
  private final Map<String, String> saved = new HashMap<>();

  @BeforeEach
  void saveProperties() {
    for (String property : PROPERTIES) {
      saved.put(property, System.getProperty(property));
    }
  }

  @AfterEach
  void restoreProperties() {
    for (String property : PROPERTIES) {
      String value = saved.get(property);
      if (value == null) {
        System.clearProperty(property);
      } else {
        System.setProperty(property, value);
      }
    }
  }

  @Test
  void copiesSettingsIntoSystemPropertiesAndConsumesKeys() {
    Map<String, String> settings = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test",
        "backend", "memory"));

    TelemetryConfigurator.configureMetrics(settings);

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("backend", "memory"), settings);
  }

  @Test
  void rejectsUnsupportedValues() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
  }
}
