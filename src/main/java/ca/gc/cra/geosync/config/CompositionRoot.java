package ca.gc.cra.geosync.config;

import ca.gc.cra.geosync.application.pipeline.SyncUseCase;
import ca.gc.cra.geosync.application.port.GeoBackend;
import ca.gc.cra.geosync.application.port.MetricsPort;
import ca.gc.cra.geosync.application.port.PolygonSource;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationEngine;
import ca.gc.cra.geosync.infrastructure.backend.FileGeoBackend;
import ca.gc.cra.geosync.infrastructure.backend.InMemoryGeoBackend;
import ca.gc.cra.geosync.infrastructure.geo.GeoJsonPolygonSource;
import ca.gc.cra.geosync.infrastructure.geo.InMemoryPolygonSource;
import ca.gc.cra.geosync.infrastructure.geo.JtsPointFactory;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import ca.gc.cra.geosync.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the sync use case to the backend family and metrics adapter named by configuration.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so the use case only sees ports.</p>
 * <p><strong>Role:</strong> Composition root invoked by the CLI.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances on each call.</p>
 *
 * @since 0.1.0
 * @see SyncUseCase
 */
public final class CompositionRoot {
  private final SyncConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry.
   *
   * @param config validated run configuration
   */
  public CompositionRoot(SyncConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config validated run configuration
   * @param metrics metrics adapter handed to the use case
   */
  public CompositionRoot(SyncConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the backend family selected by {@link SyncConfig#backend()}.
   *
   * @return new backend; the caller closes it
   */
  public GeoBackend backend() {
    return switch (config.backend()) {
      case FILE -> new FileGeoBackend(config);
      case MEMORY -> {
        JtsPointFactory pointFactory = new JtsPointFactory(config.srid());
        yield new InMemoryGeoBackend(pointFactory, polygonSource(pointFactory));
      }
    };
  }

  /**
   * Builds the sync use case over the given backend.
   *
   * @param backend backend obtained from {@link #backend()}
   * @return ready-to-run use case
   */
  public SyncUseCase syncUseCase(GeoBackend backend) {
    return new SyncUseCase(config, backend, new ReconciliationEngine(), metrics);
  }

  private PolygonSource polygonSource(JtsPointFactory pointFactory) {
    return config.polygon()
        .<PolygonSource>map(polygon -> new GeoJsonPolygonSource(
            polygon.file(), polygon.idProperty(), pointFactory.geometryFactory(), new JsonSupport()))
        .orElseGet(() -> new InMemoryPolygonSource(List.of()));
  }
}
