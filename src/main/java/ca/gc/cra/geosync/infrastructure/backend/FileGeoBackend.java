package ca.gc.cra.geosync.infrastructure.backend;

import ca.gc.cra.geosync.application.port.GeoBackend;
import ca.gc.cra.geosync.application.port.PolygonSource;
import ca.gc.cra.geosync.application.port.RecordExtractor;
import ca.gc.cra.geosync.application.port.RecordStore;
import ca.gc.cra.geosync.config.PolygonFilterConfig;
import ca.gc.cra.geosync.config.SyncConfig;
import ca.gc.cra.geosync.domain.geo.PointFactory;
import ca.gc.cra.geosync.infrastructure.extract.NdjsonRecordExtractor;
import ca.gc.cra.geosync.infrastructure.geo.GeoJsonPolygonSource;
import ca.gc.cra.geosync.infrastructure.geo.InMemoryPolygonSource;
import ca.gc.cra.geosync.infrastructure.geo.JtsPointFactory;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import ca.gc.cra.geosync.infrastructure.store.JsonFileRecordStore;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Backend family reading NDJSON sources and keeping tables as JSON files.
 * <p><strong>Role:</strong> {@link GeoBackend} selected by {@code backend=file}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run owns the backend.</p>
 *
 * @since 0.1.0
 */
public final class FileGeoBackend implements GeoBackend {
  private final JtsPointFactory pointFactory;
  private final NdjsonRecordExtractor extractor;
  private final JsonFileRecordStore store;
  private final PolygonSource polygonSource;

  public FileGeoBackend(SyncConfig config) {
    Objects.requireNonNull(config, "config");
    JsonSupport json = new JsonSupport();
    this.pointFactory = new JtsPointFactory(config.srid());
    this.extractor = new NdjsonRecordExtractor(json);
    this.store = new JsonFileRecordStore(config.storeDir(), json, pointFactory.geometryFactory());
    this.polygonSource = config.polygon()
        .map(polygon -> geoJson(polygon, json))
        .orElseGet(() -> new InMemoryPolygonSource(List.of()));
  }

  private PolygonSource geoJson(PolygonFilterConfig polygon, JsonSupport json) {
    return new GeoJsonPolygonSource(polygon.file(), polygon.idProperty(), pointFactory.geometryFactory(), json);
  }

  @Override
  public RecordExtractor extractor() {
    return extractor;
  }

  @Override
  public RecordStore store() {
    return store;
  }

  @Override
  public PolygonSource polygonSource() {
    return polygonSource;
  }

  @Override
  public PointFactory pointFactory() {
    return pointFactory;
  }
}
