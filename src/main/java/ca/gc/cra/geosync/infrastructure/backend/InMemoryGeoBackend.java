package ca.gc.cra.geosync.infrastructure.backend;

import ca.gc.cra.geosync.application.port.GeoBackend;
import ca.gc.cra.geosync.application.port.PolygonSource;
import ca.gc.cra.geosync.application.port.RecordExtractor;
import ca.gc.cra.geosync.domain.geo.PointFactory;
import ca.gc.cra.geosync.infrastructure.extract.NdjsonRecordExtractor;
import ca.gc.cra.geosync.infrastructure.geo.JtsPointFactory;
import ca.gc.cra.geosync.infrastructure.json.JsonSupport;
import ca.gc.cra.geosync.infrastructure.store.InMemoryRecordStore;
import java.util.Objects;

/**
 * Backend family keeping tables in process memory. Sources are still read as NDJSON files; the region
 * collection is whatever the caller supplies, typically a GeoJSON file or a fixed list in tests.
 *
 * @since 0.1.0
 */
public final class InMemoryGeoBackend implements GeoBackend {
  private final JtsPointFactory pointFactory;
  private final RecordExtractor extractor;
  private final InMemoryRecordStore store = new InMemoryRecordStore();
  private final PolygonSource polygonSource;

  public InMemoryGeoBackend(JtsPointFactory pointFactory, PolygonSource polygonSource) {
    this.pointFactory = Objects.requireNonNull(pointFactory, "pointFactory");
    this.polygonSource = Objects.requireNonNull(polygonSource, "polygonSource");
    this.extractor = new NdjsonRecordExtractor(new JsonSupport());
  }

  @Override
  public RecordExtractor extractor() {
    return extractor;
  }

  @Override
  public InMemoryRecordStore store() {
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
