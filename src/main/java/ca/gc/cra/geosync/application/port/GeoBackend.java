package ca.gc.cra.geosync.application.port;

import ca.gc.cra.geosync.domain.geo.PointFactory;

/**
 * Capability set of one backend family: extraction, storage, region lookup, and point construction.
 * Variants are chosen once at composition time.
 *
 * @since 0.1.0
 */
public interface GeoBackend extends AutoCloseable {
  RecordExtractor extractor();

  RecordStore store();

  PolygonSource polygonSource();

  PointFactory pointFactory();

  @Override
  default void close() throws Exception {
    store().close();
  }
}
