package ca.gc.cra.geosync.application.port;

import ca.gc.cra.geosync.domain.error.ConfigurationException;
import ca.gc.cra.geosync.domain.geo.PolygonFilter;
import ca.gc.cra.geosync.domain.geo.Region;
import java.io.IOException;
import java.util.List;

/**
 * Collection of candidate regions the filtering polygon is looked up in.
 *
 * @since 0.1.0
 */
public interface PolygonSource {
  /**
   * Loads every region of the collection.
   *
   * @return regions, possibly sharing ids
   * @throws IOException when the collection cannot be read
   */
  List<Region> loadAll() throws IOException;

  /**
   * Returns the single region carrying {@code polygonId}.
   *
   * @param polygonId region identifier
   * @return the only matching region
   * @throws ConfigurationException when the collection is empty or holds zero or several matches
   * @throws IOException when the collection cannot be read
   */
  default Region get(String polygonId) throws ConfigurationException, IOException {
    return new PolygonFilter().loadPolygon(loadAll(), polygonId);
  }
}
