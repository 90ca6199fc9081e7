package ca.gc.cra.geosync.domain.geo;

import ca.gc.cra.geosync.domain.error.ConfigurationException;
import ca.gc.cra.geosync.domain.record.Record;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

/**
 * Point-in-region membership against a single reference polygon.
 *
 * <p>The region is closed: points on the boundary are members.</p>
 *
 * @since 0.1.0
 */
public final class PolygonFilter {

  /**
   * Keeps the records whose point lies inside or on the boundary of {@code region}. Records without
   * geometry are excluded.
   *
   * @param records candidate records
   * @param region reference region
   * @return matching records in input order
   */
  public List<Record> intersect(List<Record> records, Region region) {
    Objects.requireNonNull(region, "region");
    PreparedGeometry prepared = PreparedGeometryFactory.prepare(region.geometry());
    List<Record> matching = new ArrayList<>();
    for (Record record : records) {
      if (record.hasGeometry() && prepared.covers(record.geometry().orElseThrow())) {
        matching.add(record);
      }
    }
    return matching;
  }

  /**
   * Resolves the single region carrying {@code polygonId} in a polygon collection.
   *
   * @param collection every region the polygon source holds
   * @param polygonId configured identifier
   * @return the unique match
   * @throws ConfigurationException when the collection is empty, nothing matches, or the id is ambiguous
   */
  public Region loadPolygon(Collection<Region> collection, String polygonId) throws ConfigurationException {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(polygonId, "polygonId");
    if (collection.isEmpty()) {
      throw new ConfigurationException("polygon collection contains no polygons");
    }
    List<Region> matches = new ArrayList<>();
    for (Region region : collection) {
      if (polygonId.equals(region.id())) {
        matches.add(region);
      }
    }
    if (matches.isEmpty()) {
      throw new ConfigurationException("no polygon with id '" + polygonId + "' among "
          + collection.size() + " polygons");
    }
    if (matches.size() > 1) {
      throw new ConfigurationException(matches.size() + " polygons share id '" + polygonId
          + "'; the region must be unique");
    }
    return matches.get(0);
  }
}
