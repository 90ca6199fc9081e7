package ca.gc.cra.geosync.domain.geo;

import java.util.Objects;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygonal;

/**
 * Closed planar region identified by a configured id.
 *
 * @param id identifier the region is looked up by
 * @param geometry polygon or multipolygon, never empty
 * @since 0.1.0
 */
public record Region(String id, Geometry geometry) {
  public Region {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(geometry, "geometry");
    if (!(geometry instanceof Polygonal)) {
      throw new IllegalArgumentException(
          "region " + id + " must be a Polygon or MultiPolygon (was " + geometry.getGeometryType() + ")");
    }
    if (geometry.isEmpty()) {
      throw new IllegalArgumentException("region " + id + " has empty geometry");
    }
  }
}
