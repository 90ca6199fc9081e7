package ca.gc.cra.geosync.domain.geo;

import org.locationtech.jts.geom.Point;

/**
 * Builds point geometry in the reference system shared by records and the filtering region.
 *
 * @since 0.1.0
 */
public interface PointFactory {
  /**
   * Creates a point from planar coordinates.
   *
   * @param x easting
   * @param y northing
   * @return point tagged with {@link #srid()}
   */
  Point fromXY(double x, double y);

  /**
   * Returns the spatial reference identifier stamped on created points.
   *
   * @return SRID, e.g. {@code 5514} for S-JTSK / Krovak East North
   */
  int srid();
}
