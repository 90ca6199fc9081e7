package ca.gc.cra.geosync.infrastructure.geo;

import ca.gc.cra.geosync.domain.geo.PointFactory;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

/**
 * {@link PointFactory} backed by a JTS {@link GeometryFactory} with floating precision.
 *
 * @since 0.1.0
 */
public final class JtsPointFactory implements PointFactory {
  private final GeometryFactory geometryFactory;

  public JtsPointFactory(int srid) {
    this.geometryFactory = new GeometryFactory(new PrecisionModel(), srid);
  }

  @Override
  public Point fromXY(double x, double y) {
    return geometryFactory.createPoint(new Coordinate(x, y));
  }

  @Override
  public int srid() {
    return geometryFactory.getSRID();
  }

  /** Factory shared with adapters that build or parse other geometry in the same reference system. */
  public GeometryFactory geometryFactory() {
    return geometryFactory;
  }
}
