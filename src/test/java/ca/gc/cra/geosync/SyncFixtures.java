package ca.gc.cra.geosync;

import ca.gc.cra.geosync.domain.geo.PointFactory;
import ca.gc.cra.geosync.domain.geo.Region;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;

/** Shared builders for rows, tables, and regions in tests. */
public final class SyncFixtures {
  public static final GeometryFactory GEOMETRY = new GeometryFactory(new PrecisionModel(), 5514);

  private SyncFixtures() {}

  /** Builds a record from alternating field names and values, keeping their order. */
  public static Record row(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("expected name/value pairs");
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      fields.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return Record.of(fields);
  }

  public static Table table(List<String> columns, Record... rows) {
    return Table.of(columns, Arrays.asList(rows));
  }

  public static Point point(double x, double y) {
    return GEOMETRY.createPoint(new Coordinate(x, y));
  }

  public static PointFactory points() {
    return new PointFactory() {
      @Override
      public Point fromXY(double x, double y) {
        return point(x, y);
      }

      @Override
      public int srid() {
        return GEOMETRY.getSRID();
      }
    };
  }

  /** Axis-aligned rectangular region. */
  public static Region rectangle(String id, double minX, double minY, double maxX, double maxY) {
    Coordinate[] ring = {
        new Coordinate(minX, minY),
        new Coordinate(maxX, minY),
        new Coordinate(maxX, maxY),
        new Coordinate(minX, maxY),
        new Coordinate(minX, minY)
    };
    return new Region(id, GEOMETRY.createPolygon(ring));
  }

  /** Values of one column across the table, in row order. */
  public static List<Object> column(Table table, String name) {
    List<Object> values = new ArrayList<>(table.size());
    for (Record record : table.rows()) {
      values.add(record.get(name));
    }
    return values;
  }
}
