package ca.gc.cra.geosync.domain.geo;

import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import org.locationtech.jts.geom.Point;

/**
 * <strong>What:</strong> Builds point geometry from coordinate fields and classifies points against the
 * regional axis convention.
 * <p><strong>Why:</strong> The projected system used for the area of interest has easting greater than
 * northing everywhere, so a point with {@code x <= y} almost always had its axes exchanged upstream.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable collaborators; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class GeoValidator {
  private final CoordinateFields fields;
  private final PointFactory points;

  /**
   * Creates a validator bound to a coordinate layout.
   *
   * @param fields names of the x/y fields
   * @param points factory used to (re)build geometry
   */
  public GeoValidator(CoordinateFields fields, PointFactory points) {
    this.fields = Objects.requireNonNull(fields, "fields");
    this.points = Objects.requireNonNull(points, "points");
  }

  public CoordinateFields fields() {
    return fields;
  }

  /**
   * Attaches a point to every row whose coordinate fields are both numeric. Rows with a missing or
   * non-numeric coordinate get no geometry.
   *
   * @param table extracted rows
   * @return table with geometry populated
   */
  public Table attachGeometry(Table table) {
    List<Record> located = new ArrayList<>(table.size());
    for (Record row : table.rows()) {
      located.add(row.withGeometry(pointFor(row)));
    }
    return table.withRows(located);
  }

  /**
   * Splits located records into valid and invalid; records without geometry go to neither list.
   *
   * @param records records to classify
   * @return classification with the count of excluded records
   */
  public ValidationResult validate(List<Record> records) {
    List<Record> valid = new ArrayList<>();
    List<Record> invalid = new ArrayList<>();
    int withoutGeometry = 0;
    for (Record record : records) {
      if (!record.hasGeometry()) {
        withoutGeometry++;
        continue;
      }
      Point point = record.geometry().orElseThrow();
      if (point.getX() > point.getY()) {
        valid.add(record);
      } else {
        invalid.add(record);
      }
    }
    return new ValidationResult(valid, invalid, withoutGeometry);
  }

  /**
   * Exchanges the x and y fields of every record and regenerates its geometry. Input records are not
   * modified.
   *
   * @param records records to correct
   * @return swapped copies in the same order
   */
  public List<Record> swap(List<Record> records) {
    List<Record> swapped = new ArrayList<>(records.size());
    for (Record record : records) {
      Object x = record.get(fields.x());
      Object y = record.get(fields.y());
      Record exchanged = record.withField(fields.x(), y).withField(fields.y(), x);
      Point point = pointFor(exchanged);
      if (point == null && record.hasGeometry()) {
        Point original = record.geometry().orElseThrow();
        point = points.fromXY(original.getY(), original.getX());
      }
      swapped.add(exchanged.withGeometry(point));
    }
    return swapped;
  }

  private Point pointFor(Record row) {
    OptionalDouble x = FieldValues.toDouble(row.get(fields.x()));
    OptionalDouble y = FieldValues.toDouble(row.get(fields.y()));
    if (x.isEmpty() || y.isEmpty()) {
      return null;
    }
    return points.fromXY(x.getAsDouble(), y.getAsDouble());
  }
}
