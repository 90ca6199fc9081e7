package ca.gc.cra.geosync.domain.geo;

import java.util.Objects;

/**
 * Names of the two fields holding a record's planar coordinates.
 *
 * @param x field carrying the easting
 * @param y field carrying the northing
 * @since 0.1.0
 */
public record CoordinateFields(String x, String y) {
  public CoordinateFields {
    Objects.requireNonNull(x, "x");
    Objects.requireNonNull(y, "y");
    if (x.isBlank() || y.isBlank()) {
      throw new IllegalArgumentException("coordinate field names must not be blank");
    }
    if (x.equals(y)) {
      throw new IllegalArgumentException("coordinate fields must differ (both were '" + x + "')");
    }
  }
}
