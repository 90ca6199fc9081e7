package ca.gc.cra.geosync.domain.geo;

import ca.gc.cra.geosync.domain.record.Record;
import java.util.List;

/**
 * Outcome of {@link GeoValidator#validate(List)}.
 *
 * @param valid records whose coordinates follow the easting &gt; northing convention
 * @param invalid located records that break the convention
 * @param withoutGeometry number of records excluded because they carry no usable point
 * @since 0.1.0
 */
public record ValidationResult(List<Record> valid, List<Record> invalid, int withoutGeometry) {
  public ValidationResult {
    valid = List.copyOf(valid);
    invalid = List.copyOf(invalid);
  }

  public boolean hasInvalid() {
    return !invalid.isEmpty();
  }
}
