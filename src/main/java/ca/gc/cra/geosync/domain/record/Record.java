package ca.gc.cra.geosync.domain.record;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.locationtech.jts.geom.Point;

/**
 * <strong>What:</strong> Immutable row of named scalar values with an optional point geometry.
 * <p><strong>Role:</strong> Unit of data flowing from extraction through validation, filtering, and
 * reconciliation into the store.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share.</p>
 *
 * <p>Values are normalized on construction, so a missing field and a {@code null} field both read back as
 * {@link FieldValues#ABSENT}. Field order is kept for output; equality ignores it.</p>
 *
 * @since 0.1.0
 */
public final class Record {
  private final Map<String, Object> fields;
  private final Point geometry;

  private Record(Map<String, Object> fields, Point geometry) {
    this.fields = fields;
    this.geometry = geometry;
  }

  /**
   * Creates a record without geometry.
   *
   * @param fields field values in output order; {@code null} values become {@link FieldValues#ABSENT}
   * @return new record
   */
  public static Record of(Map<String, ?> fields) {
    return of(fields, null);
  }

  /**
   * Creates a record with an optional geometry.
   *
   * @param fields field values in output order
   * @param geometry point geometry, or {@code null}
   * @return new record
   */
  public static Record of(Map<String, ?> fields, Point geometry) {
    Objects.requireNonNull(fields, "fields");
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      String name = Objects.requireNonNull(entry.getKey(), "field name");
      copy.put(name, FieldValues.normalize(entry.getValue()));
    }
    return new Record(Collections.unmodifiableMap(copy), geometry);
  }

  /**
   * Returns the value of a field.
   *
   * @param name field name
   * @return value, or {@link FieldValues#ABSENT} when missing
   */
  public Object get(String name) {
    return fields.getOrDefault(name, FieldValues.ABSENT);
  }

  public boolean has(String name) {
    return fields.containsKey(name);
  }

  public Set<String> fieldNames() {
    return fields.keySet();
  }

  public Map<String, Object> fields() {
    return fields;
  }

  public Optional<Point> geometry() {
    return Optional.ofNullable(geometry);
  }

  /**
   * Returns whether the record carries a usable, non-empty point.
   *
   * @return {@code true} when spatial checks apply to this record
   */
  public boolean hasGeometry() {
    return geometry != null && !geometry.isEmpty();
  }

  /**
   * Returns a copy with one field set.
   *
   * @param name field name
   * @param value new value
   * @return updated copy
   */
  public Record withField(String name, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(fields);
    copy.put(Objects.requireNonNull(name, "name"), FieldValues.normalize(value));
    return new Record(Collections.unmodifiableMap(copy), geometry);
  }

  public Record withGeometry(Point point) {
    return new Record(fields, point);
  }

  /**
   * Returns a copy without the named fields.
   *
   * @param names fields to drop
   * @return updated copy
   */
  public Record without(Collection<String> names) {
    if (names.isEmpty()) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>(fields);
    copy.keySet().removeAll(names);
    return new Record(Collections.unmodifiableMap(copy), geometry);
  }

  /**
   * Returns a copy with fields renamed; names not in {@code renames} are kept. Field order is preserved.
   *
   * @param renames old name to new name
   * @return renamed copy
   */
  public Record renamed(Map<String, String> renames) {
    if (renames.isEmpty()) {
      return this;
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      copy.put(renames.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
    }
    return new Record(Collections.unmodifiableMap(copy), geometry);
  }

  /**
   * Returns whether the record holds no data at all: every field absent and no geometry.
   *
   * @return {@code true} for a blank row
   */
  public boolean isBlank() {
    if (hasGeometry()) {
      return false;
    }
    for (Object value : fields.values()) {
      if (!FieldValues.isAbsent(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a copy laid out exactly on {@code columns}: missing columns read as absent, unknown columns
   * are kept after the listed ones.
   *
   * @param columns target column order
   * @return conformed copy
   */
  public Record conformTo(List<String> columns) {
    Map<String, Object> copy = new LinkedHashMap<>();
    for (String column : columns) {
      copy.put(column, get(column));
    }
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      copy.putIfAbsent(entry.getKey(), entry.getValue());
    }
    return new Record(Collections.unmodifiableMap(copy), geometry);
  }

  /**
   * Compares field values (numerically where applicable) and geometry, treating missing fields as
   * absent.
   *
   * @param other record to compare with
   * @return {@code true} when both records hold the same data
   */
  public boolean sameContent(Record other) {
    if (other == null) {
      return false;
    }
    for (String name : fields.keySet()) {
      if (!FieldValues.sameValue(get(name), other.get(name))) {
        return false;
      }
    }
    for (String name : other.fields.keySet()) {
      if (!fields.containsKey(name) && !FieldValues.isAbsent(other.get(name))) {
        return false;
      }
    }
    return sameGeometry(geometry, other.geometry);
  }

  private static boolean sameGeometry(Point a, Point b) {
    boolean aEmpty = a == null || a.isEmpty();
    boolean bEmpty = b == null || b.isEmpty();
    if (aEmpty || bEmpty) {
      return aEmpty == bEmpty;
    }
    return a.equalsExact(b);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Record other)) {
      return false;
    }
    return fields.equals(other.fields) && sameGeometry(geometry, other.geometry);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return hasGeometry() ? fields + " @ " + geometry : fields.toString();
  }
}
