package ca.gc.cra.geosync.domain.reconcile;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Split of a candidate schema relative to a persisted schema.
 *
 * @param key key column, implicitly shared
 * @param shared columns present on both sides, key excluded
 * @param added columns only the candidates carry, in candidate order
 * @since 0.1.0
 */
public record ColumnPartition(String key, List<String> shared, List<String> added) {
  public ColumnPartition {
    Objects.requireNonNull(key, "key");
    shared = List.copyOf(shared);
    added = List.copyOf(added);
  }

  /**
   * Classifies candidate columns against persisted columns.
   *
   * @param persisted persisted schema
   * @param candidates candidate schema
   * @param key key column
   * @return partition
   */
  public static ColumnPartition of(List<String> persisted, List<String> candidates, String key) {
    List<String> shared = new ArrayList<>();
    List<String> added = new ArrayList<>();
    for (String column : candidates) {
      if (column.equals(key)) {
        continue;
      }
      if (persisted.contains(column)) {
        shared.add(column);
      } else {
        added.add(column);
      }
    }
    return new ColumnPartition(key, shared, added);
  }
}
