package ca.gc.cra.geosync.domain.reconcile;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranks rows sharing a key by their position in the table. Computed per call, never stored.
 *
 * @since 0.1.0
 */
final class OccurrenceIndex {
  private OccurrenceIndex() {}

  /**
   * Returns the 0-based rank of each key among equal keys, in table order.
   *
   * @param keys normalized keys
   * @return rank per position
   */
  static int[] ranks(List<Object> keys) {
    Map<Object, Integer> seen = new HashMap<>();
    int[] ranks = new int[keys.size()];
    for (int i = 0; i < keys.size(); i++) {
      ranks[i] = seen.merge(keys.get(i), 1, Integer::sum) - 1;
    }
    return ranks;
  }

  static boolean unique(List<Object> keys) {
    Set<Object> seen = new HashSet<>();
    for (Object key : keys) {
      if (!seen.add(key)) {
        return false;
      }
    }
    return true;
  }

  static int duplicatedKeys(List<Object> keys) {
    Map<Object, Integer> counts = new HashMap<>();
    for (Object key : keys) {
      counts.merge(key, 1, Integer::sum);
    }
    int duplicated = 0;
    for (int count : counts.values()) {
      if (count > 1) {
        duplicated++;
      }
    }
    return duplicated;
  }

  /** Key paired with its occurrence rank. */
  record Slot(Object key, int occurrence) {}
}
