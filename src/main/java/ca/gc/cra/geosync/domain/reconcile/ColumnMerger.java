package ca.gc.cra.geosync.domain.reconcile;

import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Applies update candidates onto persisted rows column by column.
 * <p><strong>Role:</strong> Merge step of the reconciliation engine.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Overwrite shared columns of the persisted row paired with a candidate.</li>
 *   <li>Left-join columns only the candidates carry, by key alone.</li>
 *   <li>Report candidates that have no persisted occurrence to pair with.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * <p>Rows pair on (key, occurrence rank). When keys are unique on both sides every rank is zero and this
 * reduces to pairing on key alone, which is reported as {@link MergeMode#KEY_ONLY}. An absent candidate
 * value never overwrites a persisted value. A paired candidate that carries a point replaces the persisted
 * point.</p>
 *
 * @since 0.1.0
 */
public final class ColumnMerger {

  /**
   * Merges update candidates into the persisted table.
   *
   * @param persisted persisted rows; must contain {@code key}
   * @param candidates update candidates; must contain {@code key}
   * @param key key column
   * @return merged rows aligned with {@code persisted}, plus unmatched candidate positions
   */
  public MergeResult merge(Table persisted, Table candidates, String key) {
    Objects.requireNonNull(persisted, "persisted");
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(key, "key");

    List<Object> persistedKeys = persisted.keys(key);
    List<Object> candidateKeys = candidates.keys(key);
    MergeMode mode = OccurrenceIndex.unique(persistedKeys) && OccurrenceIndex.unique(candidateKeys)
        ? MergeMode.KEY_ONLY
        : MergeMode.KEY_AND_OCCURRENCE;
    ColumnPartition partition = ColumnPartition.of(persisted.columns(), candidates.columns(), key);

    int[] candidateRanks = OccurrenceIndex.ranks(candidateKeys);
    Map<OccurrenceIndex.Slot, Integer> bySlot = new HashMap<>();
    Map<Object, Integer> firstByKey = new HashMap<>();
    for (int j = 0; j < candidateKeys.size(); j++) {
      bySlot.put(new OccurrenceIndex.Slot(candidateKeys.get(j), candidateRanks[j]), j);
      firstByKey.putIfAbsent(candidateKeys.get(j), j);
    }

    List<String> mergedColumns = new ArrayList<>(persisted.columns());
    for (String added : partition.added()) {
      if (!mergedColumns.contains(added)) {
        mergedColumns.add(added);
      }
    }

    int[] persistedRanks = OccurrenceIndex.ranks(persistedKeys);
    Set<Integer> paired = new HashSet<>();
    List<Record> merged = new ArrayList<>(persisted.size());
    for (int i = 0; i < persisted.size(); i++) {
      Record current = persisted.row(i);
      Object rowKey = persistedKeys.get(i);
      Integer match = bySlot.get(new OccurrenceIndex.Slot(rowKey, persistedRanks[i]));
      Integer entity = firstByKey.get(rowKey);
      Map<String, Object> values = new LinkedHashMap<>();
      for (String column : persisted.columns()) {
        values.put(column, current.get(column));
      }
      Record source = null;
      if (match != null) {
        paired.add(match);
        source = candidates.row(match);
        for (String column : partition.shared()) {
          Object candidate = source.get(column);
          if (!FieldValues.isAbsent(candidate)) {
            values.put(column, candidate);
          }
        }
      }
      for (String column : partition.added()) {
        values.put(column, entity == null ? FieldValues.ABSENT : candidates.row(entity).get(column));
      }
      Record row = Record.of(values, current.geometry().orElse(null));
      if (source != null && source.hasGeometry()) {
        row = row.withGeometry(source.geometry().orElseThrow());
      }
      merged.add(row);
    }

    List<Integer> unmatched = new ArrayList<>();
    for (int j = 0; j < candidates.size(); j++) {
      if (!paired.contains(j)) {
        unmatched.add(j);
      }
    }
    return new MergeResult(
        Table.of(mergedColumns, merged),
        unmatched,
        mode,
        partition,
        OccurrenceIndex.duplicatedKeys(candidateKeys));
  }
}
