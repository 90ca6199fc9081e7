package ca.gc.cra.geosync.domain.reconcile;

import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.record.FieldValues;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Classifies an incoming batch against the persisted table into inserts and updates.
 * <p><strong>Why:</strong> Sources republish whole datasets; running the same batch twice must converge on
 * the same stored state without losing or duplicating rows.</p>
 * <p><strong>Role:</strong> Core use-case logic between validated batches and the record store.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject batches without their key column or with rows lacking a key.</li>
 *   <li>Route every incoming row to exactly one of the insert or update sets.</li>
 *   <li>Align an update mask with the persisted rows and compute their merged replacement.</li>
 *   <li>Promote candidate occurrences the persisted table cannot absorb into the insert set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use on distinct tables.</p>
 * <p><strong>Performance:</strong> Linear in persisted plus incoming rows; tables are fully materialized.</p>
 *
 * @since 0.1.0
 */
public final class ReconciliationEngine {
  private final ColumnMerger merger;

  public ReconciliationEngine() {
    this(new ColumnMerger());
  }

  public ReconciliationEngine(ColumnMerger merger) {
    this.merger = Objects.requireNonNull(merger, "merger");
  }

  /**
   * Builds the write plan for {@code incoming} against {@code persisted}.
   *
   * @param persisted committed rows, or {@link Table#empty()} when the table does not exist yet
   * @param incoming validated rows to apply
   * @param keyColumn primary key column
   * @return plan describing inserts, updates, and the merged persisted rows
   * @throws SchemaException when the key column is missing or a row has no key value
   */
  public ReconciliationPlan reconcile(Table persisted, Table incoming, String keyColumn)
      throws SchemaException {
    Objects.requireNonNull(persisted, "persisted");
    Objects.requireNonNull(incoming, "incoming");
    Objects.requireNonNull(keyColumn, "keyColumn");

    requireKey(persisted, keyColumn, "persisted");
    requireKey(incoming, keyColumn, "incoming");

    List<Object> persistedKeys = persisted.keys(keyColumn);
    List<Object> incomingKeys = incoming.keys(keyColumn);
    Set<Object> known = new HashSet<>(persistedKeys);

    List<Integer> updatePositions = new ArrayList<>();
    List<Record> candidates = new ArrayList<>();
    for (int i = 0; i < incoming.size(); i++) {
      if (known.contains(incomingKeys.get(i))) {
        updatePositions.add(i);
        candidates.add(incoming.row(i));
      }
    }

    MergeResult merge = merger.merge(persisted, Table.of(incoming.columns(), candidates), keyColumn);

    boolean[] promoted = new boolean[incoming.size()];
    for (int unmatched : merge.unmatchedCandidates()) {
      promoted[updatePositions.get(unmatched)] = true;
    }

    Set<String> schema = new LinkedHashSet<>(persisted.columns());
    schema.addAll(incoming.columns());
    List<String> schemaColumns = List.copyOf(schema);

    List<Record> inserts = new ArrayList<>();
    List<Record> updates = new ArrayList<>();
    Set<Object> updateKeys = new HashSet<>();
    for (int i = 0; i < incoming.size(); i++) {
      Record row = incoming.row(i);
      if (!known.contains(incomingKeys.get(i)) || promoted[i]) {
        inserts.add(row);
      } else {
        updates.add(row);
        updateKeys.add(incomingKeys.get(i));
      }
    }

    List<Boolean> mask = new ArrayList<>(persisted.size());
    int changed = 0;
    Table merged = merge.merged();
    for (int i = 0; i < persisted.size(); i++) {
      boolean flagged = updateKeys.contains(persistedKeys.get(i));
      mask.add(flagged);
      if (flagged && !merged.row(i).sameContent(persisted.row(i))) {
        changed++;
      }
    }

    return new ReconciliationPlan(
        Table.of(schemaColumns, inserts).conformTo(schemaColumns),
        Table.of(incoming.columns(), updates),
        mask,
        merged.conformTo(schemaColumns),
        schemaColumns,
        merge.mode(),
        changed);
  }

  private static void requireKey(Table table, String keyColumn, String label) throws SchemaException {
    if (table.isUndefined()) {
      return;
    }
    if (!table.hasColumn(keyColumn)) {
      throw new SchemaException(label + " table has no key column '" + keyColumn + "' (columns: "
          + table.columns() + ")");
    }
    List<Object> keys = table.keys(keyColumn);
    for (int i = 0; i < keys.size(); i++) {
      if (keys.get(i) == FieldValues.ABSENT) {
        throw new SchemaException(label + " row " + i + " has no value for key column '" + keyColumn + "'");
      }
    }
  }
}
