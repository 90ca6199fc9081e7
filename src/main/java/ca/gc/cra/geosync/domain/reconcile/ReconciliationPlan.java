package ca.gc.cra.geosync.domain.reconcile;

import ca.gc.cra.geosync.domain.record.Table;
import java.util.List;
import java.util.Objects;

/**
 * Write plan produced by {@link ReconciliationEngine#reconcile}.
 *
 * <p>Applying the plan means: replace every persisted row {@code i} with {@code mergedPersisted.row(i)}
 * where {@code updateMask.get(i)} is true, then append {@code insertSet}.</p>
 *
 * @param insertSet incoming rows to append, conformed to {@code schema}
 * @param updateSet incoming rows that update existing rows
 * @param updateMask one flag per persisted row, true where the row is targeted by {@code updateSet}
 * @param mergedPersisted persisted rows with updates applied, aligned with the persisted table
 * @param schema column layout of the table after the commit
 * @param mode pairing mode used by the merge
 * @param changedRows flagged rows whose content actually differs after the merge
 * @since 0.1.0
 */
public record ReconciliationPlan(
    Table insertSet,
    Table updateSet,
    List<Boolean> updateMask,
    Table mergedPersisted,
    List<String> schema,
    MergeMode mode,
    int changedRows) {

  public ReconciliationPlan {
    Objects.requireNonNull(insertSet, "insertSet");
    Objects.requireNonNull(updateSet, "updateSet");
    Objects.requireNonNull(mergedPersisted, "mergedPersisted");
    Objects.requireNonNull(mode, "mode");
    updateMask = List.copyOf(updateMask);
    schema = List.copyOf(schema);
    if (updateMask.size() != mergedPersisted.size()) {
      throw new IllegalArgumentException("update mask covers " + updateMask.size()
          + " rows but merged table has " + mergedPersisted.size());
    }
  }

  /**
   * Returns how many persisted rows the mask flags.
   *
   * @return number of true mask entries
   */
  public int flaggedRows() {
    int flagged = 0;
    for (Boolean flag : updateMask) {
      if (flag) {
        flagged++;
      }
    }
    return flagged;
  }

  /**
   * Returns whether committing the plan would leave the stored data unchanged.
   *
   * @return {@code true} when there is nothing to write
   */
  public boolean isNoOp() {
    return insertSet.isEmpty() && changedRows == 0;
  }
}
