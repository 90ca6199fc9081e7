package ca.gc.cra.geosync.infrastructure.store;

import ca.gc.cra.geosync.domain.error.StoreCommitException;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationPlan;
import ca.gc.cra.geosync.domain.record.Record;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the table state a plan produces. Shared by the store adapters so both apply plans identically.
 */
final class TableCommits {
  private TableCommits() {}

  /**
   * Applies a plan to the current rows of a table.
   *
   * <p>Staleness is detected by row count only: a plan whose update mask does not cover exactly the current
   * rows is rejected, but a concurrent rewrite that keeps the row count is overwritten. Stores rely on the
   * single-writer contract for anything stronger.</p>
   *
   * @param table table name for diagnostics
   * @param current rows currently stored
   * @param plan plan to apply
   * @return next table state
   * @throws StoreCommitException when the plan was built against a table with a different row count
   */
  static Table apply(String table, Table current, ReconciliationPlan plan) throws StoreCommitException {
    List<Boolean> mask = plan.updateMask();
    if (mask.size() != current.size()) {
      throw new StoreCommitException("stale plan for " + table + ": mask covers " + mask.size()
          + " rows but the table holds " + current.size());
    }
    List<Record> next = new ArrayList<>(current.size() + plan.insertSet().size());
    for (int i = 0; i < current.size(); i++) {
      next.add(mask.get(i) ? plan.mergedPersisted().row(i) : current.row(i).conformTo(plan.schema()));
    }
    next.addAll(plan.insertSet().rows());
    return Table.of(plan.schema(), next);
  }
}
