package ca.gc.cra.geosync.infrastructure.store;

import ca.gc.cra.geosync.application.port.CommitResult;
import ca.gc.cra.geosync.application.port.RecordStore;
import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.error.StoreCommitException;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationPlan;
import ca.gc.cra.geosync.domain.record.Table;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Process-local record store. A commit swaps in a complete new table, so it is all-or-nothing.
 *
 * @since 0.1.0
 */
public final class InMemoryRecordStore implements RecordStore {
  private final Map<String, Table> tables = new LinkedHashMap<>();

  @Override
  public synchronized Table loadAll(String table, String keyColumn) throws SchemaException {
    Table stored = tables.getOrDefault(Objects.requireNonNull(table, "table"), Table.empty());
    if (!stored.isUndefined() && !stored.hasColumn(keyColumn)) {
      throw new SchemaException("stored table " + table + " has no key column '" + keyColumn + "'");
    }
    return stored;
  }

  @Override
  public synchronized CommitResult commit(String table, ReconciliationPlan plan) throws StoreCommitException {
    Objects.requireNonNull(plan, "plan");
    Table next = TableCommits.apply(table, tables.getOrDefault(table, Table.empty()), plan);
    tables.put(table, next);
    return new CommitResult(table, plan.insertSet().size(), plan.flaggedRows(), next.size());
  }

  /**
   * Seeds or replaces a table without going through a plan.
   *
   * @param table table name
   * @param rows rows to store
   */
  public synchronized void put(String table, Table rows) {
    tables.put(Objects.requireNonNull(table, "table"), Objects.requireNonNull(rows, "rows"));
  }
}
