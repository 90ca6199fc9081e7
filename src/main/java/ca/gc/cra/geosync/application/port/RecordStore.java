package ca.gc.cra.geosync.application.port;

import ca.gc.cra.geosync.domain.error.SchemaException;
import ca.gc.cra.geosync.domain.error.StoreCommitException;
import ca.gc.cra.geosync.domain.reconcile.ReconciliationPlan;
import ca.gc.cra.geosync.domain.record.Table;
import java.io.IOException;

/**
 * <strong>What:</strong> Durable table storage consulted and updated by the synchronization workflow.
 * <p><strong>Role:</strong> Port implemented by file-backed and in-memory adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the committed state of a table, or an empty table when none exists.</li>
 *   <li>Apply a {@link ReconciliationPlan} atomically: all of it or none of it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Single-writer; callers serialize work on the same table.</p>
 *
 * @since 0.1.0
 */
public interface RecordStore extends AutoCloseable {
  /**
   * Loads every committed row of a table.
   *
   * @param table table name
   * @param keyColumn key column the caller will reconcile on
   * @return committed rows, or {@link Table#empty()} when the table does not exist
   * @throws IOException when the table cannot be read
   * @throws SchemaException when the stored table exists but lacks {@code keyColumn}
   */
  Table loadAll(String table, String keyColumn) throws IOException, SchemaException;

  /**
   * Applies a plan to a table as a single all-or-nothing change.
   *
   * @param table table name
   * @param plan plan built against the table's current state
   * @return applied counts
   * @throws StoreCommitException when nothing was written, including when the plan is stale
   */
  CommitResult commit(String table, ReconciliationPlan plan) throws StoreCommitException;

  @Override
  default void close() throws Exception {}
}
