package ca.gc.cra.geosync.domain.error;

/**
 * Raised by a record store when an atomic commit could not be applied. Nothing from the batch
 * was written; callers may reload and retry the whole batch.
 *
 * @since 0.1.0
 */
public final class StoreCommitException extends SyncException {
  public StoreCommitException(String msg) { super(msg); }

  public StoreCommitException(String msg, Throwable cause) { super(msg, cause); }
}
