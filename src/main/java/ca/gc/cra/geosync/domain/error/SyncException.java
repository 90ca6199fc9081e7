package ca.gc.cra.geosync.domain.error;

/**
 * Checked base type for failures raised while reconciling and committing a batch.
 *
 * @since 0.1.0
 */
public class SyncException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public SyncException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause
   */
  public SyncException(String msg, Throwable cause) { super(msg, cause); }
}
