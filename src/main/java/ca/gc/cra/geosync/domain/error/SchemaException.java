package ca.gc.cra.geosync.domain.error;

/**
 * Raised when a batch lacks its key or coordinate columns, or a row carries no key value.
 * Fatal to the batch being processed.
 *
 * @since 0.1.0
 */
public final class SchemaException extends SyncException {
  public SchemaException(String msg) { super(msg); }

  public SchemaException(String msg, Throwable cause) { super(msg, cause); }
}
