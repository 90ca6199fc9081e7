package ca.gc.cra.geosync.domain.error;

/**
 * Raised when the configured reference region cannot be resolved to exactly one polygon.
 * Aborts the whole run.
 *
 * @since 0.1.0
 */
public final class ConfigurationException extends SyncException {
  public ConfigurationException(String msg) { super(msg); }

  public ConfigurationException(String msg, Throwable cause) { super(msg, cause); }
}
