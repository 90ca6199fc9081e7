package ca.gc.cra.geosync.api;

/**
 * <strong>What:</strong> Process exit codes returned by the geosync CLI.
 * <p><strong>Why:</strong> Schedulers react to the numeric status, so each failure class keeps a fixed value.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed; individual units may still have failed and are listed in the log. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** The data directory, config file, or polygon collection could not be read. */
  IO_ERROR(3),
  /** The reference region was missing or ambiguous. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted, e.g. by SIGINT. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
