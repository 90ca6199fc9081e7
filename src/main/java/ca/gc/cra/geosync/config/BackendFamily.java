package ca.gc.cra.geosync.config;

import java.util.Locale;

/**
 * Backend family selected at composition time.
 *
 * @since 0.1.0
 */
public enum BackendFamily {
  /** JSON table files on disk. */
  FILE,
  /** Process-local tables; nothing survives the run. */
  MEMORY;

  /**
   * Parses a backend name, defaulting to {@link #FILE}.
   *
   * @param value raw value (case-insensitive); blank selects the default
   * @return parsed backend family
   * @throws IllegalArgumentException when the value is unknown
   */
  public static BackendFamily fromString(String value) {
    if (value == null || value.isBlank()) {
      return FILE;
    }
    try {
      return BackendFamily.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown backend: " + value, ex);
    }
  }
}
