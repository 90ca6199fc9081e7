package ca.gc.cra.geosync.application.port;

import ca.gc.cra.geosync.domain.record.Table;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads one published source file into a table of records without geometry.
 *
 * @since 0.1.0
 */
public interface RecordExtractor {
  /**
   * Extracts every row of a source file.
   *
   * @param file source file
   * @return extracted rows
   * @throws IOException when the file cannot be read or is malformed
   */
  Table extract(Path file) throws IOException;

  /**
   * Returns whether this extractor understands the file's format.
   *
   * @param file candidate file
   * @return {@code true} when {@link #extract(Path)} applies
   */
  boolean supports(Path file);
}
