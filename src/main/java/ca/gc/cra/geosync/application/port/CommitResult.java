package ca.gc.cra.geosync.application.port;

/**
 * Summary of an applied commit.
 *
 * @param table table that was written
 * @param inserted rows appended
 * @param updated persisted rows replaced through the update mask
 * @param totalRows row count after the commit
 * @since 0.1.0
 */
public record CommitResult(String table, int inserted, int updated, int totalRows) {}
