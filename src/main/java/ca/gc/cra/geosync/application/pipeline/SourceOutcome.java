package ca.gc.cra.geosync.application.pipeline;

/**
 * Counts for one source file processed inside a unit.
 *
 * @param source source name
 * @param table destination table
 * @param extracted rows read from the file
 * @param accepted rows handed to reconciliation
 * @param inserted rows appended
 * @param updated persisted rows flagged for update
 * @param changed flagged rows whose content actually changed
 * @param committed whether a commit was applied
 * @since 0.1.0
 */
public record SourceOutcome(
    String source,
    String table,
    int extracted,
    int accepted,
    int inserted,
    int updated,
    int changed,
    boolean committed) {}
