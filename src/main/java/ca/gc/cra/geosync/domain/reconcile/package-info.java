/**
 * <strong>Purpose:</strong> Pure reconciliation of candidate rows against persisted rows.
 * <p>Produces an insert set, a row-aligned update mask, and the merged persisted table. No I/O happens here.</p>
 */
package ca.gc.cra.geosync.domain.reconcile;
