/**
 * <strong>Purpose:</strong> Sync workflow over units of published files.
 * <p>Units are processed in name order; spatial sources run before related tables in each unit.</p>
 */
package ca.gc.cra.geosync.application.pipeline;
