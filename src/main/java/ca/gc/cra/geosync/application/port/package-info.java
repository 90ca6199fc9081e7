/**
 * Ports the sync workflow depends on: extraction, storage, region lookup, and metrics.
 */
package ca.gc.cra.geosync.application.port;
