/**
 * Record store adapters.
 */
package ca.gc.cra.geosync.infrastructure.store;
