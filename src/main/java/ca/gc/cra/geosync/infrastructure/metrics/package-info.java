/**
 * OpenTelemetry metrics adapter and its SDK bootstrap.
 */
package ca.gc.cra.geosync.infrastructure.metrics;
