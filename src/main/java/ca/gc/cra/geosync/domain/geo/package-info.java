/**
 * Point construction, axis-order validation, and region filtering on JTS geometry.
 */
package ca.gc.cra.geosync.domain.geo;
