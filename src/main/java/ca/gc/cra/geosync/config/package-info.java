/**
 * YAML and CLI configuration, the source catalog, and the composition root.
 */
package ca.gc.cra.geosync.config;
