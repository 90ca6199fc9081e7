/**
 * Command-line entry points: argument parsing, configuration assembly, and exit codes.
 */
package ca.gc.cra.geosync.api;
