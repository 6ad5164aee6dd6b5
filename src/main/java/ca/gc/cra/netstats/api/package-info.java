/**
 * CLI entry points that bootstrap NETSTATS statistics runs.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging and telemetry,
 * and invokes the statistics use case.</p>
 * <p><strong>Output:</strong> Result documents go to stdout; diagnostics go through SLF4J to stderr.</p>
 */
package ca.gc.cra.netstats.api;
