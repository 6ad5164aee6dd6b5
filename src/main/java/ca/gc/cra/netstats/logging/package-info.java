/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity at CLI startup.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; device identifiers travel in the
 * {@code device.id} MDC key set by the stats services.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netstats.logging;
