/**
 * <strong>Purpose:</strong> Ports defining the device -> aggregate -> cache workflow contracts.
 * <p><strong>Pipeline role:</strong> Domain layer; adapters implement these interfaces to integrate devices,
 * clocks and metrics backends.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netstats.application.port;
