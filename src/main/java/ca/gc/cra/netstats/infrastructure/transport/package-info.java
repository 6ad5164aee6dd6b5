/**
 * Device transport adapters implementing {@link ca.gc.cra.netstats.application.port.DeviceTransportPort}.
 */
package ca.gc.cra.netstats.infrastructure.transport;
