/**
 * Adapter implementations of the NETSTATS ports: clocks, metrics, device transports and JSON codecs.
 */
package ca.gc.cra.netstats.infrastructure;
