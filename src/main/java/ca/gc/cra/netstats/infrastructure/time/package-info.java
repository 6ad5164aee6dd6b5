/**
 * Clock adapters implementing {@link ca.gc.cra.netstats.application.port.ClockPort}.
 */
package ca.gc.cra.netstats.infrastructure.time;
