/**
 * Metrics adapters that bridge NETSTATS ports to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and support concurrent metric updates.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code stats.*} namespace.</p>
 */
package ca.gc.cra.netstats.infrastructure.metrics;
