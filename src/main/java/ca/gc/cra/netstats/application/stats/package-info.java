/**
 * <strong>Purpose:</strong> Aggregation of device snapshots into bounded summaries and their cached delivery.
 * <p><strong>Pipeline role:</strong> Application layer; collectors query {@code DeviceSession}s, aggregators reduce
 * the rows, {@link ca.gc.cra.netstats.application.stats.StatsService} caches the result per device.</p>
 * <p><strong>Concurrency:</strong> Aggregators are stateless; services are safe for concurrent requests.</p>
 * <p><strong>Observability:</strong> Metrics follow {@code stats.<family>.*}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.netstats.application.stats;
