package ca.gc.cra.netstats.config;

import ca.gc.cra.netstats.application.cache.TtlCache;
import ca.gc.cra.netstats.application.port.ClockPort;
import ca.gc.cra.netstats.application.port.DeviceTransportPort;
import ca.gc.cra.netstats.application.port.MetricsPort;
import ca.gc.cra.netstats.application.stats.ConnectionStatsAggregator;
import ca.gc.cra.netstats.application.stats.ConnectionStatsCollector;
import ca.gc.cra.netstats.application.stats.DhcpStatsAggregator;
import ca.gc.cra.netstats.application.stats.DhcpStatsCollector;
import ca.gc.cra.netstats.application.stats.NetworkStatsUseCase;
import ca.gc.cra.netstats.application.stats.StatsService;
import ca.gc.cra.netstats.application.stats.TrafficStatsAggregator;
import ca.gc.cra.netstats.application.stats.TrafficStatsCollector;
import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import ca.gc.cra.netstats.infrastructure.transport.SnapshotDirectoryTransportAdapter;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the statistics use case to concrete adapters.
 * <p><strong>Role:</strong> Adapter composition root spanning transport, cache, aggregation and metrics.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create one {@link TtlCache} and {@link StatsService} per statistic family.</li>
 *   <li>Apply configured TTLs, ranking size, service lookup mode and DHCP pools.</li>
 *   <li>Expose shared adapters such as metrics and clock providers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods are not synchronized.</p>
 *
 * @since 0.1.0
 * @see NetworkStatsUseCase
 */
public final class CompositionRoot {
  private final StatsConfig config;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a root with explicit clock and metrics adapters.
   *
   * @param config engine settings
   * @param clock time source shared by caches and aggregators
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public CompositionRoot(StatsConfig config, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Builds the use case over the supplied transport.
   *
   * @param transport device transport shared by all families
   * @return wired use case with empty caches
   */
  public NetworkStatsUseCase networkStatsUseCase(DeviceTransportPort transport) {
    Objects.requireNonNull(transport, "transport");
    StatsService<ConnectionSummary> connections = new StatsService<>(
        new ConnectionStatsCollector(
            new ConnectionStatsAggregator(clock, config.topN(), config.serviceLookup())),
        transport,
        new TtlCache<>(config.connectionsTtl(), clock),
        metrics,
        config.singleFlight());
    StatsService<LeaseSummary> dhcp = new StatsService<>(
        new DhcpStatsCollector(new DhcpStatsAggregator(clock), config.dhcpPools()),
        transport,
        new TtlCache<>(config.dhcpTtl(), clock),
        metrics,
        config.singleFlight());
    StatsService<TrafficSummary> traffic = new StatsService<>(
        new TrafficStatsCollector(new TrafficStatsAggregator(clock, config.topN())),
        transport,
        new TtlCache<>(config.trafficTtl(), clock),
        metrics,
        config.singleFlight());
    return new NetworkStatsUseCase(connections, dhcp, traffic);
  }

  /**
   * Builds the use case over the snapshot directory configured under {@code snapshots}.
   *
   * @return wired use case
   * @throws IllegalArgumentException when no snapshot directory is configured
   */
  public NetworkStatsUseCase snapshotUseCase() {
    return networkStatsUseCase(new SnapshotDirectoryTransportAdapter(config.snapshots()
        .orElseThrow(() -> new IllegalArgumentException("snapshots directory is required"))));
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }
}
