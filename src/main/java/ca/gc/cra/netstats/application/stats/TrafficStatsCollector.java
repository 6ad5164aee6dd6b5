package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Traffic-by-address family, derived from the byte counters of the connection table.
 *
 * @since 0.1.0
 */
public final class TrafficStatsCollector implements StatsCollector<TrafficSummary> {
  private final TrafficStatsAggregator aggregator;

  public TrafficStatsCollector(TrafficStatsAggregator aggregator) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
  }

  @Override
  public String family() {
    return "traffic";
  }

  @Override
  public Optional<TrafficSummary> collect(DeviceSession session) throws IOException {
    return session.query(DeviceCommands.CONNECTIONS).map(aggregator::aggregate);
  }
}
