package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection-tracking family: one print of the firewall connection table.
 *
 * @since 0.1.0
 */
public final class ConnectionStatsCollector implements StatsCollector<ConnectionSummary> {
  private final ConnectionStatsAggregator aggregator;

  public ConnectionStatsCollector(ConnectionStatsAggregator aggregator) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
  }

  @Override
  public String family() {
    return "connections";
  }

  @Override
  public Optional<ConnectionSummary> collect(DeviceSession session) throws IOException {
    return session.query(DeviceCommands.CONNECTIONS).map(aggregator::aggregate);
  }
}
