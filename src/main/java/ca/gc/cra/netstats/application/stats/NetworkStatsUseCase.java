package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Inbound entry point used by the presentation layer.
 * <p><strong>Role:</strong> Application-layer facade over the per-family {@link StatsService} instances.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; delegates to thread-safe services.</p>
 *
 * @since 0.1.0
 */
public final class NetworkStatsUseCase {
  private final StatsService<ConnectionSummary> connections;
  private final StatsService<LeaseSummary> dhcp;
  private final StatsService<TrafficSummary> traffic;

  public NetworkStatsUseCase(
      StatsService<ConnectionSummary> connections,
      StatsService<LeaseSummary> dhcp,
      StatsService<TrafficSummary> traffic) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.dhcp = Objects.requireNonNull(dhcp, "dhcp");
    this.traffic = Objects.requireNonNull(traffic, "traffic");
  }

  /**
   * Returns connection-tracking statistics.
   *
   * @param deviceId managed device identifier
   * @return summary, or empty when the device could not be read
   */
  public Optional<ConnectionSummary> getConnectionStats(int deviceId) {
    return connections.getStats(deviceId);
  }

  /**
   * Returns DHCP lease statistics.
   *
   * @param deviceId managed device identifier
   * @return summary, or empty when the device could not be read
   */
  public Optional<LeaseSummary> getDhcpStats(int deviceId) {
    return dhcp.getStats(deviceId);
  }

  /**
   * Returns per-address traffic statistics.
   *
   * @param deviceId managed device identifier
   * @return summary, or empty when the device could not be read
   */
  public Optional<TrafficSummary> getTrafficStats(int deviceId) {
    return traffic.getStats(deviceId);
  }

  /**
   * Forces every family to recompute on the next request for the device, e.g. after a configuration change on it.
   *
   * @param deviceId managed device identifier
   */
  public void clearCache(int deviceId) {
    for (StatsService<?> service : services()) {
      service.clearCache(deviceId);
    }
  }

  /** Forces every family to recompute on the next request for any device. */
  public void clearAllCache() {
    for (StatsService<?> service : services()) {
      service.clearAllCache();
    }
  }

  private List<StatsService<?>> services() {
    return List.of(connections, dhcp, traffic);
  }
}
