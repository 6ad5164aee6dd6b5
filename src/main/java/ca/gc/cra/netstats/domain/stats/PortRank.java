package ca.gc.cra.netstats.domain.stats;

import java.util.Objects;
import java.util.Optional;

/**
 * One row of the top-N destination port ranking.
 *
 * @param port destination port (positive)
 * @param protocol protocol reported by the device for the connections counted here
 * @param connectionCount number of connections for the {@code (port, protocol)} pair
 * @param percentage share of all connections in the snapshot
 * @param serviceName well-known service label when the registry knows the port
 * @since 0.1.0
 */
public record PortRank(
    int port,
    String protocol,
    long connectionCount,
    double percentage,
    Optional<String> serviceName) {

  public PortRank {
    Objects.requireNonNull(protocol, "protocol");
    serviceName = serviceName == null ? Optional.empty() : serviceName;
  }
}
