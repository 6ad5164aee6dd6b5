package ca.gc.cra.netstats.domain.stats;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Bounded summary of one connection-tracking snapshot.
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>{@code tcp + udp + icmp + other == totalConnections}.</li>
 *   <li>{@code internal + external} equals the number of records whose source and destination both resolved.</li>
 *   <li>{@code activeConnections == totalConnections}; the tracking table lists only live entries.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param totalConnections records in the snapshot
 * @param activeConnections same as {@code totalConnections}
 * @param tcpConnections records with protocol {@code tcp}
 * @param udpConnections records with protocol {@code udp}
 * @param icmpConnections records with protocol {@code icmp}
 * @param otherConnections every remaining record, including those without a protocol
 * @param top10Sources source addresses ranked by connection count
 * @param top10Destinations destination addresses ranked by connection count
 * @param top10Ports destination {@code (port, protocol)} pairs ranked by connection count
 * @param externalConnections resolved pairs where at least one side is public
 * @param internalConnections resolved pairs where both sides are private
 * @param lastUpdated computation instant
 * @since 0.1.0
 */
public record ConnectionSummary(
    long totalConnections,
    long activeConnections,
    long tcpConnections,
    long udpConnections,
    long icmpConnections,
    long otherConnections,
    List<AddressRank> top10Sources,
    List<AddressRank> top10Destinations,
    List<PortRank> top10Ports,
    long externalConnections,
    long internalConnections,
    Instant lastUpdated) implements Timestamped {

  public ConnectionSummary {
    top10Sources = List.copyOf(Objects.requireNonNull(top10Sources, "top10Sources"));
    top10Destinations = List.copyOf(Objects.requireNonNull(top10Destinations, "top10Destinations"));
    top10Ports = List.copyOf(Objects.requireNonNull(top10Ports, "top10Ports"));
    Objects.requireNonNull(lastUpdated, "lastUpdated");
  }
}
