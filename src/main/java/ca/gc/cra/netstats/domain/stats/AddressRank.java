package ca.gc.cra.netstats.domain.stats;

import java.util.Objects;

/**
 * One row of a top-N address ranking.
 *
 * @param ipAddress address without port
 * @param connectionCount number of connections seen for the address on this side
 * @param percentage share of all connections in the snapshot
 * @since 0.1.0
 */
public record AddressRank(String ipAddress, long connectionCount, double percentage) {
  public AddressRank {
    Objects.requireNonNull(ipAddress, "ipAddress");
  }
}
