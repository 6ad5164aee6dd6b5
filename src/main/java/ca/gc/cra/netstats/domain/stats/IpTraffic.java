package ca.gc.cra.netstats.domain.stats;

import java.util.Objects;

/**
 * Byte totals attributed to one address.
 *
 * @param ipAddress address without port
 * @param txBytes bytes sent while the address was the connection source ({@code orig-bytes})
 * @param rxBytes bytes received while the address was the connection destination ({@code repl-bytes})
 * @param totalBytes {@code txBytes + rxBytes}
 * @param connections connections the address took part in, on either side
 * @param percentage share of all bytes in the snapshot
 * @since 0.1.0
 */
public record IpTraffic(
    String ipAddress,
    long txBytes,
    long rxBytes,
    long totalBytes,
    long connections,
    double percentage) {

  public IpTraffic {
    Objects.requireNonNull(ipAddress, "ipAddress");
  }
}
