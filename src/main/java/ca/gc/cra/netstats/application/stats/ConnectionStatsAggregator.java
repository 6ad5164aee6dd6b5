package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.ClockPort;
import ca.gc.cra.netstats.domain.net.IpClassifier;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.net.ServicePort;
import ca.gc.cra.netstats.domain.net.ServiceRegistry;
import ca.gc.cra.netstats.domain.stats.AddressRank;
import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import ca.gc.cra.netstats.domain.stats.Percentages;
import ca.gc.cra.netstats.domain.stats.PortRank;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Reduces a connection-tracking snapshot into a {@link ConnectionSummary}.
 * <p><strong>Why:</strong> A router may track tens of thousands of flows; dashboards only need protocol totals,
 * top talkers, top ports and the internal/external split.</p>
 * <p><strong>Role:</strong> Application-layer aggregator invoked by the connections stats service.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bucket records by protocol; anything other than tcp/udp/icmp lands in {@code other}.</li>
 *   <li>Rank source and destination addresses (port suffix stripped) and {@code (dst-port, protocol)} pairs.</li>
 *   <li>Classify flows with both endpoints resolved as internal or external.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Single pass over the snapshot plus one stable sort per ranking.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionStatsAggregator {
  static final String PROTOCOL = "protocol";
  static final String SRC_ADDRESS = "src-address";
  static final String DST_ADDRESS = "dst-address";
  static final String DST_PORT = "dst-port";
  private static final String UNKNOWN_PROTOCOL = "unknown";

  private final ClockPort clock;
  private final int topN;
  private final ServiceLookupMode lookupMode;

  /**
   * Creates an aggregator producing top-10 rankings with port-only service lookup.
   *
   * @param clock source of the summary timestamp
   */
  public ConnectionStatsAggregator(ClockPort clock) {
    this(clock, 10, ServiceLookupMode.PORT);
  }

  /**
   * Creates an aggregator.
   *
   * @param clock source of the summary timestamp
   * @param topN maximum rows per ranking; must be positive
   * @param lookupMode how service names are resolved for port rows
   */
  public ConnectionStatsAggregator(ClockPort clock, int topN, ServiceLookupMode lookupMode) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lookupMode = Objects.requireNonNull(lookupMode, "lookupMode");
    if (topN <= 0) {
      throw new IllegalArgumentException("topN must be positive (was " + topN + ")");
    }
    this.topN = topN;
  }

  /**
   * Aggregates one snapshot.
   *
   * @param records connection-tracking entries in device order; individual fields may be missing
   * @return summary stamped with the current clock time
   */
  public ConnectionSummary aggregate(List<RawRecord> records) {
    Objects.requireNonNull(records, "records");
    long total = records.size();
    long tcp = 0;
    long udp = 0;
    long icmp = 0;
    long internal = 0;
    long external = 0;

    FrequencyTable<String> sources = new FrequencyTable<>();
    FrequencyTable<String> destinations = new FrequencyTable<>();
    FrequencyTable<PortKey> ports = new FrequencyTable<>();

    for (RawRecord record : records) {
      Optional<String> protocol = record.field(PROTOCOL).map(p -> p.toLowerCase(Locale.ROOT));
      switch (protocol.orElse("")) {
        case "tcp" -> tcp++;
        case "udp" -> udp++;
        case "icmp" -> icmp++;
        default -> {
          // counted as other
        }
      }

      String src = record.field(SRC_ADDRESS).map(IpClassifier::stripPort).orElse(null);
      String dst = record.field(DST_ADDRESS).map(IpClassifier::stripPort).orElse(null);
      if (src != null) {
        sources.increment(src);
      }
      if (dst != null) {
        destinations.increment(dst);
      }

      int port = parsePort(record.field(DST_PORT).orElse(null));
      if (port > 0) {
        ports.increment(new PortKey(port, protocol.orElse(UNKNOWN_PROTOCOL)));
      }

      if (src != null && dst != null) {
        if (IpClassifier.isPrivate(src) && IpClassifier.isPrivate(dst)) {
          internal++;
        } else {
          external++;
        }
      }
    }

    long other = total - tcp - udp - icmp;
    return new ConnectionSummary(
        total,
        total,
        tcp,
        udp,
        icmp,
        other,
        rankAddresses(sources, total),
        rankAddresses(destinations, total),
        rankPorts(ports, total),
        external,
        internal,
        clock.now());
  }

  private List<AddressRank> rankAddresses(FrequencyTable<String> table, long total) {
    List<AddressRank> rows = new ArrayList<>();
    for (FrequencyTable.Ranked<String> ranked : table.top(topN)) {
      rows.add(new AddressRank(ranked.key(), ranked.count(), Percentages.of(ranked.count(), total)));
    }
    return rows;
  }

  private List<PortRank> rankPorts(FrequencyTable<PortKey> table, long total) {
    List<PortRank> rows = new ArrayList<>();
    for (FrequencyTable.Ranked<PortKey> ranked : table.top(topN)) {
      PortKey key = ranked.key();
      rows.add(new PortRank(
          key.port(),
          key.protocol(),
          ranked.count(),
          Percentages.of(ranked.count(), total),
          serviceName(key)));
    }
    return rows;
  }

  private Optional<String> serviceName(PortKey key) {
    Optional<ServicePort> service = lookupMode == ServiceLookupMode.PORT_AND_PROTOCOL
        ? ServiceRegistry.lookup(key.port(), key.protocol())
        : ServiceRegistry.lookup(key.port());
    return service.map(ServicePort::name);
  }

  /** Returns the parsed port, or -1 when the field is absent or not a positive integer. */
  static int parsePort(String raw) {
    if (raw == null) {
      return -1;
    }
    try {
      int port = Integer.parseInt(raw.trim());
      return port > 0 ? port : -1;
    } catch (NumberFormatException ex) {
      return -1;
    }
  }

  private record PortKey(int port, String protocol) {}
}
