package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.PoolRange;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> DHCP family: reads the lease table and measures it against the address pools.
 * <p><strong>Pools:</strong> statically configured pools win; otherwise the device's own pool list is read. Pool
 * rows whose {@code ranges} cannot be parsed are skipped with a warning.</p>
 *
 * @since 0.1.0
 */
public final class DhcpStatsCollector implements StatsCollector<LeaseSummary> {
  private static final Logger log = LoggerFactory.getLogger(DhcpStatsCollector.class);
  static final String POOL_NAME = "name";
  static final String POOL_RANGES = "ranges";

  private final DhcpStatsAggregator aggregator;
  private final List<PoolRange> configuredPools;

  /**
   * Creates a collector.
   *
   * @param aggregator lease aggregator
   * @param configuredPools static pool definitions; empty to discover pools from the device
   */
  public DhcpStatsCollector(DhcpStatsAggregator aggregator, List<PoolRange> configuredPools) {
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.configuredPools = List.copyOf(Objects.requireNonNull(configuredPools, "configuredPools"));
  }

  @Override
  public String family() {
    return "dhcp";
  }

  @Override
  public Optional<LeaseSummary> collect(DeviceSession session) throws IOException {
    Optional<List<RawRecord>> leases = session.query(DeviceCommands.DHCP_LEASES);
    if (leases.isEmpty()) {
      return Optional.empty();
    }
    Optional<List<PoolRange>> pools = configuredPools.isEmpty()
        ? session.query(DeviceCommands.IP_POOLS).map(DhcpStatsCollector::toPoolRanges)
        : Optional.of(configuredPools);
    return pools.map(definitions -> aggregator.aggregate(leases.get(), definitions));
  }

  static List<PoolRange> toPoolRanges(List<RawRecord> poolRecords) {
    List<PoolRange> ranges = new ArrayList<>();
    for (RawRecord pool : poolRecords) {
      Optional<String> name = pool.field(POOL_NAME);
      Optional<String> rangeText = pool.field(POOL_RANGES);
      if (name.isEmpty() || rangeText.isEmpty()) {
        log.debug("Skipping pool record without name or ranges: {}", pool);
        continue;
      }
      try {
        ranges.addAll(PoolRange.parse(name.get(), rangeText.get()));
      } catch (IllegalArgumentException ex) {
        log.warn("Skipping pool {} with unparseable ranges '{}': {}", name.get(), rangeText.get(), ex.getMessage());
      }
    }
    return ranges;
  }
}
