package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.ClockPort;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.Percentages;
import ca.gc.cra.netstats.domain.stats.PoolRange;
import ca.gc.cra.netstats.domain.stats.PoolUsage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Measures a DHCP lease table against the configured address pools.
 * <p><strong>Role:</strong> Application-layer aggregator invoked by the DHCP stats service.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Count all leases and the subset currently bound to a client.</li>
 *   <li>Attribute each lease to every pool range containing its address.</li>
 *   <li>Derive usage and availability figures without ever dividing by zero.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls.</p>
 *
 * @since 0.1.0
 */
public final class DhcpStatsAggregator {
  static final String ADDRESS = "address";
  static final String STATUS = "status";
  static final String DISABLED = "disabled";
  private static final String BOUND = "bound";

  private final ClockPort clock;

  /**
   * Creates an aggregator.
   *
   * @param clock source of the summary timestamp
   */
  public DhcpStatsAggregator(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Aggregates a lease table.
   *
   * @param leaseRecords lease rows as returned by the device
   * @param poolDefinitions pool ranges to measure against; may be empty
   * @return summary stamped with the current clock time
   */
  public LeaseSummary aggregate(List<RawRecord> leaseRecords, List<PoolRange> poolDefinitions) {
    Objects.requireNonNull(leaseRecords, "leaseRecords");
    Objects.requireNonNull(poolDefinitions, "poolDefinitions");

    long[] used = new long[poolDefinitions.size()];
    long active = 0;
    for (RawRecord lease : leaseRecords) {
      if (isActive(lease)) {
        active++;
      }
      String address = lease.field(ADDRESS).orElse(null);
      if (address == null) {
        continue;
      }
      for (int i = 0; i < poolDefinitions.size(); i++) {
        if (poolDefinitions.get(i).contains(address)) {
          used[i]++;
        }
      }
    }

    long poolSize = 0;
    List<PoolUsage> rows = new ArrayList<>(poolDefinitions.size());
    for (int i = 0; i < poolDefinitions.size(); i++) {
      PoolRange pool = poolDefinitions.get(i);
      long size = pool.size();
      poolSize += size;
      rows.add(new PoolUsage(pool.name(), pool.start(), pool.end(), size, used[i], Percentages.of(used[i], size)));
    }

    return new LeaseSummary(
        leaseRecords.size(),
        active,
        Percentages.of(active, poolSize),
        poolSize,
        Math.max(0, poolSize - active),
        rows,
        clock.now());
  }

  private static boolean isActive(RawRecord lease) {
    boolean disabled = lease.field(DISABLED).map(Boolean::parseBoolean).orElse(false);
    return !disabled && lease.field(STATUS).map(BOUND::equalsIgnoreCase).orElse(false);
  }
}
