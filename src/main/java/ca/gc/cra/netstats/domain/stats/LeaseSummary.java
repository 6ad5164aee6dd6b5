package ca.gc.cra.netstats.domain.stats;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Summary of a DHCP lease table measured against the configured pools.
 * <p><strong>Invariants:</strong> {@code usagePercentage = activeLeases / poolSize * 100} (zero when the pool
 * size is zero, never above 100); {@code availableIPs = max(0, poolSize - activeLeases)}.</p>
 *
 * @param totalLeases every lease record in the table
 * @param activeLeases leases currently bound to a client
 * @param usagePercentage active leases as a share of all pool addresses
 * @param poolSize sum of all pool range sizes
 * @param availableIPs pool addresses not taken by an active lease
 * @param poolRanges per-range occupancy, in pool declaration order
 * @param lastUpdated computation instant
 * @since 0.1.0
 */
public record LeaseSummary(
    long totalLeases,
    long activeLeases,
    double usagePercentage,
    long poolSize,
    long availableIPs,
    List<PoolUsage> poolRanges,
    Instant lastUpdated) implements Timestamped {

  public LeaseSummary {
    poolRanges = List.copyOf(Objects.requireNonNull(poolRanges, "poolRanges"));
    Objects.requireNonNull(lastUpdated, "lastUpdated");
  }
}
