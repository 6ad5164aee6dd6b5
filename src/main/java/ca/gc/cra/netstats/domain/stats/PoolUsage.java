package ca.gc.cra.netstats.domain.stats;

import java.util.Objects;

/**
 * Occupancy of a single pool range.
 *
 * @param name pool name
 * @param start first address of the range
 * @param end last address of the range
 * @param size number of addresses in the range
 * @param used leases whose address falls within the range
 * @param availablePercentage {@code used / size * 100}, zero-guarded
 * @since 0.1.0
 */
public record PoolUsage(String name, String start, String end, long size, long used, double availablePercentage) {
  public PoolUsage {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
  }
}
