package ca.gc.cra.netstats.application.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.PoolRange;
import ca.gc.cra.netstats.domain.stats.PoolUsage;
import ca.gc.cra.netstats.testutil.FakeClock;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class DhcpStatsAggregatorTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final DhcpStatsAggregator aggregator = new DhcpStatsAggregator(new FakeClock(NOW));

  @Test
  void countsActiveLeasesAgainstPools() {
    List<RawRecord> leases = List.of(
        RawRecord.of("address", "192.168.88.10", "status", "bound"),
        RawRecord.of("address", "192.168.88.11", "status", "bound"),
        RawRecord.of("address", "192.168.88.12", "status", "waiting"),
        RawRecord.of("address", "192.168.88.13", "status", "bound", "disabled", "true"),
        RawRecord.of("address", "10.9.9.9", "status", "bound"));
    List<PoolRange> pools = List.of(new PoolRange("lan", "192.168.88.10", "192.168.88.19"));

    LeaseSummary summary = aggregator.aggregate(leases, pools);

    assertEquals(5, summary.totalLeases());
    assertEquals(3, summary.activeLeases());
    assertEquals(10, summary.poolSize());
    assertEquals(30.0, summary.usagePercentage());
    assertEquals(7, summary.availableIPs());
    assertEquals(List.of(new PoolUsage("lan", "192.168.88.10", "192.168.88.19", 10, 4, 40.0)),
        summary.poolRanges());
    assertEquals(NOW, summary.lastUpdated());
  }

  @Test
  void noPoolsGivesZeroUsageWithoutDividing() {
    List<RawRecord> leases = List.of(RawRecord.of("address", "10.0.0.1", "status", "bound"));

    LeaseSummary summary = aggregator.aggregate(leases, List.of());

    assertEquals(1, summary.activeLeases());
    assertEquals(0, summary.poolSize());
    assertEquals(0.0, summary.usagePercentage());
    assertEquals(0, summary.availableIPs());
    assertTrue(summary.poolRanges().isEmpty());
  }

  @Test
  void availableAddressesNeverNegative() {
    List<RawRecord> leases = List.of(
        RawRecord.of("address", "10.0.0.1", "status", "bound"),
        RawRecord.of("address", "10.0.0.2", "status", "bound"),
        RawRecord.of("address", "10.0.0.3", "status", "bound"));
    List<PoolRange> pools = List.of(new PoolRange("tiny", "10.0.0.1", "10.0.0.2"));

    LeaseSummary summary = aggregator.aggregate(leases, pools);

    assertEquals(0, summary.availableIPs());
    assertEquals(100.0, summary.usagePercentage());
  }

  @Test
  void overlappingPoolsEachCountTheLease() {
    List<RawRecord> leases = List.of(RawRecord.of("address", "10.0.0.5", "status", "bound"));
    List<PoolRange> pools = List.of(
        new PoolRange("a", "10.0.0.1", "10.0.0.10"),
        new PoolRange("b", "10.0.0.5", "10.0.0.6"));

    LeaseSummary summary = aggregator.aggregate(leases, pools);

    assertEquals(1, summary.poolRanges().get(0).used());
    assertEquals(1, summary.poolRanges().get(1).used());
    assertEquals(12, summary.poolSize());
  }

  @Test
  void leasesWithoutAddressCountOnlyGlobally() {
    List<RawRecord> leases = List.of(RawRecord.of("status", "bound"));
    List<PoolRange> pools = List.of(new PoolRange("lan", "10.0.0.1", "10.0.0.4"));

    LeaseSummary summary = aggregator.aggregate(leases, pools);

    assertEquals(1, summary.totalLeases());
    assertEquals(0, summary.poolRanges().get(0).used());
  }
}
