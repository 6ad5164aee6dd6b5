package ca.gc.cra.netstats.application.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.PoolRange;
import ca.gc.cra.netstats.testutil.FakeClock;
import ca.gc.cra.netstats.testutil.ScriptedTransport;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DhcpStatsCollectorTest {
  private static final int DEVICE = 7;

  private final DhcpStatsAggregator aggregator =
      new DhcpStatsAggregator(new FakeClock(Instant.parse("2024-05-01T12:00:00Z")));
  private final ScriptedTransport transport = new ScriptedTransport()
      .answer(DEVICE, DeviceCommands.DHCP_LEASES, List.of(
          RawRecord.of("address", "192.168.88.10", "status", "bound"),
          RawRecord.of("address", "10.0.0.1", "status", "bound")));

  @Test
  void configuredPoolsSkipDeviceDiscovery() throws IOException {
    DhcpStatsCollector collector = new DhcpStatsCollector(
        aggregator, List.of(new PoolRange("lan", "192.168.88.10", "192.168.88.19")));

    LeaseSummary summary = collector.collect(session()).orElseThrow();

    assertEquals(10, summary.poolSize());
    assertEquals(0, transport.queryCount(DeviceCommands.IP_POOLS));
  }

  @Test
  void devicePoolsAreUsedWhenNoneConfigured() throws IOException {
    transport.answer(DEVICE, DeviceCommands.IP_POOLS, List.of(
        RawRecord.of("name", "lan", "ranges", "192.168.88.10-192.168.88.19,192.168.88.30"),
        RawRecord.of("name", "broken", "ranges", "not-a-range"),
        RawRecord.of("ranges", "10.0.0.1-10.0.0.9")));
    DhcpStatsCollector collector = new DhcpStatsCollector(aggregator, List.of());

    LeaseSummary summary = collector.collect(session()).orElseThrow();

    assertEquals(2, summary.poolRanges().size());
    assertEquals(11, summary.poolSize());
    assertEquals(1, summary.poolRanges().get(0).used());
  }

  @Test
  void malformedLeaseTableIsUnavailable() throws IOException {
    transport.answerMalformed(DEVICE, DeviceCommands.DHCP_LEASES);
    DhcpStatsCollector collector = new DhcpStatsCollector(aggregator, List.of());

    assertTrue(collector.collect(session()).isEmpty());
  }

  @Test
  void malformedPoolTableIsUnavailable() throws IOException {
    transport.answerMalformed(DEVICE, DeviceCommands.IP_POOLS);
    DhcpStatsCollector collector = new DhcpStatsCollector(aggregator, List.of());

    Optional<LeaseSummary> summary = collector.collect(session());

    assertTrue(summary.isEmpty());
  }

  private DeviceSession session() throws IOException {
    assertTrue(transport.connect(DEVICE));
    return transport.getSession(DEVICE).orElseThrow();
  }
}
