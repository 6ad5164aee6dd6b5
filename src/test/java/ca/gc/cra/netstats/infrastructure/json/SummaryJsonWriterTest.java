package ca.gc.cra.netstats.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.domain.stats.AddressRank;
import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import ca.gc.cra.netstats.domain.stats.IpTraffic;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.PoolUsage;
import ca.gc.cra.netstats.domain.stats.PortRank;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SummaryJsonWriterTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final SummaryJsonWriter writer = new SummaryJsonWriter();

  @Test
  void connectionSummaryUsesDashboardFieldNames() {
    ConnectionSummary summary = new ConnectionSummary(
        2, 2, 1, 1, 0, 0,
        List.of(new AddressRank("10.0.0.1", 2, 100.0)),
        List.of(new AddressRank("8.8.8.8", 1, 50.0)),
        List.of(
            new PortRank(53, "udp", 1, 50.0, Optional.of("DNS")),
            new PortRank(40000, "tcp", 1, 50.0, Optional.empty())),
        1, 1, NOW);

    String json = writer.write(summary);

    assertTrue(json.startsWith("{\"totalConnections\":2,\"activeConnections\":2,\"tcpConnections\":1"));
    assertTrue(json.contains("\"top10Sources\":[{\"ipAddress\":\"10.0.0.1\",\"connectionCount\":2,"
        + "\"percentage\":100.0}]"));
    assertTrue(json.contains("{\"port\":53,\"protocol\":\"udp\",\"connectionCount\":1,\"percentage\":50.0,"
        + "\"serviceName\":\"DNS\"}"));
    assertTrue(json.contains("{\"port\":40000,\"protocol\":\"tcp\",\"connectionCount\":1,\"percentage\":50.0}"));
    assertTrue(json.endsWith("\"lastUpdated\":\"2024-05-01T12:00:00Z\"}"));
  }

  @Test
  void leaseSummaryIncludesPoolRows() {
    LeaseSummary summary = new LeaseSummary(
        3, 2, 20.0, 10, 8,
        List.of(new PoolUsage("lan", "10.0.0.1", "10.0.0.10", 10, 3, 30.0)),
        NOW);

    String json = writer.write(summary);

    assertEquals("{\"totalLeases\":3,\"activeLeases\":2,\"usagePercentage\":20.0,\"poolSize\":10,"
        + "\"availableIPs\":8,\"poolRanges\":[{\"name\":\"lan\",\"start\":\"10.0.0.1\",\"end\":\"10.0.0.10\","
        + "\"size\":10,\"used\":3,\"availablePercentage\":30.0}],\"lastUpdated\":\"2024-05-01T12:00:00Z\"}", json);
  }

  @Test
  void trafficSummaryListsTalkers() {
    TrafficSummary summary = new TrafficSummary(
        1, 300, List.of(new IpTraffic("10.0.0.1", 100, 200, 300, 1, 100.0)), NOW);

    String json = writer.write(summary);

    assertTrue(json.contains("\"topTalkers\":[{\"ipAddress\":\"10.0.0.1\",\"txBytes\":100,\"rxBytes\":200,"
        + "\"totalBytes\":300,\"connections\":1,\"percentage\":100.0}]"));
    assertFalse(json.contains("\n"));
  }
}
