package ca.gc.cra.netstats.application.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import ca.gc.cra.netstats.testutil.FakeClock;
import ca.gc.cra.netstats.testutil.ScriptedTransport;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TrafficStatsCollectorTest {
  private static final int DEVICE = 4;

  private final TrafficStatsCollector collector = new TrafficStatsCollector(
      new TrafficStatsAggregator(new FakeClock(Instant.parse("2024-05-01T12:00:00Z")), 10));
  private final ScriptedTransport transport = new ScriptedTransport();

  @Test
  void familyNameIsTraffic() {
    assertEquals("traffic", collector.family());
  }

  @Test
  void derivesTrafficFromConnectionTable() throws IOException {
    transport.answer(DEVICE, DeviceCommands.CONNECTIONS, List.of(
        RawRecord.of("src-address", "192.168.88.2:51000", "dst-address", "8.8.8.8:443",
            "orig-bytes", "100", "repl-bytes", "400")));

    TrafficSummary summary = collector.collect(session()).orElseThrow();

    assertEquals(1, summary.totalConnections());
    assertEquals(500, summary.totalBytes());
    assertEquals(1, transport.queryCount(DeviceCommands.CONNECTIONS));
  }

  @Test
  void malformedTableIsUnavailable() throws IOException {
    transport.answerMalformed(DEVICE, DeviceCommands.CONNECTIONS);

    assertTrue(collector.collect(session()).isEmpty());
  }

  private DeviceSession session() throws IOException {
    assertTrue(transport.connect(DEVICE));
    return transport.getSession(DEVICE).orElseThrow();
  }
}
