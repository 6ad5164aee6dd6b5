package ca.gc.cra.netstats.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.netstats.application.port.MetricsPort;
import ca.gc.cra.netstats.application.stats.NetworkStatsUseCase;
import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import ca.gc.cra.netstats.testutil.FakeClock;
import ca.gc.cra.netstats.testutil.RecordingMetrics;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void snapshotUseCaseHonoursConfiguredTtlAndTopN() throws IOException {
    Path device = Files.createDirectories(tempDir.resolve("1"));
    Files.writeString(device.resolve("ip_firewall_connection_print.json"), """
        [
          {"protocol": "tcp", "src-address": "10.0.0.1:1", "dst-address": "1.1.1.1:443", "dst-port": "443"},
          {"protocol": "tcp", "src-address": "10.0.0.2:1", "dst-address": "1.1.1.1:443", "dst-port": "443"}
        ]
        """);
    StatsConfig config = StatsConfig.fromMap(Map.of(
        "snapshots", tempDir.toString(),
        "topN", "1",
        "connections.cacheTtlSeconds", "10"));
    FakeClock clock = new FakeClock(Instant.parse("2024-05-01T12:00:00Z"));
    RecordingMetrics metrics = new RecordingMetrics();

    NetworkStatsUseCase useCase = new CompositionRoot(config, clock, metrics).snapshotUseCase();
    ConnectionSummary first = useCase.getConnectionStats(1).orElseThrow();
    clock.advance(Duration.ofSeconds(9));
    assertSame(first, useCase.getConnectionStats(1).orElseThrow());
    clock.advance(Duration.ofSeconds(2));
    useCase.getConnectionStats(1);

    assertEquals(1, first.top10Sources().size());
    assertEquals(2, metrics.counter("stats.connections.cache.miss"));
    assertEquals(1, metrics.counter("stats.connections.cache.hit"));
  }

  @Test
  void snapshotUseCaseRequiresDirectory() {
    CompositionRoot root = new CompositionRoot(StatsConfig.defaults(), new FakeClock(Instant.EPOCH), null);

    assertSame(MetricsPort.NO_OP, root.metrics());
    assertThrows(IllegalArgumentException.class, root::snapshotUseCase);
  }
}
