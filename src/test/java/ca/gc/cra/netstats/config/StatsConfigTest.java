package ca.gc.cra.netstats.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.application.stats.ServiceLookupMode;
import ca.gc.cra.netstats.domain.stats.PoolRange;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatsConfigTest {

  @Test
  void defaultsMatchEmbeddedDefaults() {
    StatsConfig fromDefaults = StatsConfig.fromMap(DefaultsForMode.asFlatMap("stats"));

    assertEquals(StatsConfig.defaults(), fromDefaults);
    assertEquals(Duration.ofSeconds(60), fromDefaults.connectionsTtl());
    assertEquals(10, fromDefaults.topN());
    assertTrue(fromDefaults.singleFlight());
    assertEquals(ServiceLookupMode.PORT, fromDefaults.serviceLookup());
    assertTrue(fromDefaults.snapshots().isEmpty());
  }

  @Test
  void overridesAreApplied() {
    StatsConfig config = StatsConfig.fromMap(Map.of(
        "connections.cacheTtlSeconds", "15",
        "dhcp.cacheTtlSeconds", "120",
        "topN", "25",
        "singleFlight", "off",
        "serviceLookup", "port-and-protocol",
        "snapshots", "snap"));

    assertEquals(Duration.ofSeconds(15), config.connectionsTtl());
    assertEquals(Duration.ofSeconds(120), config.dhcpTtl());
    assertEquals(Duration.ofSeconds(60), config.trafficTtl());
    assertEquals(25, config.topN());
    assertFalse(config.singleFlight());
    assertEquals(ServiceLookupMode.PORT_AND_PROTOCOL, config.serviceLookup());
    assertEquals(Path.of("snap").toAbsolutePath().normalize(), config.snapshots().orElseThrow());
  }

  @Test
  void poolsAreParsedInNameOrder() {
    StatsConfig config = StatsConfig.fromMap(Map.of(
        "dhcp.pools.wifi", "10.1.0.10-10.1.0.20",
        "dhcp.pools.lan", "10.0.0.10-10.0.0.20,10.0.0.30"));

    assertEquals(List.of(
        new PoolRange("lan", "10.0.0.10", "10.0.0.20"),
        new PoolRange("lan", "10.0.0.30", "10.0.0.30"),
        new PoolRange("wifi", "10.1.0.10", "10.1.0.20")), config.dhcpPools());
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> StatsConfig.fromMap(Map.of("topN", "0")));
    assertThrows(IllegalArgumentException.class, () -> StatsConfig.fromMap(Map.of("topN", "ten")));
    assertThrows(IllegalArgumentException.class,
        () -> StatsConfig.fromMap(Map.of("traffic.cacheTtlSeconds", "0")));
    assertThrows(IllegalArgumentException.class, () -> StatsConfig.fromMap(Map.of("singleFlight", "maybe")));
    assertThrows(IllegalArgumentException.class, () -> StatsConfig.fromMap(Map.of("serviceLookup", "dns")));
    assertThrows(IllegalArgumentException.class,
        () -> StatsConfig.fromMap(Map.of("dhcp.pools.lan", "10.0.0.20-10.0.0.10")));
  }
}
