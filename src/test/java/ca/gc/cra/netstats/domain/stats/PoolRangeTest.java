package ca.gc.cra.netstats.domain.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PoolRangeTest {

  @Test
  void sizeIsInclusive() {
    assertEquals(245, new PoolRange("lan", "192.168.88.10", "192.168.88.254").size());
    assertEquals(1, new PoolRange("single", "10.0.0.5", "10.0.0.5").size());
    assertEquals(512, new PoolRange("wide", "10.0.0.0", "10.0.1.255").size());
  }

  @Test
  void containsChecksBounds() {
    PoolRange pool = new PoolRange("lan", "192.168.88.10", "192.168.88.20");

    assertTrue(pool.contains("192.168.88.10"));
    assertTrue(pool.contains("192.168.88.20"));
    assertFalse(pool.contains("192.168.88.9"));
    assertFalse(pool.contains("192.168.88.21"));
    assertFalse(pool.contains("not-an-ip"));
  }

  @Test
  void invalidRangesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PoolRange("lan", "10.0.0.9", "10.0.0.1"));
    assertThrows(IllegalArgumentException.class, () -> new PoolRange("lan", "10.0.0", "10.0.0.1"));
  }

  @Test
  void parseReadsSpansAndSingleAddresses() {
    List<PoolRange> ranges = PoolRange.parse("dhcp", "10.0.0.10-10.0.0.50, 10.0.1.1");

    assertEquals(List.of(
        new PoolRange("dhcp", "10.0.0.10", "10.0.0.50"),
        new PoolRange("dhcp", "10.0.1.1", "10.0.1.1")), ranges);
  }

  @Test
  void parseRejectsEmptyDeclaration() {
    assertThrows(IllegalArgumentException.class, () -> PoolRange.parse("dhcp", " , "));
  }
}
