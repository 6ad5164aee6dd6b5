package ca.gc.cra.netstats.domain.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ServiceRegistryTest {

  @Test
  void wellKnownPortsResolve() {
    assertEquals("HTTPS", ServiceRegistry.lookup(443).orElseThrow().name());
    assertEquals("DNS", ServiceRegistry.lookup(53).orElseThrow().name());
    assertEquals("udp", ServiceRegistry.lookup(53).orElseThrow().protocol());
    assertEquals("RDP", ServiceRegistry.lookup(3389).orElseThrow().name());
  }

  @Test
  void unknownPortHasNoService() {
    assertTrue(ServiceRegistry.lookup(12345).isEmpty());
  }

  @Test
  void protocolAwareLookupRequiresMatchingProtocol() {
    assertTrue(ServiceRegistry.lookup(53, "tcp").isEmpty());
    assertEquals("DNS", ServiceRegistry.lookup(53, "UDP").orElseThrow().name());
    assertTrue(ServiceRegistry.lookup(53, null).isEmpty());
  }

  @Test
  void registryHoldsTwentyOneEntries() {
    int known = 0;
    for (int port = 1; port <= 65535; port++) {
      if (ServiceRegistry.lookup(port).isPresent()) {
        known++;
      }
    }
    assertEquals(21, known);
  }
}
