package ca.gc.cra.netstats.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "device=3", " snapshots = ./snap ", "otelResourceAttributes=a=b,c=d", "dhcp.pools.lan=10.0.0.1-10.0.0.9"});

    assertEquals("3", map.get("device"));
    assertEquals("./snap", map.get("snapshots"));
    assertEquals("a=b,c=d", map.get("otelResourceAttributes"));
    assertEquals("10.0.0.1-10.0.0.9", map.get("dhcp.pools.lan"));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void malformedArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"device"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"device="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=3"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"dev ice=3"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"device=3\u0007x"}));
  }
}
