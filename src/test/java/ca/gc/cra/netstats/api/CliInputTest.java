package ca.gc.cra.netstats.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"device=1", "--VERBOSE", "--pretty", "family=dhcp"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--pretty"));
    assertArrayEquals(new String[] {"device=1", "family=dhcp"}, input.keyValueArgs());
  }

  @Test
  void helpAliasesAreRecognised() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
