package ca.gc.cra.netstats.domain.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class PercentagesTest {

  @Test
  void zeroTotalYieldsZero() {
    assertEquals(0.0, Percentages.of(5, 0));
    assertEquals(0.0, Percentages.of(0, 0));
  }

  @Test
  void resultIsClampedToHundred() {
    assertEquals(100.0, Percentages.of(7, 5));
    assertEquals(50.0, Percentages.of(1, 2));
  }
}
