package ca.gc.cra.netstats.application.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netstats.testutil.FakeClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TtlCacheTest {
  private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

  private final FakeClock clock = new FakeClock(T0);
  private final TtlCache<Integer, String> cache = new TtlCache<>(Duration.ofSeconds(60), clock);

  @Test
  void entryIsServedWithinTtl() {
    cache.put(1, "summary", T0);
    clock.advance(Duration.ofSeconds(30));

    assertEquals(Optional.of("summary"), cache.get(1));
  }

  @Test
  void entryExpiresAfterTtl() {
    cache.put(1, "summary", T0);
    clock.advance(Duration.ofSeconds(61));

    assertTrue(cache.get(1).isEmpty());
  }

  @Test
  void entryExpiresExactlyAtTtl() {
    cache.put(1, "summary", T0);
    clock.advance(Duration.ofSeconds(60));

    assertTrue(cache.get(1).isEmpty());
  }

  @Test
  void invalidateDropsSingleKey() {
    cache.put(1, "a", T0);
    cache.put(2, "b", T0);

    cache.invalidate(1);

    assertTrue(cache.get(1).isEmpty());
    assertEquals(Optional.of("b"), cache.get(2));
  }

  @Test
  void invalidateAllDropsEverything() {
    cache.put(1, "a", T0);
    cache.put(2, "b", T0);

    cache.invalidateAll();

    assertEquals(0, cache.size());
  }

  @Test
  void putIfCurrentStoresWhenNothingIntervened() {
    long generation = cache.generation(1);

    assertTrue(cache.putIfCurrent(1, "a", T0, generation));
    assertEquals(Optional.of("a"), cache.get(1));
  }

  @Test
  void putIfCurrentRejectsValueComputedBeforeInvalidate() {
    long generation = cache.generation(1);
    cache.invalidate(1);

    assertFalse(cache.putIfCurrent(1, "stale", T0, generation));
    assertTrue(cache.get(1).isEmpty());
  }

  @Test
  void putIfCurrentRejectsValueComputedBeforeInvalidateAll() {
    long first = cache.generation(1);
    long second = cache.generation(2);
    cache.invalidateAll();

    assertFalse(cache.putIfCurrent(1, "stale", T0, first));
    assertFalse(cache.putIfCurrent(2, "stale", T0, second));
    assertEquals(0, cache.size());
  }

  @Test
  void invalidatingOneKeyLeavesOtherGenerationsAlone() {
    long generation = cache.generation(2);
    cache.invalidate(1);

    assertTrue(cache.putIfCurrent(2, "b", T0, generation));
  }

  @Test
  void keysAreIsolated() {
    cache.put(1, "a", T0);

    assertTrue(cache.get(2).isEmpty());
  }

  @Test
  void nonPositiveTtlIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TtlCache<Integer, String>(Duration.ZERO, clock));
  }
}
