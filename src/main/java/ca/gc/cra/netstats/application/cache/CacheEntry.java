package ca.gc.cra.netstats.application.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * Cached value plus the instant it was computed at. Entries are replaced, never mutated.
 *
 * @param value cached summary
 * @param computedAt computation instant used for freshness checks
 * @param <V> cached value type
 * @since 0.1.0
 */
public record CacheEntry<V>(V value, Instant computedAt) {
  public CacheEntry {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(computedAt, "computedAt");
  }
}
