package ca.gc.cra.netstats.application.cache;

import ca.gc.cra.netstats.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Keyed cache that serves a value only while it is younger than a fixed time-to-live.
 * <p><strong>Why:</strong> Dashboard requests arrive far more often than a device can be polled; a short freshness
 * window collapses them onto one computed summary per device.</p>
 * <p><strong>Role:</strong> Application-layer component owned by a single stats service.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Serve entries for which {@code now - computedAt < ttl}; report everything else as a miss.</li>
 *   <li>Replace entries atomically so a reader never observes a half-written value.</li>
 *   <li>Drop entries only on explicit invalidation or replacement; there is no background sweep.</li>
 *   <li>Track a per-key generation so a value computed before an invalidation is never stored after it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Backed by a {@link ConcurrentHashMap}; all operations are safe for concurrent
 * use. Invalidation and conditional stores are serialized on the cache instance.</p>
 * <p><strong>Performance:</strong> O(1) per operation; capacity grows with the number of managed devices.</p>
 *
 * @param <K> key type, typically the device identifier
 * @param <V> cached value type
 * @since 0.1.0
 */
public final class TtlCache<K, V> {
  private final ConcurrentMap<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
  private final ConcurrentMap<K, AtomicLong> generations = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final ClockPort clock;

  /**
   * Creates a cache with the supplied freshness window.
   *
   * @param ttl time-to-live; must be positive
   * @param clock time source used for freshness checks
   * @throws IllegalArgumentException if {@code ttl} is zero or negative
   */
  public TtlCache(Duration ttl, ClockPort clock) {
    this.ttl = Objects.requireNonNull(ttl, "ttl");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be positive (was " + ttl + ")");
    }
  }

  /**
   * Returns the cached value when it is still fresh.
   *
   * @param key cache key
   * @return value computed less than {@code ttl} ago, or empty on a miss
   */
  public Optional<V> get(K key) {
    CacheEntry<V> entry = entries.get(key);
    if (entry == null || !isFresh(entry, clock.now())) {
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  /**
   * Stores a value, replacing any previous entry for the key.
   *
   * @param key cache key
   * @param value computed value; must not be {@code null}
   * @param computedAt instant the value was computed at
   */
  public synchronized void put(K key, V value, Instant computedAt) {
    Objects.requireNonNull(key, "key");
    entries.put(key, new CacheEntry<>(value, computedAt));
  }

  /**
   * Returns the key's current generation. Capture it before computing a value and hand it to
   * {@link #putIfCurrent(Object, Object, Instant, long)}.
   *
   * @param key cache key
   * @return generation, advanced by every invalidation covering the key
   */
  public long generation(K key) {
    return counter(key).get();
  }

  /**
   * Stores a value only if the key has not been invalidated since {@code generation} was read.
   *
   * @param key cache key
   * @param value computed value; must not be {@code null}
   * @param computedAt instant the value was computed at
   * @param generation value of {@link #generation(Object)} taken before the computation started
   * @return {@code true} if stored; {@code false} if an invalidation intervened
   */
  public synchronized boolean putIfCurrent(K key, V value, Instant computedAt, long generation) {
    Objects.requireNonNull(key, "key");
    if (counter(key).get() != generation) {
      return false;
    }
    entries.put(key, new CacheEntry<>(value, computedAt));
    return true;
  }

  /**
   * Removes the entry for a key so the next lookup misses.
   *
   * @param key cache key
   */
  public synchronized void invalidate(K key) {
    counter(key).incrementAndGet();
    entries.remove(key);
  }

  /**
   * Removes every entry.
   */
  public synchronized void invalidateAll() {
    for (AtomicLong counter : generations.values()) {
      counter.incrementAndGet();
    }
    entries.clear();
  }

  /**
   * Returns the number of stored entries, fresh or not.
   *
   * @return entry count
   */
  public int size() {
    return entries.size();
  }

  private AtomicLong counter(K key) {
    return generations.computeIfAbsent(key, k -> new AtomicLong());
  }

  private boolean isFresh(CacheEntry<V> entry, Instant now) {
    return Duration.between(entry.computedAt(), now).compareTo(ttl) < 0;
  }
}
