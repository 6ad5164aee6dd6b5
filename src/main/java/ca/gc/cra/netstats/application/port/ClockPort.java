package ca.gc.cra.netstats.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to aggregators and caches.
 * <p><strong>Why:</strong> Summary freshness and cache expiry must be testable without real delays.</p>
 * <p><strong>Role:</strong> Domain port consumed by application services.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads happen on every request
 * thread.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.netstats.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z, subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return instant derived from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
