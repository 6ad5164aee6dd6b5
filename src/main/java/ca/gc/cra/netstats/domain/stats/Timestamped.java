package ca.gc.cra.netstats.domain.stats;

import java.time.Instant;

/**
 * Summary carrying the instant it was computed at.
 *
 * @since 0.1.0
 */
public interface Timestamped {
  /**
   * Returns when the summary was computed.
   *
   * @return computation instant; serialized as ISO-8601 by output adapters
   */
  Instant lastUpdated();
}
