package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.domain.stats.Timestamped;
import java.io.IOException;
import java.util.Optional;

/**
 * Queries a device session for one statistic family and aggregates the answer.
 *
 * @param <S> summary type produced by the family
 * @since 0.1.0
 */
public interface StatsCollector<S extends Timestamped> {
  /**
   * Returns the family name used in logs and metric keys (e.g. {@code connections}).
   *
   * @return stable, lowercase family name
   */
  String family();

  /**
   * Runs the family's queries and aggregates the result.
   *
   * @param session open device session
   * @return summary, or empty when the device answered with something other than a record sequence
   * @throws IOException when a query fails at the transport level
   */
  Optional<S> collect(DeviceSession session) throws IOException;
}
