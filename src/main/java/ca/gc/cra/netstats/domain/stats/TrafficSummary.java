package ca.gc.cra.netstats.domain.stats;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Per-address traffic ranking derived from connection-tracking byte counters.
 *
 * @param totalConnections records in the snapshot
 * @param totalBytes sum of {@code orig-bytes} and {@code repl-bytes} over all records
 * @param topTalkers addresses ranked by total bytes
 * @param lastUpdated computation instant
 * @since 0.1.0
 */
public record TrafficSummary(
    long totalConnections,
    long totalBytes,
    List<IpTraffic> topTalkers,
    Instant lastUpdated) implements Timestamped {

  public TrafficSummary {
    topTalkers = List.copyOf(Objects.requireNonNull(topTalkers, "topTalkers"));
    Objects.requireNonNull(lastUpdated, "lastUpdated");
  }
}
