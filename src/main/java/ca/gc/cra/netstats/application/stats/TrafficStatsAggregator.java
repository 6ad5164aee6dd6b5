package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.port.ClockPort;
import ca.gc.cra.netstats.domain.net.IpClassifier;
import ca.gc.cra.netstats.domain.net.RawRecord;
import ca.gc.cra.netstats.domain.stats.IpTraffic;
import ca.gc.cra.netstats.domain.stats.Percentages;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Attributes connection byte counters to addresses and ranks the heaviest talkers.
 *
 * <p>Source addresses accumulate {@code orig-bytes} as transmitted bytes, destination addresses accumulate
 * {@code repl-bytes} as received bytes. Counters that are missing or not numeric count as zero. Ties keep first-seen
 * order.</p>
 *
 * @since 0.1.0
 */
public final class TrafficStatsAggregator {
  static final String ORIG_BYTES = "orig-bytes";
  static final String REPL_BYTES = "repl-bytes";

  private final ClockPort clock;
  private final int topN;

  public TrafficStatsAggregator(ClockPort clock, int topN) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (topN <= 0) {
      throw new IllegalArgumentException("topN must be positive (was " + topN + ")");
    }
    this.topN = topN;
  }

  public TrafficSummary aggregate(List<RawRecord> records) {
    Objects.requireNonNull(records, "records");
    Map<String, Totals> byAddress = new LinkedHashMap<>();
    long totalBytes = 0;
    for (RawRecord record : records) {
      long orig = parseBytes(record.field(ORIG_BYTES).orElse(null));
      long repl = parseBytes(record.field(REPL_BYTES).orElse(null));
      totalBytes += orig + repl;

      String src = record.field(ConnectionStatsAggregator.SRC_ADDRESS).map(IpClassifier::stripPort).orElse(null);
      if (src != null) {
        Totals totals = byAddress.computeIfAbsent(src, k -> new Totals());
        totals.tx += orig;
        totals.connections++;
      }
      String dst = record.field(ConnectionStatsAggregator.DST_ADDRESS).map(IpClassifier::stripPort).orElse(null);
      if (dst != null) {
        Totals totals = byAddress.computeIfAbsent(dst, k -> new Totals());
        totals.rx += repl;
        totals.connections++;
      }
    }

    List<IpTraffic> rows = new ArrayList<>(byAddress.size());
    for (Map.Entry<String, Totals> entry : byAddress.entrySet()) {
      Totals totals = entry.getValue();
      long sum = totals.tx + totals.rx;
      rows.add(new IpTraffic(
          entry.getKey(), totals.tx, totals.rx, sum, totals.connections, Percentages.of(sum, totalBytes)));
    }
    return new TrafficSummary(
        records.size(), totalBytes, Ranking.top(rows, IpTraffic::totalBytes, topN), clock.now());
  }

  private static long parseBytes(String raw) {
    if (raw == null) {
      return 0;
    }
    try {
      return Math.max(0, Long.parseLong(raw.trim()));
    } catch (NumberFormatException ex) {
      return 0;
    }
  }

  private static final class Totals {
    private long tx;
    private long rx;
    private long connections;
  }
}
