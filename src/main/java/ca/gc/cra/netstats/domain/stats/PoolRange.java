package ca.gc.cra.netstats.domain.stats;

import ca.gc.cra.netstats.domain.net.IpClassifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Named, inclusive IPv4 range from which a DHCP server allocates leases.
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name pool name as configured on the device or in YAML
 * @param start first address of the range
 * @param end last address of the range (inclusive)
 * @since 0.1.0
 */
public record PoolRange(String name, String start, String end) {

  public PoolRange {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    long first = IpClassifier.toLong(start)
        .orElseThrow(() -> new IllegalArgumentException("invalid pool start address: " + start));
    long last = IpClassifier.toLong(end)
        .orElseThrow(() -> new IllegalArgumentException("invalid pool end address: " + end));
    if (last < first) {
      throw new IllegalArgumentException("pool " + name + " ends before it starts: " + start + "-" + end);
    }
  }

  /**
   * Number of addresses in the range.
   *
   * @return {@code end - start + 1}
   */
  public long size() {
    return lastAddress() - firstAddress() + 1;
  }

  /**
   * Tests whether an address belongs to the range.
   *
   * @param address dotted quad; malformed input never matches
   * @return {@code true} when the address lies within {@code [start, end]}
   */
  public boolean contains(String address) {
    OptionalLong value = IpClassifier.toLong(address);
    if (value.isEmpty()) {
      return false;
    }
    long v = value.getAsLong();
    return v >= firstAddress() && v <= lastAddress();
  }

  /**
   * Parses the RouterOS {@code ranges} notation, e.g. {@code 10.0.0.10-10.0.0.50,10.0.1.1}.
   *
   * @param name pool name applied to every parsed range
   * @param ranges comma-separated list of {@code start-end} spans or single addresses
   * @return parsed ranges in declaration order
   * @throws IllegalArgumentException when any span is malformed
   */
  public static List<PoolRange> parse(String name, String ranges) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(ranges, "ranges");
    List<PoolRange> parsed = new ArrayList<>();
    for (String token : ranges.split(",")) {
      String span = token.trim();
      if (span.isEmpty()) {
        continue;
      }
      int dash = span.indexOf('-');
      if (dash < 0) {
        parsed.add(new PoolRange(name, span, span));
      } else {
        parsed.add(new PoolRange(name, span.substring(0, dash).trim(), span.substring(dash + 1).trim()));
      }
    }
    if (parsed.isEmpty()) {
      throw new IllegalArgumentException("pool " + name + " declares no ranges");
    }
    return List.copyOf(parsed);
  }

  private long firstAddress() {
    return IpClassifier.toLong(start).orElse(0);
  }

  private long lastAddress() {
    return IpClassifier.toLong(end).orElse(0);
  }
}
