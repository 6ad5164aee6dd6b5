package ca.gc.cra.netstats.config;

import ca.gc.cra.netstats.application.stats.ServiceLookupMode;
import ca.gc.cra.netstats.domain.stats.PoolRange;
import ca.gc.cra.netstats.validation.Numbers;
import ca.gc.cra.netstats.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Immutable settings for the statistics engine.
 * <p><strong>Role:</strong> Produced from the merged flat configuration map and consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Keys:</strong> {@code connections.cacheTtlSeconds}, {@code dhcp.cacheTtlSeconds},
 * {@code traffic.cacheTtlSeconds}, {@code topN}, {@code singleFlight}, {@code serviceLookup},
 * {@code dhcp.pools.<name>}, {@code snapshots}.</p>
 *
 * @param connectionsTtl cache lifetime of connection summaries
 * @param dhcpTtl cache lifetime of DHCP lease summaries
 * @param trafficTtl cache lifetime of traffic summaries
 * @param topN maximum rows per ranking
 * @param singleFlight whether concurrent misses for one device share a computation
 * @param serviceLookup how port rows resolve service names
 * @param dhcpPools operator-defined pools; empty means read pools from the device
 * @param snapshots snapshot directory for the file-backed transport, if configured
 * @since 0.1.0
 */
public record StatsConfig(
    Duration connectionsTtl,
    Duration dhcpTtl,
    Duration trafficTtl,
    int topN,
    boolean singleFlight,
    ServiceLookupMode serviceLookup,
    List<PoolRange> dhcpPools,
    Optional<Path> snapshots) {
  static final long DEFAULT_TTL_SECONDS = 60;
  static final int DEFAULT_TOP_N = 10;
  static final long MAX_TTL_SECONDS = 86_400;
  static final int MAX_TOP_N = 1_000;
  static final String POOL_PREFIX = "dhcp.pools.";

  public StatsConfig {
    Objects.requireNonNull(connectionsTtl, "connectionsTtl");
    Objects.requireNonNull(dhcpTtl, "dhcpTtl");
    Objects.requireNonNull(trafficTtl, "trafficTtl");
    Objects.requireNonNull(serviceLookup, "serviceLookup");
    Numbers.requireRange("topN", topN, 1, MAX_TOP_N);
    dhcpPools = List.copyOf(Objects.requireNonNull(dhcpPools, "dhcpPools"));
    snapshots = Objects.requireNonNull(snapshots, "snapshots");
  }

  /**
   * Returns the built-in settings: one minute TTLs, top 10, single-flight on, port-only lookup.
   *
   * @return default configuration
   */
  public static StatsConfig defaults() {
    Duration ttl = Duration.ofSeconds(DEFAULT_TTL_SECONDS);
    return new StatsConfig(
        ttl, ttl, ttl, DEFAULT_TOP_N, true, ServiceLookupMode.PORT, List.of(), Optional.empty());
  }

  /**
   * Builds configuration from a flat key/value map, falling back to {@link #defaults()} for absent keys.
   *
   * @param options merged configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static StatsConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    StatsConfig defaults = defaults();

    Duration connectionsTtl = parseTtl(options, "connections.cacheTtlSeconds", defaults.connectionsTtl());
    Duration dhcpTtl = parseTtl(options, "dhcp.cacheTtlSeconds", defaults.dhcpTtl());
    Duration trafficTtl = parseTtl(options, "traffic.cacheTtlSeconds", defaults.trafficTtl());

    int topN = optionalString(options.get("topN"))
        .map(raw -> (int) Numbers.parseRange("topN", raw, 1, MAX_TOP_N))
        .orElse(defaults.topN());
    boolean singleFlight = parseBoolean("singleFlight", options.get("singleFlight"), defaults.singleFlight());
    ServiceLookupMode lookup = ServiceLookupMode.from(options.get("serviceLookup"));
    List<PoolRange> pools = parsePools(options);
    Optional<Path> snapshots = optionalString(options.get("snapshots")).map(raw -> parsePath("snapshots", raw));

    return new StatsConfig(connectionsTtl, dhcpTtl, trafficTtl, topN, singleFlight, lookup, pools, snapshots);
  }

  private static Duration parseTtl(Map<String, String> options, String key, Duration fallback) {
    return optionalString(options.get(key))
        .map(raw -> Duration.ofSeconds(Numbers.parseRange(key, raw, 1, MAX_TTL_SECONDS)))
        .orElse(fallback);
  }

  private static List<PoolRange> parsePools(Map<String, String> options) {
    // sorted so pool order does not depend on map iteration order
    Map<String, String> byName = new TreeMap<>();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (key != null && key.startsWith(POOL_PREFIX)) {
        String name = Strings.requireNonBlank(key, key.substring(POOL_PREFIX.length()));
        byName.put(name, Strings.requireNonBlank(key, entry.getValue() == null ? "" : entry.getValue()));
      }
    }
    List<PoolRange> pools = new ArrayList<>();
    for (Map.Entry<String, String> entry : byName.entrySet()) {
      pools.addAll(PoolRange.parse(entry.getKey(), entry.getValue()));
    }
    return pools;
  }

  private static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + value + ")");
    };
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static Path parsePath(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    try {
      return Path.of(sanitized).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
