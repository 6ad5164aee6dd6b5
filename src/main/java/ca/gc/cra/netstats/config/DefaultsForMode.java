package ca.gc.cra.netstats.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each NETSTATS CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; {@link StatsConfig#defaults()} holds the
 * same values in typed form.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code stats})
   * @return unmodifiable map of default key/value pairs as strings
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "stats" -> buildStatsDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildStatsDefaults() {
    StatsConfig defaults = StatsConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("connections.cacheTtlSeconds", Long.toString(defaults.connectionsTtl().toSeconds()));
    map.put("dhcp.cacheTtlSeconds", Long.toString(defaults.dhcpTtl().toSeconds()));
    map.put("traffic.cacheTtlSeconds", Long.toString(defaults.trafficTtl().toSeconds()));
    map.put("topN", Integer.toString(defaults.topN()));
    map.put("singleFlight", Boolean.toString(defaults.singleFlight()));
    map.put("serviceLookup", defaults.serviceLookup().name());
    map.put("family", "all");
    return Map.copyOf(map);
  }
}
