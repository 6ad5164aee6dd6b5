package ca.gc.cra.netstats.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final Set<String> FAMILIES = Set.of("all", "connections", "dhcp", "traffic");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    // a CLI pool definition replaces the whole YAML pool set rather than merging with it
    boolean cliDefinesPools = cliCopy.keySet().stream()
        .anyMatch(key -> key != null && key.startsWith(StatsConfig.POOL_PREFIX));
    if (cliDefinesPools) {
      merged.keySet().removeIf(key -> key.startsWith(StatsConfig.POOL_PREFIX));
    }

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"stats".equalsIgnoreCase(mode)) {
      return;
    }
    String family = trim(effective.get("family")).toLowerCase(Locale.ROOT);
    if (!family.isEmpty() && !FAMILIES.contains(family)) {
      throw new IllegalArgumentException("family must be one of all, connections, dhcp, traffic (was " + family + ")");
    }
    for (Map.Entry<String, String> entry : effective.entrySet()) {
      if (entry.getKey().startsWith(StatsConfig.POOL_PREFIX) && trim(entry.getValue()).isEmpty()) {
        throw new IllegalArgumentException(entry.getKey() + " must list at least one address range");
      }
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
