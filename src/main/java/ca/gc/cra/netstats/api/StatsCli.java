package ca.gc.cra.netstats.api;

import ca.gc.cra.netstats.application.stats.NetworkStatsUseCase;
import ca.gc.cra.netstats.config.CompositionRoot;
import ca.gc.cra.netstats.config.ConfigMerger;
import ca.gc.cra.netstats.config.DefaultsForMode;
import ca.gc.cra.netstats.config.StatsConfig;
import ca.gc.cra.netstats.config.YamlConfigLoader;
import ca.gc.cra.netstats.infrastructure.json.SummaryJsonWriter;
import ca.gc.cra.netstats.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.netstats.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.netstats.logging.LoggingConfigurator;
import ca.gc.cra.netstats.validation.Numbers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for computing device statistics from exported snapshot tables.
 *
 * <p>Prints one JSON document per requested family, one per line, in the order connections, dhcp, traffic.</p>
 *
 * @since 0.1.0
 */
public final class StatsCli {
  private static final Logger log = LoggerFactory.getLogger(StatsCli.class);
  private static final String MODE = "stats";
  private static final String SUMMARY_USAGE =
      "usage: stats snapshots=DIR device=ID [family=all|connections|dhcp|traffic] [config=FILE] "
          + "[topN=N] [serviceLookup=PORT|PORT_AND_PROTOCOL] [dhcp.pools.NAME=START-END[,..]] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      NETSTATS statistics

      Usage:
        stats snapshots=./snapshots device=1 [options]

      Required:
        snapshots=DIR            Directory holding <device>/<command>.json snapshot files
        device=ID                Managed device identifier (sub-directory of snapshots)

      Optional (validated):
        family=all|connections|dhcp|traffic  Families to print (default all)
        config=FILE              YAML file with common/stats sections
        topN=N                   Rows per ranking, 1-1000 (default 10)
        serviceLookup=MODE       PORT (default) or PORT_AND_PROTOCOL
        dhcp.pools.NAME=RANGES   Pool ranges such as 192.168.88.10-192.168.88.254; overrides device pools
        singleFlight=true|false  Share one computation between concurrent misses (default true)
        metricsExporter=otlp|none  Configure metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Exit codes:
        0 all requested families printed, 6 at least one family unavailable
      """;

  private StatsCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the stats CLI logic using structured logging and exit codes.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for stats CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, MODE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    int deviceId;
    String family;
    StatsConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          MODE, yamlConfig, kv, DefaultsForMode.asFlatMap(MODE), log::warn);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      deviceId = (int) Numbers.parseRange(
          "device", ConfigCliUtils.extractRequired(configInputs, "device"), 0, Integer.MAX_VALUE);
      ConfigCliUtils.extractRequired(configInputs, "snapshots");
      family = configInputs.getOrDefault("family", "all").trim().toLowerCase(Locale.ROOT);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = StatsConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid stats arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path snapshots = config.snapshots().orElseThrow();
    if (!Files.isDirectory(snapshots)) {
      log.error("Snapshot directory does not exist: {}", snapshots);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    log.info(
        "Computing {} statistics for device {} from {} (topN={}, serviceLookup={}, metricsExporter={})",
        family, deviceId, snapshots, config.topN(), config.serviceLookup(), effective.get("metricsExporter"));

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      NetworkStatsUseCase useCase =
          new CompositionRoot(config, new SystemClockAdapter(), metrics).snapshotUseCase();
      return printFamilies(useCase, deviceId, family);
    } catch (IllegalArgumentException ex) {
      log.error("Stats configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure computing statistics", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode printFamilies(NetworkStatsUseCase useCase, int deviceId, String family) {
    SummaryJsonWriter writer = new SummaryJsonWriter();
    List<String> unavailable = new ArrayList<>();
    if (wants(family, "connections")) {
      print("connections", useCase.getConnectionStats(deviceId), writer::write, unavailable);
    }
    if (wants(family, "dhcp")) {
      print("dhcp", useCase.getDhcpStats(deviceId), writer::write, unavailable);
    }
    if (wants(family, "traffic")) {
      print("traffic", useCase.getTrafficStats(deviceId), writer::write, unavailable);
    }
    if (!unavailable.isEmpty()) {
      log.warn("Statistics unavailable for device {}: {}", deviceId, unavailable);
      return ExitCode.STATS_UNAVAILABLE;
    }
    return ExitCode.SUCCESS;
  }

  private static <S> void print(
      String name, Optional<S> summary, Function<S, String> render, List<String> unavailable) {
    if (summary.isPresent()) {
      CliPrinter.println(render.apply(summary.get()));
    } else {
      unavailable.add(name);
    }
  }

  private static boolean wants(String requested, String family) {
    return requested.equals("all") || requested.equals(family);
  }
}
