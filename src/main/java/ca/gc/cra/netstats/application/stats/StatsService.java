package ca.gc.cra.netstats.application.stats;

import ca.gc.cra.netstats.application.cache.TtlCache;
import ca.gc.cra.netstats.application.port.DeviceSession;
import ca.gc.cra.netstats.application.port.DeviceTransportPort;
import ca.gc.cra.netstats.application.port.MetricsPort;
import ca.gc.cra.netstats.domain.stats.Timestamped;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Serves one statistic family per device, computing it from the device only when the cached
 * summary has gone stale.
 * <p><strong>Why:</strong> Device round-trips are slow and expensive; dashboards poll far more often.</p>
 * <p><strong>Role:</strong> Application-layer use case; one instance per family (connections, DHCP, traffic).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer from the {@link TtlCache} while the entry is fresh.</li>
 *   <li>On a miss, connect, query and aggregate, then store the result.</li>
 *   <li>Turn transport failures and malformed answers into an empty result with a warning; never throw.</li>
 *   <li>Discard a result whose device cache was cleared while it was being computed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent requests. With single-flight enabled, concurrent misses for
 * the same device wait on a per-device lock and reuse the summary computed by the first caller.</p>
 * <p><strong>Observability:</strong> Emits {@code stats.<family>.cache.hit|miss}, {@code .device.unavailable},
 * {@code .response.malformed}, {@code .aggregate.failed}, {@code .latencyNanos}; logs carry {@code device.id} in
 * the MDC.</p>
 *
 * @param <S> summary type
 * @since 0.1.0
 */
public final class StatsService<S extends Timestamped> {
  private static final Logger log = LoggerFactory.getLogger(StatsService.class);
  static final String MDC_DEVICE_ID = "device.id";

  private final StatsCollector<S> collector;
  private final DeviceTransportPort transport;
  private final TtlCache<Integer, S> cache;
  private final MetricsPort metrics;
  private final boolean singleFlight;
  private final ConcurrentMap<Integer, Object> deviceLocks = new ConcurrentHashMap<>();
  private final String metricPrefix;

  /**
   * Creates a service.
   *
   * @param collector family-specific query and aggregation
   * @param transport device transport
   * @param cache per-device summary cache owned by this service
   * @param metrics metrics sink
   * @param singleFlight whether concurrent misses for one device share a single computation
   */
  public StatsService(
      StatsCollector<S> collector,
      DeviceTransportPort transport,
      TtlCache<Integer, S> cache,
      MetricsPort metrics,
      boolean singleFlight) {
    this.collector = Objects.requireNonNull(collector, "collector");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.singleFlight = singleFlight;
    this.metricPrefix = "stats." + collector.family();
  }

  /**
   * Returns the family's summary for a device.
   *
   * @param deviceId managed device identifier
   * @return fresh cached or newly computed summary; empty when the device could not be read
   */
  public Optional<S> getStats(int deviceId) {
    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_DEVICE_ID, Integer.toString(deviceId))) {
      Optional<S> cached = cache.get(deviceId);
      if (cached.isPresent()) {
        metrics.increment(metricPrefix + ".cache.hit");
        return cached;
      }
      if (!singleFlight) {
        return computeAndCache(deviceId);
      }
      synchronized (deviceLocks.computeIfAbsent(deviceId, id -> new Object())) {
        Optional<S> raced = cache.get(deviceId);
        if (raced.isPresent()) {
          metrics.increment(metricPrefix + ".cache.hit");
          return raced;
        }
        return computeAndCache(deviceId);
      }
    }
  }

  /**
   * Drops the cached summary for a device so the next request recomputes it.
   *
   * @param deviceId managed device identifier
   */
  public void clearCache(int deviceId) {
    cache.invalidate(deviceId);
    log.debug("Cleared {} cache for device {}", collector.family(), deviceId);
  }

  /**
   * Drops every cached summary of this family.
   */
  public void clearAllCache() {
    cache.invalidateAll();
    log.debug("Cleared {} cache for all devices", collector.family());
  }

  private Optional<S> computeAndCache(int deviceId) {
    metrics.increment(metricPrefix + ".cache.miss");
    long started = System.nanoTime();
    long generation = cache.generation(deviceId);

    Optional<DeviceSession> session = openSession(deviceId);
    if (session.isEmpty()) {
      metrics.increment(metricPrefix + ".device.unavailable");
      return Optional.empty();
    }

    Optional<S> summary;
    try {
      summary = collector.collect(session.get());
    } catch (IOException ex) {
      metrics.increment(metricPrefix + ".device.unavailable");
      log.warn("Failed to query {} statistics from device {}: {}", collector.family(), deviceId, ex.toString());
      return Optional.empty();
    } catch (RuntimeException ex) {
      metrics.increment(metricPrefix + ".aggregate.failed");
      log.error("Unexpected failure computing {} statistics for device {}", collector.family(), deviceId, ex);
      return Optional.empty();
    }

    if (summary.isEmpty()) {
      metrics.increment(metricPrefix + ".response.malformed");
      log.warn("Device {} returned a malformed {} response; statistics unavailable", deviceId, collector.family());
      return Optional.empty();
    }

    S value = summary.get();
    metrics.observe(metricPrefix + ".latencyNanos", System.nanoTime() - started);
    if (cache.putIfCurrent(deviceId, value, value.lastUpdated(), generation)) {
      log.debug("Computed {} statistics for device {}", collector.family(), deviceId);
    } else {
      log.debug("Cache for device {} cleared while computing {} statistics; result not cached",
          deviceId, collector.family());
    }
    return summary;
  }

  private Optional<DeviceSession> openSession(int deviceId) {
    boolean connected;
    try {
      connected = transport.connect(deviceId);
    } catch (IOException ex) {
      log.warn("Unable to connect to device {} for {} statistics: {}", deviceId, collector.family(), ex.toString());
      return Optional.empty();
    } catch (RuntimeException ex) {
      log.warn("Transport failure connecting to device {} for {} statistics", deviceId, collector.family(), ex);
      return Optional.empty();
    }
    if (!connected) {
      log.warn("Unable to connect to device {} for {} statistics", deviceId, collector.family());
      return Optional.empty();
    }
    Optional<DeviceSession> session;
    try {
      session = transport.getSession(deviceId);
    } catch (RuntimeException ex) {
      log.warn("Transport failure opening session on device {} for {} statistics", deviceId, collector.family(), ex);
      return Optional.empty();
    }
    if (session.isEmpty()) {
      log.warn("No session available for device {} after connect", deviceId);
    }
    return session;
  }
}
