package ca.gc.cra.netstats.infrastructure.json;

import ca.gc.cra.netstats.domain.stats.AddressRank;
import ca.gc.cra.netstats.domain.stats.ConnectionSummary;
import ca.gc.cra.netstats.domain.stats.IpTraffic;
import ca.gc.cra.netstats.domain.stats.LeaseSummary;
import ca.gc.cra.netstats.domain.stats.PoolUsage;
import ca.gc.cra.netstats.domain.stats.PortRank;
import ca.gc.cra.netstats.domain.stats.TrafficSummary;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders summaries in the JSON shape consumed by the dashboard.
 * <p><strong>Contract:</strong> {@code lastUpdated} is an ISO-8601 instant; {@code serviceName} is omitted when the
 * port is not well known; field names follow the dashboard's camelCase spelling.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; {@link JsonFactory} is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class SummaryJsonWriter {
  private final JsonFactory factory = new JsonFactory();

  public String write(ConnectionSummary summary) {
    Objects.requireNonNull(summary, "summary");
    return render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("totalConnections", summary.totalConnections());
      gen.writeNumberField("activeConnections", summary.activeConnections());
      gen.writeNumberField("tcpConnections", summary.tcpConnections());
      gen.writeNumberField("udpConnections", summary.udpConnections());
      gen.writeNumberField("icmpConnections", summary.icmpConnections());
      gen.writeNumberField("otherConnections", summary.otherConnections());
      writeAddresses(gen, "top10Sources", summary.top10Sources());
      writeAddresses(gen, "top10Destinations", summary.top10Destinations());
      gen.writeArrayFieldStart("top10Ports");
      for (PortRank port : summary.top10Ports()) {
        gen.writeStartObject();
        gen.writeNumberField("port", port.port());
        gen.writeStringField("protocol", port.protocol());
        gen.writeNumberField("connectionCount", port.connectionCount());
        gen.writeNumberField("percentage", port.percentage());
        if (port.serviceName().isPresent()) {
          gen.writeStringField("serviceName", port.serviceName().get());
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeNumberField("externalConnections", summary.externalConnections());
      gen.writeNumberField("internalConnections", summary.internalConnections());
      gen.writeStringField("lastUpdated", summary.lastUpdated().toString());
      gen.writeEndObject();
    });
  }

  public String write(LeaseSummary summary) {
    Objects.requireNonNull(summary, "summary");
    return render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("totalLeases", summary.totalLeases());
      gen.writeNumberField("activeLeases", summary.activeLeases());
      gen.writeNumberField("usagePercentage", summary.usagePercentage());
      gen.writeNumberField("poolSize", summary.poolSize());
      gen.writeNumberField("availableIPs", summary.availableIPs());
      gen.writeArrayFieldStart("poolRanges");
      for (PoolUsage pool : summary.poolRanges()) {
        gen.writeStartObject();
        gen.writeStringField("name", pool.name());
        gen.writeStringField("start", pool.start());
        gen.writeStringField("end", pool.end());
        gen.writeNumberField("size", pool.size());
        gen.writeNumberField("used", pool.used());
        gen.writeNumberField("availablePercentage", pool.availablePercentage());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeStringField("lastUpdated", summary.lastUpdated().toString());
      gen.writeEndObject();
    });
  }

  public String write(TrafficSummary summary) {
    Objects.requireNonNull(summary, "summary");
    return render(gen -> {
      gen.writeStartObject();
      gen.writeNumberField("totalConnections", summary.totalConnections());
      gen.writeNumberField("totalBytes", summary.totalBytes());
      gen.writeArrayFieldStart("topTalkers");
      for (IpTraffic row : summary.topTalkers()) {
        gen.writeStartObject();
        gen.writeStringField("ipAddress", row.ipAddress());
        gen.writeNumberField("txBytes", row.txBytes());
        gen.writeNumberField("rxBytes", row.rxBytes());
        gen.writeNumberField("totalBytes", row.totalBytes());
        gen.writeNumberField("connections", row.connections());
        gen.writeNumberField("percentage", row.percentage());
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeStringField("lastUpdated", summary.lastUpdated().toString());
      gen.writeEndObject();
    });
  }

  private static void writeAddresses(JsonGenerator gen, String field, List<AddressRank> rows) throws IOException {
    gen.writeArrayFieldStart(field);
    for (AddressRank row : rows) {
      gen.writeStartObject();
      gen.writeStringField("ipAddress", row.ipAddress());
      gen.writeNumberField("connectionCount", row.connectionCount());
      gen.writeNumberField("percentage", row.percentage());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private String render(Body body) {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = factory.createGenerator(out)) {
      body.write(gen);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render summary JSON", ex);
    }
    return out.toString();
  }

  @FunctionalInterface
  private interface Body {
    void write(JsonGenerator gen) throws IOException;
  }
}
